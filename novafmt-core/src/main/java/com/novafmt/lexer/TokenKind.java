package com.novafmt.lexer;

/**
 * 词法单元的大类：代码、空白、注释，以及零宽的文件结束标记
 */
public enum TokenKind {
    CODE,
    WHITESPACE,
    COMMENT,
    EOF
}
