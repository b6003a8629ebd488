package com.novafmt.ops;

/**
 * 指令种类
 */
public enum OpKind {
    LITERAL,
    TOKEN_ANCHOR,
    OPEN_GROUP,
    CLOSE_GROUP,
    BREAK,
    INDENT,
    DEDENT
}
