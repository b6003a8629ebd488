package com.novafmt;

/**
 * 语法错误：输入无法解析
 */
public class SyntaxException extends FormatterException {

    public SyntaxException(String message, int line, int column) {
        super(message, line, column);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.SYNTAX;
    }
}
