package com.novafmt;

/**
 * 输入中出现了保留的哨兵字符 U+0003
 */
public class UnsupportedInputException extends FormatterException {
    private final int offset;

    public UnsupportedInputException(String message, int offset, int line, int column) {
        super(message, line, column);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.UNSUPPORTED_INPUT;
    }
}
