package com.novafmt;

/**
 * 格式化异常基类：携带错误类别与源码位置（行、列均从 1 开始）
 */
public abstract class FormatterException extends RuntimeException {
    private final int line;
    private final int column;

    protected FormatterException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public abstract ErrorKind getKind();

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        if (line <= 0) {
            return super.getMessage();
        }
        return line + ":" + column + ": " + super.getMessage();
    }

    /** 不带位置前缀的原始消息 */
    public String getDescription() {
        return super.getMessage();
    }
}
