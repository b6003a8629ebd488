package com.novafmt;

/**
 * 结构错误：某个变换的结构前提不成立，携带出错元素的原文
 */
public class StructuralException extends FormatterException {
    private final String elementText;

    public StructuralException(String message, String elementText, int line, int column) {
        super(message, line, column);
        this.elementText = elementText;
    }

    /** 内部一致性错误，没有对应的源码位置 */
    public StructuralException(String message) {
        this(message, null, 0, 0);
    }

    public String getElementText() {
        return elementText;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.STRUCTURAL;
    }
}
