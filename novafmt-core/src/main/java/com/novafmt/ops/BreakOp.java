package com.novafmt.ops;

/**
 * 可断行点
 *
 * <p>flexible 的断点在展开的组中也单独判断是否换行；
 * blankLineAllowed 表示换行时可以保留原文中的一个空行。</p>
 */
public final class BreakOp extends Op {
    private final BreakKind breakKind;
    private final String flatText;
    private final boolean flexible;
    private final int blankLines;
    private final boolean blankLineAllowed;

    public BreakOp(BreakKind breakKind, String flatText, boolean flexible, int blankLines, boolean blankLineAllowed) {
        this.breakKind = breakKind;
        this.flatText = flatText;
        this.flexible = flexible;
        this.blankLines = blankLines;
        this.blankLineAllowed = blankLineAllowed;
    }

    public BreakKind getBreakKind() {
        return breakKind;
    }

    public String getFlatText() {
        return flatText;
    }

    public boolean isFlexible() {
        return flexible;
    }

    /** 换行后额外输出的空行数（0 或 1） */
    public int getBlankLines() {
        return blankLines;
    }

    public boolean isBlankLineAllowed() {
        return blankLineAllowed;
    }

    public boolean isForced() {
        return breakKind == BreakKind.FORCED_LINE;
    }

    public BreakOp withKind(BreakKind kind) {
        return new BreakOp(kind, flatText, flexible, blankLines, blankLineAllowed);
    }

    public BreakOp withFlatText(String text) {
        return new BreakOp(breakKind, text, flexible, blankLines, blankLineAllowed);
    }

    public BreakOp withBlankLines(int lines) {
        return new BreakOp(breakKind, flatText, flexible, lines, blankLineAllowed);
    }

    @Override
    public OpKind getKind() {
        return OpKind.BREAK;
    }

    @Override
    public String toString() {
        return "Break(" + breakKind + ", \"" + flatText + "\"" + (flexible ? ", flexible" : "")
                + (blankLines > 0 ? ", blank" : "") + ")";
    }
}
