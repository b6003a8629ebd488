package com.novafmt.doc;

import com.novafmt.ops.BreakKind;

/**
 * 断点：平铺时输出 flatText，换行时输出换行与缩进
 */
public final class Break extends Doc {
    private final BreakKind kind;
    private final String flatText;
    private final boolean flexible;
    private final int blankLines;

    public Break(BreakKind kind, String flatText, boolean flexible, int blankLines) {
        super(kind == BreakKind.FORCED_LINE ? INFINITE : flatText.length());
        this.kind = kind;
        this.flatText = flatText;
        this.flexible = flexible;
        this.blankLines = blankLines;
    }

    public BreakKind getKind() {
        return kind;
    }

    public String getFlatText() {
        return flatText;
    }

    public boolean isFlexible() {
        return flexible;
    }

    public int getBlankLines() {
        return blankLines;
    }

    @Override
    public void appendFlat(StringBuilder out) {
        out.append(flatText);
    }

    @Override
    public String toString() {
        return "Break(" + kind + ")";
    }
}
