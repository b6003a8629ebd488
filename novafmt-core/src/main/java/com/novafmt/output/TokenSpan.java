package com.novafmt.output;

/**
 * 输出记录：原文区间 [start, end) 被 renderedText 取代
 */
public final class TokenSpan {
    private final int start;
    private final int end;
    private final String renderedText;

    public TokenSpan(int start, int end, String renderedText) {
        this.start = start;
        this.end = end;
        this.renderedText = renderedText;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getRenderedText() {
        return renderedText;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ") -> \"" + renderedText + "\"";
    }
}
