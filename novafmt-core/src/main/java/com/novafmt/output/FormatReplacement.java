package com.novafmt.output;

/**
 * 最小替换：原文区间 [start, end) 替换为 replacementText
 */
public final class FormatReplacement {
    private final int start;
    private final int end;
    private final String replacementText;

    public FormatReplacement(int start, int end, String replacementText) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.replacementText = replacementText;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getReplacementText() {
        return replacementText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormatReplacement)) return false;
        FormatReplacement that = (FormatReplacement) o;
        return start == that.start && end == that.end && replacementText.equals(that.replacementText);
    }

    @Override
    public int hashCode() {
        return (start * 31 + end) * 31 + replacementText.hashCode();
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ") -> \"" + replacementText + "\"";
    }
}
