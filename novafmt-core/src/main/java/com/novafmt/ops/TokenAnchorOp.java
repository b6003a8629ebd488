package com.novafmt.ops;

/**
 * 标记紧随其后的 Literal 对应原文区间 [start, end)
 */
public final class TokenAnchorOp extends Op {
    private final int start;
    private final int end;

    public TokenAnchorOp(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public OpKind getKind() {
        return OpKind.TOKEN_ANCHOR;
    }

    @Override
    public String toString() {
        return "Anchor[" + start + ", " + end + ")";
    }
}
