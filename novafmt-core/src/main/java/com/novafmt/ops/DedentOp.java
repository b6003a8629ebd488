package com.novafmt.ops;

public final class DedentOp extends Op {

    @Override
    public OpKind getKind() {
        return OpKind.DEDENT;
    }

    @Override
    public String toString() {
        return "Dedent";
    }
}
