package com.novafmt.ops;

public final class IndentOp extends Op {
    private final int amount;

    public IndentOp(int amount) {
        this.amount = amount;
    }

    public int getAmount() {
        return amount;
    }

    @Override
    public OpKind getKind() {
        return OpKind.INDENT;
    }

    @Override
    public String toString() {
        return "Indent(" + amount + ")";
    }
}
