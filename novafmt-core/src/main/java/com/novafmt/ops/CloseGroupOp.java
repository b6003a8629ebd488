package com.novafmt.ops;

public final class CloseGroupOp extends Op {
    private final int id;

    public CloseGroupOp(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    @Override
    public OpKind getKind() {
        return OpKind.CLOSE_GROUP;
    }

    @Override
    public String toString() {
        return "CloseGroup#" + id;
    }
}
