package com.novafmt.ops;

public final class OpenGroupOp extends Op {
    private final int id;
    private final boolean fill;

    public OpenGroupOp(int id, boolean fill) {
        this.id = id;
        this.fill = fill;
    }

    public int getId() {
        return id;
    }

    public boolean isFill() {
        return fill;
    }

    @Override
    public OpKind getKind() {
        return OpKind.OPEN_GROUP;
    }

    @Override
    public String toString() {
        return (fill ? "OpenFill#" : "OpenGroup#") + id;
    }
}
