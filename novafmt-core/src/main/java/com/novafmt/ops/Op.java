package com.novafmt.ops;

/**
 * 打印指令（不可变）
 */
public abstract class Op {

    public abstract OpKind getKind();

    public boolean is(OpKind kind) {
        return getKind() == kind;
    }
}
