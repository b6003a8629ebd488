package com.novafmt.layout;

/**
 * 排版状态：当前列与当前缩进（不可变）
 */
public final class State {
    private final int column;
    private final int indent;

    public State(int column, int indent) {
        this.column = column;
        this.indent = indent;
    }

    public int getColumn() {
        return column;
    }

    public int getIndent() {
        return indent;
    }

    public State withColumn(int newColumn) {
        return new State(newColumn, indent);
    }

    public State advance(int width) {
        return new State(column + width, indent);
    }

    public State withIndent(int newIndent) {
        return new State(column, newIndent);
    }

    /** 换行到当前缩进 */
    public State newline() {
        return new State(indent, indent);
    }

    @Override
    public String toString() {
        return "State{column=" + column + ", indent=" + indent + "}";
    }
}
