package com.novafmt.doc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 缩进区域：其中的断点换行后多缩进 amount 列
 */
public final class Indent extends Doc {
    private final int amount;
    private final List<Doc> children;

    public Indent(int amount, List<Doc> children) {
        super(sumWidths(children));
        this.amount = amount;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public int getAmount() {
        return amount;
    }

    public List<Doc> getChildren() {
        return children;
    }

    @Override
    public void appendFlat(StringBuilder out) {
        for (Doc child : children) {
            child.appendFlat(out);
        }
    }

    @Override
    public String toString() {
        return "Indent(" + amount + ")" + children;
    }
}
