package com.novafmt.doc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 组：其中的断点一起平铺或一起展开；fill 组的断点各自决定
 */
public final class Group extends Doc {
    private final List<Doc> children;
    private final boolean fill;

    public Group(List<Doc> children, boolean fill) {
        super(sumWidths(children));
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.fill = fill;
    }

    public List<Doc> getChildren() {
        return children;
    }

    public boolean isFill() {
        return fill;
    }

    @Override
    public void appendFlat(StringBuilder out) {
        for (Doc child : children) {
            child.appendFlat(out);
        }
    }

    @Override
    public String toString() {
        return (fill ? "Fill" : "Group") + children;
    }
}
