package com.novafmt.doc;

import java.util.List;

/**
 * 文档模型节点
 *
 * <p>平铺宽度在构造时计算一次。强制换行或含换行的文本宽度为 {@link #INFINITE}，
 * 并向外传播到所有外层节点。</p>
 */
public abstract class Doc {
    /** 无法平铺 */
    public static final int INFINITE = Integer.MAX_VALUE;

    private final int flatWidth;

    protected Doc(int flatWidth) {
        this.flatWidth = flatWidth;
    }

    public int getFlatWidth() {
        return flatWidth;
    }

    public boolean isFlatPossible() {
        return flatWidth != INFINITE;
    }

    /** 平铺渲染：所有断点取平铺文本 */
    public abstract void appendFlat(StringBuilder out);

    public String flatText() {
        StringBuilder sb = new StringBuilder();
        appendFlat(sb);
        return sb.toString();
    }

    static int add(int a, int b) {
        if (a == INFINITE || b == INFINITE) {
            return INFINITE;
        }
        long sum = (long) a + b;
        return sum >= INFINITE ? INFINITE : (int) sum;
    }

    static int sumWidths(List<Doc> children) {
        int width = 0;
        for (Doc child : children) {
            width = add(width, child.getFlatWidth());
        }
        return width;
    }
}
