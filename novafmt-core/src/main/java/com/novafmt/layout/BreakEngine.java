package com.novafmt.layout;

import com.novafmt.doc.Break;
import com.novafmt.doc.Doc;
import com.novafmt.doc.Group;
import com.novafmt.doc.Indent;
import com.novafmt.doc.Text;
import com.novafmt.ops.BreakKind;

import java.util.List;

/**
 * 断行引擎：在列宽限制下决定每个组平铺还是展开
 *
 * <p>由外向内、从左到右处理。组平铺后连同其后直到下一个可换行断点的内容都能放进当前行时整体平铺，
 * 否则展开：直接子断点换行到所在缩进区域的缩进，嵌套组在新状态下各自决定。
 * fill 组与 flexible 断点逐个判断到下一个可换行断点为止的内容是否放得下。
 * 宽于列宽的不可分割文本原样输出。</p>
 */
public final class BreakEngine {

    private enum Mode {
        FLAT,
        BROKEN,
        FILL
    }

    private final int maxWidth;

    public BreakEngine(int maxWidth) {
        if (maxWidth <= 0) {
            throw new IllegalArgumentException("maxWidth must be positive: " + maxWidth);
        }
        this.maxWidth = maxWidth;
    }

    public LayoutPlan layout(Doc root) {
        LayoutPlan plan = new LayoutPlan();
        layoutNode(root, new State(0, 0), Mode.BROKEN, 0, plan);
        return plan;
    }

    /**
     * @param trailing 节点之后、下一个可换行断点之前还要接在同一行上的平铺宽度
     */
    private State layoutNode(Doc doc, State state, Mode mode, int trailing, LayoutPlan plan) {
        if (doc instanceof Text) {
            return advanceText(state, ((Text) doc).getText());
        }
        if (mode == Mode.FLAT) {
            return state.advance(doc.getFlatWidth());
        }
        if (doc instanceof Group) {
            Group group = (Group) doc;
            if (fits(state.getColumn(), add(group.getFlatWidth(), trailing))) {
                return state.advance(group.getFlatWidth());
            }
            plan.markBroken(group);
            return layoutChildren(group.getChildren(), state, group.isFill() ? Mode.FILL : Mode.BROKEN,
                    trailing, plan);
        }
        if (doc instanceof Indent) {
            Indent indent = (Indent) doc;
            State inner = state.withIndent(state.getIndent() + indent.getAmount());
            return layoutChildren(indent.getChildren(), inner, mode, trailing, plan).withIndent(state.getIndent());
        }
        throw new IllegalStateException("Break outside of its container: " + doc);
    }

    private State layoutChildren(List<Doc> children, State state, Mode mode, int trailing, LayoutPlan plan) {
        State current = state;
        for (int i = 0; i < children.size(); i++) {
            Doc child = children.get(i);
            if (child instanceof Text) {
                current = advanceText(current, ((Text) child).getText());
                continue;
            }
            int after = widthToNextBreak(children, i + 1, trailing);
            if (child instanceof Break) {
                current = layoutBreak((Break) child, after, current, mode, plan);
            } else {
                current = layoutNode(child, current, mode, after, plan);
            }
        }
        return current;
    }

    private State layoutBreak(Break b, int after, State state, Mode mode, LayoutPlan plan) {
        if (mode == Mode.FLAT || b.getKind() == BreakKind.SPACE) {
            return state.advance(b.getFlatText().length());
        }
        boolean newline;
        if (b.getKind() == BreakKind.FORCED_LINE) {
            newline = true;
        } else if (mode == Mode.FILL || b.isFlexible()) {
            newline = !fits(state.getColumn(), add(b.getFlatText().length(), after));
        } else {
            newline = true;
        }
        if (!newline) {
            return state.advance(b.getFlatText().length());
        }
        plan.markNewline(b, state.getIndent());
        return state.newline();
    }

    /**
     * 从 from 开始到下一个可换行断点为止的平铺宽度，空格断点不算断点，嵌套节点只量到其中第一个断点。
     * 同级内容走完仍没有断点时接上外层的 trailing。
     */
    private static int widthToNextBreak(List<Doc> siblings, int from, int trailing) {
        Measure measure = new Measure();
        measure.scan(siblings, from);
        return measure.stopped ? measure.width : add(measure.width, trailing);
    }

    /** 一行之内累计的宽度，遇到可换行断点或含换行的文本时停止 */
    private static final class Measure {
        int width;
        boolean stopped;

        void scan(List<Doc> docs, int from) {
            for (int i = from; i < docs.size() && !stopped; i++) {
                Doc doc = docs.get(i);
                if (doc instanceof Break) {
                    Break b = (Break) doc;
                    if (b.getKind() == BreakKind.SPACE) {
                        width = add(width, b.getFlatText().length());
                    } else {
                        stopped = true;
                    }
                } else if (doc instanceof Text) {
                    String text = ((Text) doc).getText();
                    int newline = text.indexOf('\n');
                    width = add(width, newline < 0 ? text.length() : newline);
                    stopped = newline >= 0;
                } else if (doc instanceof Group) {
                    scan(((Group) doc).getChildren(), 0);
                } else if (doc instanceof Indent) {
                    scan(((Indent) doc).getChildren(), 0);
                }
            }
        }
    }

    private static int add(int a, int b) {
        if (a == Doc.INFINITE || b == Doc.INFINITE) {
            return Doc.INFINITE;
        }
        long sum = (long) a + b;
        return sum >= Doc.INFINITE ? Doc.INFINITE : (int) sum;
    }

    private boolean fits(int column, int width) {
        return width != Doc.INFINITE && (long) column + width <= maxWidth;
    }

    private static State advanceText(State state, String text) {
        int newline = text.lastIndexOf('\n');
        if (newline < 0) {
            return state.advance(text.length());
        }
        return state.withColumn(text.length() - newline - 1);
    }
}
