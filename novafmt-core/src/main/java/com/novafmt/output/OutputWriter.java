package com.novafmt.output;

import com.novafmt.doc.Break;
import com.novafmt.doc.Doc;
import com.novafmt.doc.Group;
import com.novafmt.doc.Indent;
import com.novafmt.doc.Text;
import com.novafmt.layout.LayoutPlan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 按断行方案渲染文档，为每个锚定 Token 记录它取代的原文区间
 *
 * <p>两个锚定 Token 之间的断点与合成文本累积为分隔串；换行时去掉行尾空格，
 * 且不重复输出换行。第一个 Token 之前不输出任何内容。</p>
 */
public final class OutputWriter {
    private final LayoutPlan plan;
    private final String lineSeparator;

    private final List<TokenSpan> spans = new ArrayList<>();
    private final StringBuilder separator = new StringBuilder();
    private int previousEnd;
    private boolean started;
    private boolean atLineStart;

    public OutputWriter(LayoutPlan plan, String lineSeparator) {
        this.plan = plan;
        this.lineSeparator = lineSeparator;
    }

    /**
     * 渲染整个文档；最后一段覆盖 [最后一个 Token 结束, textLength)，输出一个行分隔符（空文档不输出）
     */
    public List<TokenSpan> write(Doc root, int textLength) {
        walk(root);
        spans.add(new TokenSpan(previousEnd, textLength, started ? lineSeparator : ""));
        return Collections.unmodifiableList(spans);
    }

    /** 把记录拼接为完整输出 */
    public static String render(List<TokenSpan> spans) {
        StringBuilder sb = new StringBuilder();
        for (TokenSpan span : spans) {
            sb.append(span.getRenderedText());
        }
        return sb.toString();
    }

    private void walk(Doc doc) {
        if (doc instanceof Text) {
            writeText((Text) doc);
        } else if (doc instanceof Break) {
            writeBreak((Break) doc);
        } else if (doc instanceof Group) {
            for (Doc child : ((Group) doc).getChildren()) {
                walk(child);
            }
        } else if (doc instanceof Indent) {
            for (Doc child : ((Indent) doc).getChildren()) {
                walk(child);
            }
        } else {
            throw new IllegalStateException("Unknown doc node: " + doc);
        }
    }

    private void writeText(Text text) {
        if (!text.isAnchored()) {
            if (started) {
                separator.append(text.getText());
                atLineStart = false;
            }
            return;
        }
        String rendered = convertNewlines(separator.toString()) + convertNewlines(text.getText());
        spans.add(new TokenSpan(previousEnd, text.getToken().getEnd(), rendered));
        previousEnd = text.getToken().getEnd();
        separator.setLength(0);
        started = true;
        atLineStart = false;
    }

    private void writeBreak(Break b) {
        if (!started) {
            return;
        }
        if (plan.isNewline(b)) {
            newline(plan.indentOf(b), b.getBlankLines());
        } else if (!(atLineStart && b.getFlatText().trim().isEmpty())) {
            separator.append(b.getFlatText());
            if (!b.getFlatText().isEmpty()) {
                atLineStart = false;
            }
        }
    }

    private void newline(int indent, int blankLines) {
        int end = separator.length();
        while (end > 0 && (separator.charAt(end - 1) == ' ' || separator.charAt(end - 1) == '\t')) {
            end--;
        }
        separator.setLength(end);

        int existing = 0;
        for (int i = separator.length() - 1; i >= 0 && separator.charAt(i) == '\n'; i--) {
            existing++;
        }
        for (int i = existing; i < 1 + blankLines; i++) {
            separator.append('\n');
        }
        for (int i = 0; i < indent; i++) {
            separator.append(' ');
        }
        atLineStart = true;
    }

    private String convertNewlines(String text) {
        if ("\n".equals(lineSeparator) || text.indexOf('\n') < 0) {
            return text;
        }
        return text.replace("\n", lineSeparator);
    }
}
