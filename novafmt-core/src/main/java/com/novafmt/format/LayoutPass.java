package com.novafmt.format;

import com.novafmt.FormattingOptions;
import com.novafmt.ast.SyntaxNode;
import com.novafmt.doc.DocBuilder;
import com.novafmt.doc.Group;
import com.novafmt.input.TokenIndex;
import com.novafmt.layout.BreakEngine;
import com.novafmt.layout.LayoutPlan;
import com.novafmt.ops.Op;
import com.novafmt.ops.OpsPrinter;
import com.novafmt.output.FormatReplacement;
import com.novafmt.output.OutputWriter;
import com.novafmt.output.PatchApplier;
import com.novafmt.output.TokenSpan;
import com.novafmt.parser.Parser;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 一次完整的排版：解析 → 指令流 → 文档 → 断行 → 输出记录 → 最小替换
 */
public final class LayoutPass {
    private static final Logger LOG = Logger.getLogger(LayoutPass.class.getName());

    private final FormattingOptions options;
    private final String lineSeparator;

    public LayoutPass(FormattingOptions options, String lineSeparator) {
        this.options = options;
        this.lineSeparator = lineSeparator;
    }

    /**
     * 排版 text（换行已统一为 \n）。输出与原文相同时返回原字符串实例。
     */
    public String run(String text) {
        return PatchApplier.apply(text, replacements(text));
    }

    /** 把 text 排版为目标格式所需的替换列表 */
    public List<FormatReplacement> replacements(String text) {
        TokenIndex index = TokenIndex.of(text);
        SyntaxNode file = new Parser(index).parseFile();

        List<Op> ops = new NodeFormatter(index, options).formatRoot(file);
        if (options.isDebugLayoutTrace()) {
            LOG.info("Layout ops:\n" + new OpsPrinter().toJson(ops));
        }

        Group root = new DocBuilder(index).build(ops);
        LayoutPlan plan = new BreakEngine(options.getMaxWidth()).layout(root);
        List<TokenSpan> spans = new OutputWriter(plan, lineSeparator).write(root, text.length());
        List<FormatReplacement> replacements = PatchApplier.replacementsFor(text, spans);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(ops.size() + " ops, " + plan.brokenGroupCount() + " broken groups, "
                    + replacements.size() + " replacements");
        }
        return replacements;
    }
}
