package com.novafmt;

import com.novafmt.format.ImportCanonicalizer;
import com.novafmt.format.LayoutPass;
import com.novafmt.format.RedundantElementRemover;
import com.novafmt.input.TokenIndex;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 格式化入口
 *
 * <p>流程：拒绝含 U+0003 的输入 → 换行统一为 \n → 规范化 import →
 * 第一遍排版 → 删除多余元素 → 第二遍排版（使用原文的换行风格）。
 * 每次调用互不共享状态，可在多个线程中并发使用。</p>
 */
public final class Formatter {
    private static final Logger LOG = Logger.getLogger(Formatter.class.getName());

    private static final char TOMBSTONE = '\u0003';

    private Formatter() {
    }

    /** 使用默认选项格式化 */
    public static String format(String text) {
        return format(FormattingOptions.defaults(), text);
    }

    /**
     * 格式化源码
     *
     * @throws SyntaxException 源码无法解析
     * @throws StructuralException 格式化过程中发现结构错误（如 import 之间夹有注释）
     * @throws UnsupportedInputException 源码含有 U+0003
     */
    public static String format(FormattingOptions options, String text) {
        long start = System.nanoTime();
        checkTombstone(text);
        String lineSeparator = detectLineSeparator(text);
        String normalized = normalizeLineSeparators(text);

        String canonical = ImportCanonicalizer.canonicalize(normalized);
        String laidOut = new LayoutPass(options, "\n").run(canonical);
        String stripped = new RedundantElementRemover(options.isRemoveUnusedImports()).remove(laidOut);
        String result = new LayoutPass(options, lineSeparator).run(stripped);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("Formatted %d chars in %.2f ms", text.length(),
                    (System.nanoTime() - start) / 1e6));
        }
        return result.equals(text) ? text : result;
    }

    /** 只规范化 import 块 */
    public static String canonicalizeImports(String text) {
        checkTombstone(text);
        return ImportCanonicalizer.canonicalize(text);
    }

    static void checkTombstone(String text) {
        int offset = text.indexOf(TOMBSTONE);
        if (offset >= 0) {
            int[] position = TokenIndex.lineColumn(text, offset);
            throw new UnsupportedInputException(
                    "novafmt does not support code which contains a \\u0003 character; escape it",
                    offset, position[0], position[1]);
        }
    }

    /** 原文第一个换行的风格；没有换行时为 \n */
    static String detectLineSeparator(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                return i + 1 < text.length() && text.charAt(i + 1) == '\n' ? "\r\n" : "\r";
            }
            if (c == '\n') {
                return "\n";
            }
        }
        return "\n";
    }

    static String normalizeLineSeparators(String text) {
        if (text.indexOf('\r') < 0) {
            return text;
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
