package com.novafmt.output;

import java.util.ArrayList;
import java.util.List;

/**
 * 把输出记录转换为最小替换并应用到原文
 */
public final class PatchApplier {

    private PatchApplier() {
    }

    /**
     * 只保留渲染结果与原文不同的区间，并去掉两端相同的部分
     */
    public static List<FormatReplacement> replacementsFor(String original, List<TokenSpan> spans) {
        List<FormatReplacement> replacements = new ArrayList<>();
        for (TokenSpan span : spans) {
            String before = original.substring(span.getStart(), span.getEnd());
            String after = span.getRenderedText();
            if (before.equals(after)) {
                continue;
            }
            int prefix = 0;
            int limit = Math.min(before.length(), after.length());
            while (prefix < limit && before.charAt(prefix) == after.charAt(prefix)) {
                prefix++;
            }
            int suffix = 0;
            while (suffix < limit - prefix
                    && before.charAt(before.length() - 1 - suffix) == after.charAt(after.length() - 1 - suffix)) {
                suffix++;
            }
            replacements.add(new FormatReplacement(span.getStart() + prefix, span.getEnd() - suffix,
                    after.substring(prefix, after.length() - suffix)));
        }
        return replacements;
    }

    /**
     * 应用替换；未覆盖的字节原样复制。替换必须有序且互不重叠。
     * 没有替换时返回原字符串实例。
     */
    public static String apply(String original, List<FormatReplacement> replacements) {
        if (replacements.isEmpty()) {
            return original;
        }
        StringBuilder sb = new StringBuilder(original.length());
        int copied = 0;
        for (FormatReplacement replacement : replacements) {
            if (replacement.getStart() < copied) {
                throw new IllegalArgumentException("Replacements overlap or are out of order at " + replacement);
            }
            if (replacement.getEnd() > original.length()) {
                throw new IllegalArgumentException("Replacement " + replacement + " exceeds text length "
                        + original.length());
            }
            sb.append(original, copied, replacement.getStart());
            sb.append(replacement.getReplacementText());
            copied = replacement.getEnd();
        }
        sb.append(original, copied, original.length());
        return sb.toString();
    }
}
