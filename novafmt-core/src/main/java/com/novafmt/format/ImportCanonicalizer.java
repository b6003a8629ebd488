package com.novafmt.format;

import com.novafmt.StructuralException;
import com.novafmt.ast.NodeKind;
import com.novafmt.ast.SyntaxNode;
import com.novafmt.input.TokenIndex;
import com.novafmt.lexer.Token;
import com.novafmt.lexer.TokenType;
import com.novafmt.output.FormatReplacement;
import com.novafmt.output.PatchApplier;
import com.novafmt.parser.Parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * import 规范化：按规范键排序、去重，整块替换为每行一条
 *
 * <p>规范键为 {@code 限定名 + " " + 别名 + " " + (通配 ? "*" : "")}，无别名时写作 null。
 * import 之间夹有注释时无法安全移动，直接报错。</p>
 */
public final class ImportCanonicalizer {

    /**
     * 单条 import 的记录
     */
    public static final class ImportRecord {
        private final String qualifiedName;
        private final String alias;
        private final boolean wildcard;
        private final String originalText;
        private final int start;
        private final int end;

        ImportRecord(String qualifiedName, String alias, boolean wildcard, String originalText, int start, int end) {
            this.qualifiedName = qualifiedName;
            this.alias = alias;
            this.wildcard = wildcard;
            this.originalText = originalText;
            this.start = start;
            this.end = end;
        }

        public String getQualifiedName() {
            return qualifiedName;
        }

        /** 去掉反引号的别名，没有时为 null */
        public String getAlias() {
            return alias;
        }

        public boolean isWildcard() {
            return wildcard;
        }

        public String getOriginalText() {
            return originalText;
        }

        public int getStart() {
            return start;
        }

        public int getEnd() {
            return end;
        }

        /** 别名，或限定名的最后一段；通配 import 返回 null */
        public String getSimpleName() {
            if (alias != null) {
                return alias;
            }
            if (wildcard) {
                return null;
            }
            int dot = qualifiedName.lastIndexOf('.');
            return qualifiedName.substring(dot + 1);
        }

        public String getCanonicalKey() {
            return qualifiedName + " " + alias + " " + (wildcard ? "*" : "");
        }

        @Override
        public String toString() {
            return getCanonicalKey();
        }
    }

    private ImportCanonicalizer() {
    }

    /**
     * 规范化 text 中的 import 块；无需改动时返回原字符串实例
     */
    public static String canonicalize(String text) {
        TokenIndex index = TokenIndex.of(text);
        SyntaxNode importList = new Parser(index).parseFile().findChild(NodeKind.IMPORT_LIST);
        if (importList == null) {
            return text;
        }
        List<ImportRecord> records = collect(text, importList);
        ImportRecord first = records.get(0);
        ImportRecord last = records.get(records.size() - 1);
        checkContiguous(index, first.getStart(), last.getEnd());

        List<ImportRecord> sorted = new ArrayList<ImportRecord>(records);
        Collections.sort(sorted, new Comparator<ImportRecord>() {
            @Override
            public int compare(ImportRecord a, ImportRecord b) {
                return a.getCanonicalKey().compareTo(b.getCanonicalKey());
            }
        });
        StringBuilder block = new StringBuilder();
        Set<String> seen = new HashSet<String>();
        for (ImportRecord record : sorted) {
            if (!seen.add(record.getCanonicalKey())) {
                continue;
            }
            if (block.length() > 0) {
                block.append('\n');
            }
            block.append(record.getOriginalText());
        }

        String replacement = block.toString();
        if (replacement.equals(text.substring(first.getStart(), last.getEnd()))) {
            return text;
        }
        return PatchApplier.apply(text, Collections.singletonList(
                new FormatReplacement(first.getStart(), last.getEnd(), replacement)));
    }

    /** 按源码顺序收集 import 记录 */
    public static List<ImportRecord> collect(String text, SyntaxNode importList) {
        List<ImportRecord> records = new ArrayList<ImportRecord>();
        for (SyntaxNode directive : importList.childrenOf(NodeKind.IMPORT_DIRECTIVE)) {
            records.add(toRecord(text, directive));
        }
        return records;
    }

    private static ImportRecord toRecord(String text, SyntaxNode directive) {
        SyntaxNode path = directive.findChild(NodeKind.NAME_PATH);
        StringBuilder name = new StringBuilder();
        boolean wildcard = false;
        for (SyntaxNode part : path.getChildren()) {
            if (part.isToken(TokenType.MUL)) {
                wildcard = true;
            } else if (part.isToken(TokenType.IDENTIFIER)) {
                if (name.length() > 0) {
                    name.append('.');
                }
                name.append(part.getToken().getText());
            }
        }
        String alias = null;
        List<SyntaxNode> children = directive.getChildren();
        for (int i = 0; i < children.size() - 1; i++) {
            if (children.get(i).isToken(TokenType.KW_AS)) {
                alias = stripBackticks(children.get(i + 1).getToken().getText());
            }
        }
        return new ImportRecord(name.toString(), alias, wildcard,
                text.substring(directive.getStart(), directive.getEnd()),
                directive.getStart(), directive.getEnd());
    }

    /**
     * 第一条与最后一条 import 之间只能有 import 与空白
     */
    private static void checkContiguous(TokenIndex index, int start, int end) {
        for (Token token : index.getTokens()) {
            if (token.getStart() >= end) {
                break;
            }
            if (token.getStart() >= start && token.isComment()) {
                throw new StructuralException(
                        "Imports not contiguous (perhaps a comment separates them?): " + token.getText(),
                        token.getText(), token.getLine(), token.getColumn());
            }
        }
    }

    static String stripBackticks(String name) {
        if (name.length() >= 2 && name.startsWith("`") && name.endsWith("`")) {
            return name.substring(1, name.length() - 1);
        }
        return name;
    }
}
