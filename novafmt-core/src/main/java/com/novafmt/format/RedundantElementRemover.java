package com.novafmt.format;

import com.novafmt.ast.NodeKind;
import com.novafmt.ast.SyntaxNode;
import com.novafmt.input.TokenIndex;
import com.novafmt.lexer.Token;
import com.novafmt.lexer.TokenType;
import com.novafmt.output.FormatReplacement;
import com.novafmt.output.PatchApplier;
import com.novafmt.parser.Parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 删除语法上多余的元素：行末分号，以及（可选）未使用的 import
 */
public final class RedundantElementRemover {

    /** 通过约定隐式调用的运算符函数名，导入后即使没有出现在源码中也在使用 */
    private static final Set<String> OPERATOR_NAMES = new HashSet<String>(Arrays.asList(
            "get", "set", "invoke", "getValue", "setValue", "provideDelegate",
            "plus", "minus", "times", "div", "rem", "mod", "rangeTo", "rangeUntil",
            "unaryPlus", "unaryMinus", "not", "inc", "dec", "contains", "compareTo", "equals",
            "plusAssign", "minusAssign", "timesAssign", "divAssign", "remAssign", "modAssign",
            "iterator", "next", "hasNext"));

    private static final Pattern COMPONENT_N = Pattern.compile("component\\d+");
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern TEMPLATE_BLOCK = Pattern.compile("\\$\\{([^}]*)}");
    private static final Pattern TEMPLATE_NAME = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern DOC_LINK = Pattern.compile("\\[([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern DOC_TAG = Pattern.compile("@(?:see|throws|exception)\\s+([A-Za-z_][A-Za-z0-9_]*)");

    /** 分号可作为语句结束符删除的父节点 */
    private static final Set<NodeKind> STATEMENT_CONTAINERS = EnumSet.of(
            NodeKind.FILE, NodeKind.BLOCK, NodeKind.CLASS_BODY, NodeKind.LAMBDA,
            NodeKind.PACKAGE_HEADER, NodeKind.IMPORT_DIRECTIVE, NodeKind.WHEN_ENTRY);

    /** 这些 Token 开头的下一行会与上一行接续，分号不能省 */
    private static final Set<TokenType> CONTINUATION_STARTS = EnumSet.of(
            TokenType.LBRACE, TokenType.DOT, TokenType.SAFE_DOT,
            TokenType.ELVIS, TokenType.AND, TokenType.OR);

    private static final Set<String> CONTINUATION_WORDS = new HashSet<String>(Arrays.asList("get", "set", "by"));

    private final boolean removeUnusedImports;

    public RedundantElementRemover(boolean removeUnusedImports) {
        this.removeUnusedImports = removeUnusedImports;
    }

    /**
     * 删除多余元素；没有可删除的内容时返回原字符串实例
     */
    public String remove(String text) {
        TokenIndex index = TokenIndex.of(text);
        SyntaxNode file = new Parser(index).parseFile();

        List<FormatReplacement> removals = new ArrayList<FormatReplacement>();
        if (removeUnusedImports) {
            collectUnusedImports(text, index, file, removals);
        }
        List<FormatReplacement> semicolons = new ArrayList<FormatReplacement>();
        collectSemicolons(index, file, semicolons);
        for (FormatReplacement semicolon : semicolons) {
            if (!covered(removals, semicolon)) {
                removals.add(semicolon);
            }
        }

        Collections.sort(removals, new Comparator<FormatReplacement>() {
            @Override
            public int compare(FormatReplacement a, FormatReplacement b) {
                return Integer.compare(a.getStart(), b.getStart());
            }
        });
        return PatchApplier.apply(text, removals);
    }

    // ============ 分号 ============

    private void collectSemicolons(TokenIndex index, SyntaxNode node, List<FormatReplacement> removals) {
        List<SyntaxNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            SyntaxNode child = children.get(i);
            if (child.isToken(TokenType.SEMICOLON)) {
                if (STATEMENT_CONTAINERS.contains(node.getKind())
                        && isRedundantSemicolon(index, node, children, i)) {
                    Token token = child.getToken();
                    removals.add(new FormatReplacement(token.getStart(), token.getEnd(), ""));
                }
            } else if (!child.isToken()) {
                collectSemicolons(index, child, removals);
            }
        }
    }

    private static boolean isRedundantSemicolon(TokenIndex index, SyntaxNode parent, List<SyntaxNode> siblings,
                                                int position) {
        Token semicolon = siblings.get(position).getToken();
        SyntaxNode previous = position > 0 ? siblings.get(position - 1) : null;
        if (previous != null) {
            // 枚举项与成员之间的分号
            if (parent.is(NodeKind.CLASS_BODY)
                    && (previous.is(NodeKind.ENUM_ENTRY) || previous.isToken(TokenType.COMMA))) {
                return false;
            }
            // 作为空循环体/空分支的分号
            if ((previous.is(NodeKind.FOR) || previous.is(NodeKind.WHILE) || previous.is(NodeKind.IF))
                    && previous.child(previous.childCount() - 1).isToken(TokenType.RPAREN)) {
                return false;
            }
        }

        // 连续的分号按整段处理，由其后的第一个 Token 决定
        List<Token> codeTokens = index.getCodeTokens();
        int nextIndex = index.codeIndexOf(semicolon) + 1;
        while (codeTokens.get(nextIndex).is(TokenType.SEMICOLON)) {
            nextIndex++;
        }
        Token next = codeTokens.get(nextIndex);
        if (next.is(TokenType.EOF) || next.is(TokenType.RBRACE)) {
            return true;
        }
        if (!index.lineBreakBefore(next)) {
            return false;
        }
        if (CONTINUATION_STARTS.contains(next.getType())) {
            return false;
        }
        return !(next.is(TokenType.IDENTIFIER) && CONTINUATION_WORDS.contains(next.getText()));
    }

    // ============ 未使用的 import ============

    private void collectUnusedImports(String text, TokenIndex index, SyntaxNode file,
                                      List<FormatReplacement> removals) {
        SyntaxNode importList = file.findChild(NodeKind.IMPORT_LIST);
        if (importList == null) {
            return;
        }
        Set<String> used = referencedNames(index, file);
        for (ImportCanonicalizer.ImportRecord record : ImportCanonicalizer.collect(text, importList)) {
            String name = record.getSimpleName();
            if (name == null || used.contains(name) || isOperatorName(name)) {
                continue;
            }
            int end = record.getEnd();
            while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
                end++;
            }
            if (end < text.length() && text.charAt(end) == '\n') {
                end++;
            } else {
                end = record.getEnd();
            }
            removals.add(new FormatReplacement(record.getStart(), end, ""));
        }
    }

    /**
     * 包头与 import 之外出现的所有名称：标识符、字符串模板中的引用、文档注释中的链接
     */
    private static Set<String> referencedNames(TokenIndex index, SyntaxNode file) {
        SyntaxNode packageHeader = file.findChild(NodeKind.PACKAGE_HEADER);
        SyntaxNode importList = file.findChild(NodeKind.IMPORT_LIST);
        Set<String> names = new HashSet<String>();
        for (Token token : index.getTokens()) {
            if (within(token, packageHeader) || within(token, importList)) {
                continue;
            }
            switch (token.getType()) {
                case IDENTIFIER:
                    names.add(ImportCanonicalizer.stripBackticks(token.getText()));
                    break;
                case STRING_LITERAL:
                case MULTILINE_STRING:
                    addTemplateNames(token.getText(), names);
                    break;
                case BLOCK_COMMENT:
                    if (token.getText().startsWith("/**")) {
                        addMatches(DOC_LINK, token.getText(), names);
                        addMatches(DOC_TAG, token.getText(), names);
                    }
                    break;
                default:
                    break;
            }
        }
        return names;
    }

    private static void addTemplateNames(String literal, Set<String> names) {
        Matcher block = TEMPLATE_BLOCK.matcher(literal);
        while (block.find()) {
            addMatches(NAME, block.group(1), names);
        }
        addMatches(TEMPLATE_NAME, literal, names);
    }

    private static void addMatches(Pattern pattern, String text, Set<String> names) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            names.add(matcher.groupCount() > 0 ? matcher.group(1) : matcher.group());
        }
    }

    private static boolean within(Token token, SyntaxNode node) {
        return node != null && token.getStart() >= node.getStart() && token.getEnd() <= node.getEnd();
    }

    private static boolean isOperatorName(String name) {
        return OPERATOR_NAMES.contains(name) || COMPONENT_N.matcher(name).matches();
    }

    private static boolean covered(List<FormatReplacement> removals, FormatReplacement candidate) {
        for (FormatReplacement removal : removals) {
            if (removal.getStart() <= candidate.getStart() && candidate.getEnd() <= removal.getEnd()) {
                return true;
            }
        }
        return false;
    }
}
