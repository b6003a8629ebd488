package com.novafmt.input;

import com.novafmt.StructuralException;
import com.novafmt.lexer.Lexer;
import com.novafmt.lexer.Token;
import com.novafmt.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 原文 Token 索引
 *
 * <p>Token 区间恰好划分原文（无空隙、无重叠），构建时校验。
 * 提供区间到 Token 的反查、偏移到行列的换算，以及注释的归属：
 * 与前一个代码 Token 同行的注释是它的尾随注释，其余注释是下一个代码 Token 的前置注释。</p>
 */
public final class TokenIndex {
    private final String text;
    private final List<Token> tokens;
    private final List<Token> codeTokens;
    private final Map<Token, Integer> positions = new IdentityHashMap<>();
    private final Map<Token, Integer> codePositions = new IdentityHashMap<>();
    private final Map<Token, List<Token>> leading = new IdentityHashMap<>();
    private final Map<Token, List<Token>> trailing = new IdentityHashMap<>();
    private final int[] lineStarts;

    public TokenIndex(String text, List<Token> tokens) {
        this.text = text;
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
        checkPartition();

        List<Token> code = new ArrayList<>();
        for (int i = 0; i < this.tokens.size(); i++) {
            Token token = this.tokens.get(i);
            positions.put(token, i);
            if (token.isCode() || token.is(TokenType.EOF)) {
                codePositions.put(token, code.size());
                code.add(token);
            }
        }
        this.codeTokens = Collections.unmodifiableList(code);
        attachComments();
        this.lineStarts = computeLineStarts(text);
    }

    /** 对文本做词法分析并建立索引 */
    public static TokenIndex of(String text) {
        return new TokenIndex(text, new Lexer(text).scanTokens());
    }

    public String getText() {
        return text;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /** 全部代码 Token，末尾为 EOF */
    public List<Token> getCodeTokens() {
        return codeTokens;
    }

    public Token getEof() {
        return codeTokens.get(codeTokens.size() - 1);
    }

    public boolean contains(Token token) {
        return positions.containsKey(token);
    }

    /** 代码 Token 在 {@link #getCodeTokens()} 中的序号；非代码 Token 返回 -1 */
    public int codeIndexOf(Token token) {
        Integer index = codePositions.get(token);
        return index != null ? index : -1;
    }

    /**
     * 覆盖 offset 的 Token（零宽 EOF 覆盖文本末尾）
     */
    public Token tokenAt(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside [0, " + text.length() + "]");
        }
        int lo = 0;
        int hi = tokens.size() - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (tokens.get(mid).getStart() <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        Token token = tokens.get(lo);
        // 零宽 EOF 与最后一个 Token 同起点时取非空的那个
        if (token.getText().isEmpty() && lo > 0 && tokens.get(lo - 1).getEnd() > offset) {
            return tokens.get(lo - 1);
        }
        return token;
    }

    /** 区间恰好等于 [start, end) 的 Token，不存在时返回 null */
    public Token tokenForRange(int start, int end) {
        if (start < 0 || start > text.length()) {
            return null;
        }
        Token token = tokenAt(start);
        if (token.getStart() == start && token.getEnd() == end) {
            return token;
        }
        if (start == end && getEof().getStart() == start) {
            return getEof();
        }
        return null;
    }

    public List<Token> leadingComments(Token codeToken) {
        List<Token> list = leading.get(codeToken);
        return list != null ? list : Collections.<Token>emptyList();
    }

    public List<Token> trailingComments(Token codeToken) {
        List<Token> list = trailing.get(codeToken);
        return list != null ? list : Collections.<Token>emptyList();
    }

    /** 两个代码 Token 之间（含两端注释）是否存在注释 */
    public boolean hasCommentsBetween(Token from, Token to) {
        int a = positions.get(from);
        int b = positions.get(to);
        for (int i = a + 1; i < b; i++) {
            if (tokens.get(i).isComment()) {
                return true;
            }
        }
        return false;
    }

    /** 紧邻 token 之前的连续空白中的换行数 */
    public int newlinesBefore(Token token) {
        int count = 0;
        for (int i = positions.get(token) - 1; i >= 0 && tokens.get(i).isWhitespace(); i--) {
            if (tokens.get(i).is(TokenType.NEWLINE)) count++;
        }
        return count;
    }

    /** 紧邻 token 之后的连续空白中的换行数 */
    public int newlinesAfter(Token token) {
        int count = 0;
        for (int i = positions.get(token) + 1; i < tokens.size() && tokens.get(i).isWhitespace(); i++) {
            if (tokens.get(i).is(TokenType.NEWLINE)) count++;
        }
        return count;
    }

    public boolean whitespaceBefore(Token token) {
        int i = positions.get(token);
        return i > 0 && tokens.get(i - 1).isWhitespace();
    }

    public boolean whitespaceAfter(Token token) {
        int i = positions.get(token);
        return i + 1 < tokens.size() && tokens.get(i + 1).isWhitespace();
    }

    /**
     * 代码 Token 与前一个代码 Token 之间是否换行（换行符、行注释或跨行块注释均算）
     */
    public boolean lineBreakBefore(Token codeToken) {
        int i = positions.get(codeToken) - 1;
        for (; i >= 0; i--) {
            Token token = tokens.get(i);
            if (token.isCode()) {
                return false;
            }
            if (token.is(TokenType.NEWLINE) || token.containsNewline()) {
                return true;
            }
        }
        return false;
    }

    /** 代码 Token 与下一个代码 Token 之间是否换行 */
    public boolean lineBreakAfter(Token codeToken) {
        int index = codeIndexOf(codeToken);
        if (index < 0 || index + 1 >= codeTokens.size()) {
            return false;
        }
        return lineBreakBefore(codeTokens.get(index + 1));
    }

    /** 偏移换算为行列（均从 1 开始） */
    public int[] lineColumn(int offset) {
        return lineColumn(lineStarts, offset);
    }

    /** 不建立索引时的行列换算 */
    public static int[] lineColumn(String text, int offset) {
        return lineColumn(computeLineStarts(text), offset);
    }

    private static int[] lineColumn(int[] lineStarts, int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return new int[] {lo + 1, offset - lineStarts[lo] + 1};
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
                starts.add(i + 1);
            }
        }
        int[] result = new int[starts.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = starts.get(i);
        }
        return result;
    }

    private void checkPartition() {
        int expected = 0;
        for (Token token : tokens) {
            if (token.getStart() != expected) {
                throw new StructuralException("Token ranges do not partition the text at offset " + expected
                        + ": found " + token);
            }
            if (!text.regionMatches(token.getStart(), token.getText(), 0, token.getText().length())) {
                throw new StructuralException("Token text does not match the source: " + token);
            }
            expected = token.getEnd();
        }
        if (expected != text.length()) {
            throw new StructuralException("Tokens end at " + expected + " but the text has length " + text.length());
        }
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new StructuralException("Token list must end with EOF");
        }
    }

    private void attachComments() {
        Token previousCode = null;
        boolean sameLine = false;
        List<Token> pendingLeading = new ArrayList<>();
        for (Token token : tokens) {
            if (token.isComment()) {
                if (previousCode != null && sameLine) {
                    trailing.computeIfAbsent(previousCode, k -> new ArrayList<>()).add(token);
                    // 行注释之后必然换行
                    sameLine = !token.is(TokenType.LINE_COMMENT) && !token.containsNewline();
                } else {
                    pendingLeading.add(token);
                }
            } else if (token.is(TokenType.NEWLINE)) {
                sameLine = false;
            } else if (token.isCode() || token.is(TokenType.EOF)) {
                if (!pendingLeading.isEmpty()) {
                    leading.put(token, pendingLeading);
                    pendingLeading = new ArrayList<>();
                }
                previousCode = token;
                sameLine = true;
            }
        }
    }
}
