package com.novafmt.parser;

import com.novafmt.SyntaxException;
import com.novafmt.ast.NodeKind;
import com.novafmt.ast.SyntaxNode;
import com.novafmt.input.TokenIndex;
import com.novafmt.lexer.Token;
import com.novafmt.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.novafmt.lexer.TokenType.*;

/**
 * Nova 语法分析器（递归下降），产出以代码 Token 为叶子的具体语法树
 *
 * <p>语句以换行或分号结束。圆括号、方括号内换行不敏感，花括号内恢复敏感。</p>
 */
public class Parser {

    final TokenIndex index;
    private final List<Token> tokens;
    private int pos;

    // 换行敏感性栈：true 表示换行可以结束表达式
    private final Deque<Boolean> newlineSensitive = new ArrayDeque<Boolean>();
    // > 0 时禁止尾随 lambda（如 by 委托表达式之后紧跟类体），进入括号后重新允许
    private int noTrailingLambda;
    private final Deque<Integer> savedTrailingLambda = new ArrayDeque<Integer>();

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(TokenIndex index) {
        this.index = index;
        this.tokens = index.getCodeTokens();
        this.newlineSensitive.push(Boolean.TRUE);
    }

    /** 词法分析并解析整个文件 */
    public static SyntaxNode parse(String source) {
        return new Parser(TokenIndex.of(source)).parseFile();
    }

    // ============ 文件 ============

    /**
     * 解析文件：可选的文件注解、package、import 列表，随后是顶层声明
     */
    public SyntaxNode parseFile() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        if (check(AT) && isFileAnnotation()) {
            parts.add(declParser.parseFileAnnotations());
        }
        if (check(KW_PACKAGE)) {
            parts.add(declParser.parsePackageHeader());
        }
        if (check(KW_IMPORT)) {
            parts.add(declParser.parseImportList());
        }
        while (!check(EOF)) {
            if (check(SEMICOLON)) {
                parts.add(advance());
                continue;
            }
            parts.add(declParser.parseDeclaration(DeclParser.Context.TOP_LEVEL));
            expectStatementEnd();
        }
        return SyntaxNode.node(NodeKind.FILE, parts);
    }

    private boolean isFileAnnotation() {
        return peekType(1) == IDENTIFIER && "file".equals(peek(1).getText()) && peekType(2) == COLON;
    }

    // ============ 基础方法 ============

    Token current() {
        return tokens.get(pos);
    }

    Token previous() {
        return pos > 0 ? tokens.get(pos - 1) : null;
    }

    Token peek(int distance) {
        int i = Math.min(pos + distance, tokens.size() - 1);
        return tokens.get(i);
    }

    TokenType peekType(int distance) {
        return peek(distance).getType();
    }

    /**
     * 前进到下一个 token，返回被消费 token 的叶子节点
     */
    SyntaxNode advance() {
        Token token = tokens.get(pos);
        if (!token.is(EOF)) {
            pos++;
        }
        return SyntaxNode.leaf(token);
    }

    /**
     * 标记当前位置，用于回溯
     */
    int mark() {
        return pos;
    }

    /**
     * 回溯到标记的位置
     */
    void reset(int mark) {
        pos = mark;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current().getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 检查当前 token 是否为指定的软关键词
     */
    boolean checkSoft(String keyword) {
        return check(IDENTIFIER) && keyword.equals(current().getText());
    }

    /**
     * 如果当前 token 匹配，则加入 parts 并前进
     */
    boolean match(List<SyntaxNode> parts, TokenType type) {
        if (check(type)) {
            parts.add(advance());
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    SyntaxNode expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    /**
     * 期望软关键词
     */
    SyntaxNode expectSoft(String keyword) {
        if (checkSoft(keyword)) {
            return advance();
        }
        throw error("Expected '" + keyword + "'");
    }

    /**
     * 当前 token 之前是否有换行（仅在换行敏感的上下文中生效）
     */
    boolean newlineBefore() {
        return newlineSensitive.peek() && index.lineBreakBefore(current());
    }

    /**
     * 当前 token 是否与前一个 token 紧邻（中间没有任何字符）
     */
    boolean adjacentToPrevious() {
        Token prev = previous();
        return prev != null && prev.getEnd() == current().getStart();
    }

    /**
     * 判断第 distance 个 token 是否紧跟在其前一个 token 之后
     */
    boolean adjacent(int distance) {
        return peek(distance - 1).getEnd() == peek(distance).getStart();
    }

    void enterParens() {
        newlineSensitive.push(Boolean.FALSE);
        savedTrailingLambda.push(noTrailingLambda);
        noTrailingLambda = 0;
    }

    void enterBraces() {
        newlineSensitive.push(Boolean.TRUE);
        savedTrailingLambda.push(noTrailingLambda);
        noTrailingLambda = 0;
    }

    void exitScope() {
        newlineSensitive.pop();
        noTrailingLambda = savedTrailingLambda.pop();
    }

    void disallowTrailingLambda() {
        noTrailingLambda++;
    }

    void allowTrailingLambda() {
        noTrailingLambda--;
    }

    boolean trailingLambdaAllowed() {
        return noTrailingLambda == 0;
    }

    /**
     * 语句/声明之后必须是换行、分号、右花括号或文件结束
     */
    void expectStatementEnd() {
        if (checkAny(SEMICOLON, RBRACE, EOF)) {
            return;
        }
        if (!index.lineBreakBefore(current())) {
            throw error("Expected newline or ';'");
        }
    }

    SyntaxException error(String message) {
        Token token = current();
        String found = token.is(EOF) ? "end of file" : "'" + token.getText() + "'";
        return new SyntaxException(message + " (found " + found + ")", token.getLine(), token.getColumn());
    }

    /**
     * 试探性解析：失败时回溯并返回 null
     */
    <T> T attempt(Attempt<T> attempt) {
        int mark = mark();
        int depth = newlineSensitive.size();
        int trailing = noTrailingLambda;
        try {
            T result = attempt.run();
            if (result == null) {
                reset(mark);
            }
            return result;
        } catch (SyntaxException e) {
            reset(mark);
            while (newlineSensitive.size() > depth) {
                newlineSensitive.pop();
                savedTrailingLambda.pop();
            }
            noTrailingLambda = trailing;
            return null;
        }
    }

    interface Attempt<T> {
        T run();
    }
}
