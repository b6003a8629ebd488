package com.novafmt.parser;

import com.novafmt.ast.NodeKind;
import com.novafmt.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

import static com.novafmt.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 代码块：{ 语句* }
     */
    SyntaxNode parseBlock() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(LBRACE, "Expected '{'"));
        parser.enterBraces();
        parseStatements(parts);
        parts.add(parser.expect(RBRACE, "Expected '}'"));
        parser.exitScope();
        return SyntaxNode.node(NodeKind.BLOCK, parts);
    }

    /**
     * 解析到 '}' 为止的语句序列，分号作为独立叶子保留
     */
    void parseStatements(List<SyntaxNode> parts) {
        while (!parser.check(RBRACE)) {
            if (parser.check(EOF)) {
                throw parser.error("Expected '}'");
            }
            if (parser.check(SEMICOLON)) {
                parts.add(parser.advance());
                continue;
            }
            parts.add(parseStatement());
            parser.expectStatementEnd();
        }
    }

    SyntaxNode parseStatement() {
        switch (parser.current().getType()) {
            case KW_FOR:
                return parseFor();
            case KW_WHILE:
                return parseWhile();
            case KW_DO:
                return parseDoWhile();
            default:
                break;
        }

        if (isLabel()) {
            List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
            parts.add(parser.advance());
            parts.add(parser.advance());
            parts.add(parseStatement());
            return SyntaxNode.node(NodeKind.LABELED, parts);
        }

        // 声明（可能带修饰符）
        int mark = parser.mark();
        SyntaxNode modifiers = parser.declParser.parseModifiers();
        if (parser.declParser.isDeclarationStart(DeclParser.Context.LOCAL)) {
            return parser.declParser.parseDeclarationAfter(modifiers, DeclParser.Context.LOCAL);
        }
        parser.reset(mark);

        SyntaxNode expr = parser.exprParser.parseExpression();
        if (parser.current().getType().isAssignmentOp()) {
            List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
            parts.add(expr);
            parts.add(parser.advance());
            parts.add(parser.exprParser.parseExpression());
            return SyntaxNode.node(NodeKind.ASSIGNMENT, parts);
        }
        return expr;
    }

    /**
     * 标签：name@ 紧跟语句
     */
    boolean isLabel() {
        return parser.check(IDENTIFIER) && parser.peekType(1) == AT && parser.adjacent(1)
                && parser.peekType(2) != EOF;
    }

    /**
     * 控制结构体：代码块或单条语句
     */
    SyntaxNode parseControlBody() {
        if (parser.check(LBRACE)) {
            return parseBlock();
        }
        return parseStatement();
    }

    private SyntaxNode parseFor() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(KW_FOR, "Expected 'for'"));
        parts.add(parser.expect(LPAREN, "Expected '(' after 'for'"));
        parser.enterParens();
        if (parser.check(LPAREN)) {
            parts.add(parser.declParser.parseDestructuring());
        } else {
            List<SyntaxNode> variable = new ArrayList<SyntaxNode>();
            SyntaxNode modifiers = parser.declParser.parseModifiers();
            if (modifiers != null) {
                variable.add(modifiers);
            }
            variable.add(parser.expect(IDENTIFIER, "Expected loop variable"));
            if (parser.check(COLON)) {
                variable.add(parser.advance());
                variable.add(parser.typeParser.parseTypeReference());
            }
            parts.add(SyntaxNode.node(NodeKind.PARAMETER, variable));
        }
        parts.add(parser.expect(KW_IN, "Expected 'in'"));
        parts.add(parser.exprParser.parseExpression());
        parts.add(parser.expect(RPAREN, "Expected ')'"));
        parser.exitScope();
        if (!isEmptyBody()) {
            parts.add(parseControlBody());
        }
        return SyntaxNode.node(NodeKind.FOR, parts);
    }

    private SyntaxNode parseWhile() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(KW_WHILE, "Expected 'while'"));
        parseCondition(parts);
        if (!isEmptyBody()) {
            parts.add(parseControlBody());
        }
        return SyntaxNode.node(NodeKind.WHILE, parts);
    }

    private SyntaxNode parseDoWhile() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(KW_DO, "Expected 'do'"));
        if (!parser.check(KW_WHILE)) {
            parts.add(parseControlBody());
        }
        parts.add(parser.expect(KW_WHILE, "Expected 'while' after do body"));
        parseCondition(parts);
        return SyntaxNode.node(NodeKind.DO_WHILE, parts);
    }

    /**
     * 括号条件：( expr )
     */
    void parseCondition(List<SyntaxNode> parts) {
        parts.add(parser.expect(LPAREN, "Expected '('"));
        parser.enterParens();
        parts.add(parser.exprParser.parseExpression());
        parts.add(parser.expect(RPAREN, "Expected ')'"));
        parser.exitScope();
    }

    /** 循环体缺省：其后直接是分号或块结束 */
    private boolean isEmptyBody() {
        return parser.checkAny(SEMICOLON, RBRACE, EOF);
    }
}
