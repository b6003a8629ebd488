package com.novafmt.parser;

import com.novafmt.ast.NodeKind;
import com.novafmt.ast.SyntaxNode;
import com.novafmt.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.novafmt.lexer.TokenType.*;

/**
 * 表达式解析辅助类（按优先级递归下降）
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    SyntaxNode parseExpression() {
        return parseDisjunction();
    }

    // 逻辑或 ||（允许在运算符前换行）
    private SyntaxNode parseDisjunction() {
        SyntaxNode left = parseConjunction();
        while (parser.check(OR)) {
            SyntaxNode op = parser.advance();
            left = binary(left, op, parseConjunction());
        }
        return left;
    }

    // 逻辑与 &&（允许在运算符前换行）
    private SyntaxNode parseConjunction() {
        SyntaxNode left = parseEquality();
        while (parser.check(AND)) {
            SyntaxNode op = parser.advance();
            left = binary(left, op, parseEquality());
        }
        return left;
    }

    // 相等性 == != === !==
    private SyntaxNode parseEquality() {
        SyntaxNode left = parseComparison();
        while (parser.checkAny(EQ, NE, REF_EQ, REF_NE) && !parser.newlineBefore()) {
            SyntaxNode op = parser.advance();
            left = binary(left, op, parseComparison());
        }
        return left;
    }

    // 比较 < > <= >=
    private SyntaxNode parseComparison() {
        SyntaxNode left = parseNamedCheck();
        while (parser.checkAny(LT, GT, LE, GE) && !parser.newlineBefore()) {
            SyntaxNode op = parser.advance();
            left = binary(left, op, parseNamedCheck());
        }
        return left;
    }

    // in / !in / is / !is
    private SyntaxNode parseNamedCheck() {
        SyntaxNode left = parseElvis();
        while (!parser.newlineBefore()) {
            List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
            parts.add(left);
            if (parser.check(NOT) && parser.adjacent(1)
                    && (parser.peekType(1) == KW_IN || parser.peekType(1) == KW_IS)) {
                parts.add(parser.advance());
            } else if (!parser.check(KW_IN) && !parser.check(KW_IS)) {
                break;
            }
            if (parser.check(KW_IS)) {
                parts.add(parser.advance());
                parts.add(parser.typeParser.parseTypeReference());
                left = SyntaxNode.node(NodeKind.IS_EXPRESSION, parts);
            } else {
                parts.add(parser.expect(KW_IN, "Expected 'in'"));
                parts.add(parseElvis());
                left = SyntaxNode.node(NodeKind.BINARY, parts);
            }
        }
        return left;
    }

    // Elvis ?:（允许在运算符前换行）
    private SyntaxNode parseElvis() {
        SyntaxNode left = parseInfixCall();
        while (parser.check(ELVIS)) {
            SyntaxNode op = parser.advance();
            left = binary(left, op, parseInfixCall());
        }
        return left;
    }

    // 中缀函数调用 a to b, x until y
    private SyntaxNode parseInfixCall() {
        SyntaxNode left = parseRange();
        while (parser.check(IDENTIFIER) && !parser.index.lineBreakBefore(parser.current())
                && startsOperand(parser.peekType(1))) {
            SyntaxNode op = parser.advance();
            left = binary(left, op, parseRange());
        }
        return left;
    }

    // 范围 .. ..<
    private SyntaxNode parseRange() {
        SyntaxNode left = parseAdditive();
        while (parser.checkAny(RANGE, RANGE_EXCLUSIVE) && !parser.newlineBefore()) {
            SyntaxNode op = parser.advance();
            left = binary(left, op, parseAdditive());
        }
        return left;
    }

    // 加减 + -
    private SyntaxNode parseAdditive() {
        SyntaxNode left = parseMultiplicative();
        while (parser.checkAny(PLUS, MINUS) && !parser.newlineBefore()) {
            SyntaxNode op = parser.advance();
            left = binary(left, op, parseMultiplicative());
        }
        return left;
    }

    // 乘除模 * / %
    private SyntaxNode parseMultiplicative() {
        SyntaxNode left = parseAs();
        while (parser.checkAny(MUL, DIV, MOD) && !parser.newlineBefore()) {
            SyntaxNode op = parser.advance();
            left = binary(left, op, parseAs());
        }
        return left;
    }

    // 类型转换 as / as?
    private SyntaxNode parseAs() {
        SyntaxNode left = parsePrefix();
        while (parser.check(KW_AS) && !parser.newlineBefore()) {
            List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
            parts.add(left);
            parts.add(parser.advance());
            if (parser.check(QUESTION) && parser.adjacentToPrevious()) {
                parts.add(parser.advance());
            }
            parts.add(parser.typeParser.parseTypeReference());
            left = SyntaxNode.node(NodeKind.AS_EXPRESSION, parts);
        }
        return left;
    }

    // 一元前缀 - + ! ++ --
    private SyntaxNode parsePrefix() {
        if (parser.checkAny(MINUS, PLUS, NOT, NOT_NULL, INC, DEC)) {
            List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
            parts.add(parser.advance());
            parts.add(parsePrefix());
            return SyntaxNode.node(NodeKind.PREFIX, parts);
        }
        return parsePostfix();
    }

    // 后缀：调用、索引、成员访问、++ -- !!
    private SyntaxNode parsePostfix() {
        SyntaxNode expr = parsePrimary();
        while (true) {
            if (parser.checkAny(DOT, SAFE_DOT)) {
                List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
                parts.add(expr);
                parts.add(parser.advance());
                parts.add(parseSelector());
                expr = SyntaxNode.node(NodeKind.DOT_QUALIFIED, parts);
                continue;
            }
            if (parser.newlineBefore()) {
                break;
            }
            if (parser.checkAny(INC, DEC, NOT_NULL)) {
                List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
                parts.add(expr);
                parts.add(parser.advance());
                expr = SyntaxNode.node(NodeKind.POSTFIX, parts);
            } else if (parser.check(LBRACKET)) {
                expr = parseIndex(expr);
            } else if (parser.check(DOUBLE_COLON)) {
                List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
                parts.add(expr);
                parts.add(parser.advance());
                parts.add(parseReferenceName());
                expr = SyntaxNode.node(NodeKind.CALLABLE_REFERENCE, parts);
            } else {
                SyntaxNode call = tryCallSuffix(expr);
                if (call == null) {
                    break;
                }
                expr = call;
            }
        }
        return expr;
    }

    /**
     * 成员访问的右侧：名称，后面可能紧跟调用
     */
    private SyntaxNode parseSelector() {
        SyntaxNode name;
        if (parser.check(IDENTIFIER) || parser.check(KW_CLASS)) {
            name = parser.advance();
        } else {
            throw parser.error("Expected member name after '.'");
        }
        if (parser.newlineBefore()) {
            return name;
        }
        SyntaxNode call = tryCallSuffix(name);
        return call != null ? call : name;
    }

    /**
     * 调用后缀：[类型实参] (实参) [尾随 lambda] 或仅尾随 lambda，不是调用时返回 null
     */
    private SyntaxNode tryCallSuffix(SyntaxNode callee) {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(callee);
        if (parser.check(LT)) {
            SyntaxNode typeArgs = parser.attempt(new Parser.Attempt<SyntaxNode>() {
                @Override
                public SyntaxNode run() {
                    SyntaxNode args = parser.typeParser.parseTypeArguments();
                    boolean callFollows = (parser.check(LPAREN) && !parser.newlineBefore())
                            || (parser.check(LBRACE) && !parser.newlineBefore() && parser.trailingLambdaAllowed());
                    return callFollows ? args : null;
                }
            });
            if (typeArgs == null) {
                return null;
            }
            parts.add(typeArgs);
        }
        if (parser.check(LPAREN)) {
            parts.add(parseValueArguments());
        }
        if (parser.check(LBRACE) && !parser.newlineBefore() && parser.trailingLambdaAllowed()) {
            parts.add(parseLambda());
        }
        return parts.size() > 1 ? SyntaxNode.node(NodeKind.CALL, parts) : null;
    }

    /**
     * 实参列表：(a, name = b, *spread, )
     */
    SyntaxNode parseValueArguments() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(LPAREN, "Expected '('"));
        parser.enterParens();
        while (!parser.check(RPAREN)) {
            parts.add(parseValueArgument());
            if (!parser.match(parts, COMMA)) {
                break;
            }
        }
        parts.add(parser.expect(RPAREN, "Expected ')'"));
        parser.exitScope();
        return SyntaxNode.node(NodeKind.VALUE_ARGUMENTS, parts);
    }

    private SyntaxNode parseValueArgument() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        if (parser.check(IDENTIFIER) && parser.peekType(1) == ASSIGN) {
            parts.add(parser.advance());
            parts.add(parser.advance());
        }
        if (parser.check(MUL)) {
            parts.add(parser.advance());
        }
        parts.add(parseExpression());
        return SyntaxNode.node(NodeKind.VALUE_ARGUMENT, parts);
    }

    private SyntaxNode parseIndex(SyntaxNode receiver) {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(receiver);
        parts.add(parser.expect(LBRACKET, "Expected '['"));
        parser.enterParens();
        do {
            parts.add(parseExpression());
        } while (parser.match(parts, COMMA) && !parser.check(RBRACKET));
        parts.add(parser.expect(RBRACKET, "Expected ']'"));
        parser.exitScope();
        return SyntaxNode.node(NodeKind.INDEX, parts);
    }

    private SyntaxNode parseReferenceName() {
        if (parser.check(IDENTIFIER) || parser.check(KW_CLASS)) {
            return parser.advance();
        }
        throw parser.error("Expected name after '::'");
    }

    // ============ 基本表达式 ============

    private SyntaxNode parsePrimary() {
        TokenType type = parser.current().getType();
        if (type.isLiteral()) {
            return parser.advance();
        }
        switch (type) {
            case IDENTIFIER:
                if (parser.stmtParser.isLabel() && parser.peekType(2) == LBRACE) {
                    List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
                    parts.add(parser.advance());
                    parts.add(parser.advance());
                    parts.add(parseLambda());
                    return SyntaxNode.node(NodeKind.LABELED, parts);
                }
                return parser.advance();
            case KW_THIS:
            case KW_SUPER:
                return parseThis();
            case LPAREN:
                return parseParenthesized();
            case LBRACE:
                return parseLambda();
            case KW_IF:
                return parseIf();
            case KW_WHEN:
                return parseWhen();
            case KW_TRY:
                return parseTry();
            case KW_RETURN:
                return parseReturn();
            case KW_THROW: {
                List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
                parts.add(parser.advance());
                parts.add(parseExpression());
                return SyntaxNode.node(NodeKind.THROW, parts);
            }
            case KW_BREAK:
            case KW_CONTINUE: {
                List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
                parts.add(parser.advance());
                parseJumpLabel(parts);
                return SyntaxNode.node(NodeKind.JUMP, parts);
            }
            case KW_OBJECT:
                return parseObjectLiteral();
            case DOUBLE_COLON: {
                List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
                parts.add(parser.advance());
                parts.add(parseReferenceName());
                return SyntaxNode.node(NodeKind.CALLABLE_REFERENCE, parts);
            }
            default:
                throw parser.error("Expected expression");
        }
    }

    private SyntaxNode parseThis() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.advance());
        if (parts.get(0).isToken(KW_SUPER) && parser.check(LT) && parser.adjacentToPrevious()) {
            parts.add(parser.typeParser.parseTypeArguments());
        }
        parseJumpLabel(parts);
        return parts.size() == 1 ? parts.get(0) : SyntaxNode.node(NodeKind.THIS_EXPRESSION, parts);
    }

    /** 紧贴在关键词之后的 @label */
    private void parseJumpLabel(List<SyntaxNode> parts) {
        if (parser.check(AT) && parser.adjacentToPrevious() && parser.peekType(1) == IDENTIFIER) {
            parts.add(parser.advance());
            parts.add(parser.advance());
        }
    }

    private SyntaxNode parseParenthesized() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(LPAREN, "Expected '('"));
        parser.enterParens();
        parts.add(parseExpression());
        parts.add(parser.expect(RPAREN, "Expected ')'"));
        parser.exitScope();
        return SyntaxNode.node(NodeKind.PARENTHESIZED, parts);
    }

    private SyntaxNode parseReturn() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.advance());
        parseJumpLabel(parts);
        // 返回值必须与 return 同行
        if (!parser.index.lineBreakBefore(parser.current())
                && !parser.checkAny(RBRACE, RPAREN, RBRACKET, SEMICOLON, COMMA, EOF, KW_ELSE, ARROW)) {
            parts.add(parseExpression());
        }
        return SyntaxNode.node(NodeKind.RETURN, parts);
    }

    /**
     * Lambda：{ [参数 ->] 语句* }
     */
    SyntaxNode parseLambda() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(LBRACE, "Expected '{'"));
        parser.enterBraces();
        if (parser.check(ARROW)) {
            parts.add(parser.advance());
        } else if (parser.check(IDENTIFIER) || parser.check(LPAREN)) {
            SyntaxNode params = parser.attempt(new Parser.Attempt<SyntaxNode>() {
                @Override
                public SyntaxNode run() {
                    return parseLambdaParameters();
                }
            });
            if (params != null) {
                parts.add(params);
                parts.add(parser.advance());
            }
        }
        parser.stmtParser.parseStatements(parts);
        parts.add(parser.expect(RBRACE, "Expected '}'"));
        parser.exitScope();
        return SyntaxNode.node(NodeKind.LAMBDA, parts);
    }

    /**
     * Lambda 参数，成功时停在 '->' 上；否则返回 null
     */
    private SyntaxNode parseLambdaParameters() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        do {
            if (parser.check(LPAREN)) {
                parts.add(parser.declParser.parseDestructuring());
            } else {
                List<SyntaxNode> param = new ArrayList<SyntaxNode>();
                param.add(parser.expect(IDENTIFIER, "Expected parameter name"));
                if (parser.check(COLON)) {
                    param.add(parser.advance());
                    param.add(parser.typeParser.parseTypeReference());
                }
                parts.add(SyntaxNode.node(NodeKind.PARAMETER, param));
            }
        } while (parser.match(parts, COMMA) && !parser.check(ARROW));
        return parser.check(ARROW) ? SyntaxNode.node(NodeKind.LAMBDA_PARAMETERS, parts) : null;
    }

    // ============ 控制流表达式 ============

    private SyntaxNode parseIf() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(KW_IF, "Expected 'if'"));
        parser.stmtParser.parseCondition(parts);
        if (!parser.check(KW_ELSE) && !parser.check(SEMICOLON)) {
            parts.add(parser.stmtParser.parseControlBody());
        }
        if (parser.check(SEMICOLON) && parser.peekType(1) == KW_ELSE) {
            parts.add(parser.advance());
        }
        if (parser.check(KW_ELSE)) {
            parts.add(parser.advance());
            if (!parser.checkAny(SEMICOLON, RBRACE, EOF)) {
                parts.add(parser.stmtParser.parseControlBody());
            }
        }
        return SyntaxNode.node(NodeKind.IF, parts);
    }

    private SyntaxNode parseWhen() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(KW_WHEN, "Expected 'when'"));
        if (parser.check(LPAREN)) {
            parts.add(parser.advance());
            parser.enterParens();
            if (parser.check(KW_VAL)) {
                List<SyntaxNode> subject = new ArrayList<SyntaxNode>();
                parts.add(parser.declParser.parseProperty(subject, DeclParser.Context.LOCAL));
            } else {
                parts.add(parseExpression());
            }
            parts.add(parser.expect(RPAREN, "Expected ')'"));
            parser.exitScope();
        }
        parts.add(parser.expect(LBRACE, "Expected '{' after 'when'"));
        parser.enterBraces();
        while (!parser.check(RBRACE)) {
            if (parser.check(EOF)) {
                throw parser.error("Expected '}'");
            }
            parts.add(parseWhenEntry());
        }
        parts.add(parser.advance());
        parser.exitScope();
        return SyntaxNode.node(NodeKind.WHEN, parts);
    }

    private SyntaxNode parseWhenEntry() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        if (parser.check(KW_ELSE)) {
            parts.add(parser.advance());
        } else {
            do {
                parts.add(parseWhenCondition());
            } while (parser.match(parts, COMMA) && !parser.check(ARROW));
        }
        parts.add(parser.expect(ARROW, "Expected '->' in when entry"));
        parts.add(parser.stmtParser.parseControlBody());
        parser.match(parts, SEMICOLON);
        parser.expectStatementEnd();
        return SyntaxNode.node(NodeKind.WHEN_ENTRY, parts);
    }

    private SyntaxNode parseWhenCondition() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        if (parser.check(NOT) && parser.adjacent(1)
                && (parser.peekType(1) == KW_IN || parser.peekType(1) == KW_IS)) {
            parts.add(parser.advance());
        }
        if (parser.check(KW_IS)) {
            parts.add(parser.advance());
            parts.add(parser.typeParser.parseTypeReference());
        } else if (parser.check(KW_IN)) {
            parts.add(parser.advance());
            parts.add(parseExpression());
        } else {
            parts.add(parseExpression());
        }
        return SyntaxNode.node(NodeKind.WHEN_CONDITION, parts);
    }

    private SyntaxNode parseTry() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(KW_TRY, "Expected 'try'"));
        parts.add(parser.stmtParser.parseBlock());
        while (parser.checkSoft("catch") && parser.peekType(1) == LPAREN) {
            List<SyntaxNode> clause = new ArrayList<SyntaxNode>();
            clause.add(parser.advance());
            clause.add(parser.advance());
            parser.enterParens();
            List<SyntaxNode> param = new ArrayList<SyntaxNode>();
            param.add(parser.expect(IDENTIFIER, "Expected exception name"));
            param.add(parser.expect(COLON, "Expected ':'"));
            param.add(parser.typeParser.parseTypeReference());
            clause.add(SyntaxNode.node(NodeKind.PARAMETER, param));
            clause.add(parser.expect(RPAREN, "Expected ')'"));
            parser.exitScope();
            clause.add(parser.stmtParser.parseBlock());
            parts.add(SyntaxNode.node(NodeKind.CATCH, clause));
        }
        if (parser.checkSoft("finally") && parser.peekType(1) == LBRACE) {
            List<SyntaxNode> clause = new ArrayList<SyntaxNode>();
            clause.add(parser.advance());
            clause.add(parser.stmtParser.parseBlock());
            parts.add(SyntaxNode.node(NodeKind.FINALLY, clause));
        }
        if (parts.size() == 2) {
            throw parser.error("Expected 'catch' or 'finally'");
        }
        return SyntaxNode.node(NodeKind.TRY, parts);
    }

    private SyntaxNode parseObjectLiteral() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(KW_OBJECT, "Expected 'object'"));
        if (parser.check(COLON)) {
            parts.add(parser.advance());
            parser.disallowTrailingLambda();
            try {
                parts.add(parser.declParser.parseSuperTypeList());
            } finally {
                parser.allowTrailingLambda();
            }
        }
        parts.add(parser.declParser.parseClassBody(false));
        return SyntaxNode.node(NodeKind.OBJECT_LITERAL, parts);
    }

    // ============ 工具方法 ============

    private static SyntaxNode binary(SyntaxNode left, SyntaxNode op, SyntaxNode right) {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(left);
        parts.add(op);
        parts.add(right);
        return SyntaxNode.node(NodeKind.BINARY, parts);
    }

    /** 中缀函数名之后的 token 能否开始一个操作数 */
    private static boolean startsOperand(TokenType next) {
        if (next.isLiteral()) {
            return true;
        }
        switch (next) {
            case IDENTIFIER:
            case KW_THIS:
            case KW_SUPER:
            case LPAREN:
            case LBRACE:
            case KW_IF:
            case KW_WHEN:
            case KW_TRY:
            case KW_OBJECT:
            case DOUBLE_COLON:
            case MINUS:
            case PLUS:
            case NOT:
                return true;
            default:
                return false;
        }
    }
}
