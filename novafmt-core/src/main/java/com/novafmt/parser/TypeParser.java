package com.novafmt.parser;

import com.novafmt.ast.NodeKind;
import com.novafmt.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

import static com.novafmt.lexer.TokenType.*;

/**
 * 类型解析辅助类
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 类型参数声明：&lt;T, out R : Any, reified E&gt;
     */
    SyntaxNode parseTypeParameters() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(LT, "Expected '<'"));
        parser.enterParens();
        do {
            parts.add(parseTypeParameter());
        } while (parser.match(parts, COMMA) && !parser.check(GT));
        parts.add(parser.expect(GT, "Expected '>'"));
        parser.exitScope();
        return SyntaxNode.node(NodeKind.TYPE_PARAMETERS, parts);
    }

    private SyntaxNode parseTypeParameter() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        SyntaxNode modifiers = parseVarianceModifiers();
        if (modifiers != null) {
            parts.add(modifiers);
        }
        parts.add(parser.expect(IDENTIFIER, "Expected type parameter name"));
        if (parser.match(parts, COLON)) {
            parts.add(parseTypeReference());
        }
        return SyntaxNode.node(NodeKind.TYPE_PARAMETER, parts);
    }

    /**
     * 类型参数/类型实参前的修饰符：注解、in、out、reified
     */
    private SyntaxNode parseVarianceModifiers() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        while (true) {
            if (parser.check(KW_IN) && parser.peekType(1) == IDENTIFIER) {
                parts.add(parser.advance());
            } else if (parser.check(AT)) {
                parts.add(parser.declParser.parseAnnotation());
            } else if ((parser.checkSoft("out") || parser.checkSoft("reified"))
                    && (parser.peekType(1) == IDENTIFIER || parser.peekType(1) == MUL)) {
                parts.add(parser.advance());
            } else {
                break;
            }
        }
        return parts.isEmpty() ? null : SyntaxNode.node(NodeKind.MODIFIER_LIST, parts);
    }

    /**
     * 类型引用：[修饰符] (用户类型 | 函数类型 | 括号类型) ['?']*
     */
    SyntaxNode parseTypeReference() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        SyntaxNode modifiers = parseTypeModifiers();
        if (modifiers != null) {
            parts.add(modifiers);
        }

        if (parser.check(LPAREN)) {
            SyntaxNode functionType = parser.attempt(new Parser.Attempt<SyntaxNode>() {
                @Override
                public SyntaxNode run() {
                    return parseFunctionType(null);
                }
            });
            parts.add(functionType != null ? functionType : parseParenthesizedType());
        } else {
            SyntaxNode userType = parseUserType(Integer.MAX_VALUE);
            // 带接收者的函数类型：String.() -> Unit
            if (parser.check(DOT) && parser.peekType(1) == LPAREN) {
                List<SyntaxNode> receiver = new ArrayList<SyntaxNode>();
                receiver.add(userType);
                while (parser.check(QUESTION)) {
                    receiver.add(parser.advance());
                }
                parts.add(parseFunctionType(SyntaxNode.node(NodeKind.TYPE_REFERENCE, receiver)));
            } else {
                parts.add(userType);
            }
        }

        while (parser.check(QUESTION) && parser.adjacentToPrevious()) {
            parts.add(parser.advance());
        }
        return SyntaxNode.node(NodeKind.TYPE_REFERENCE, parts);
    }

    private SyntaxNode parseTypeModifiers() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        while (true) {
            if (parser.check(AT)) {
                parts.add(parser.declParser.parseAnnotation());
            } else if (parser.checkSoft("suspend") && parser.peekType(1) == LPAREN) {
                parts.add(parser.advance());
            } else {
                break;
            }
        }
        return parts.isEmpty() ? null : SyntaxNode.node(NodeKind.MODIFIER_LIST, parts);
    }

    /**
     * 用户类型：Name&lt;Args&gt;.Inner&lt;Args&gt;，最多解析 maxSegments 段
     */
    SyntaxNode parseUserType(int maxSegments) {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(IDENTIFIER, "Expected type name"));
        if (parser.check(LT)) {
            parts.add(parseTypeArguments());
        }
        int segments = 1;
        while (segments < maxSegments && parser.check(DOT) && parser.peekType(1) == IDENTIFIER) {
            parts.add(parser.advance());
            parts.add(parser.advance());
            if (parser.check(LT)) {
                parts.add(parseTypeArguments());
            }
            segments++;
        }
        return SyntaxNode.node(NodeKind.USER_TYPE, parts);
    }

    /**
     * 类型实参：&lt;Int, out T, *&gt;
     */
    SyntaxNode parseTypeArguments() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(LT, "Expected '<'"));
        parser.enterParens();
        do {
            if (parser.check(MUL)) {
                parts.add(parser.advance());
            } else {
                SyntaxNode variance = parseVarianceModifiers();
                SyntaxNode type = parseTypeReference();
                if (variance != null) {
                    // 型变修饰符并入类型引用的修饰符列表
                    List<SyntaxNode> merged = new ArrayList<SyntaxNode>();
                    merged.add(variance);
                    merged.addAll(type.getChildren());
                    type = SyntaxNode.node(NodeKind.TYPE_REFERENCE, merged);
                }
                parts.add(type);
            }
        } while (parser.match(parts, COMMA) && !parser.check(GT));
        parts.add(parser.expect(GT, "Expected '>'"));
        parser.exitScope();
        return SyntaxNode.node(NodeKind.TYPE_ARGUMENTS, parts);
    }

    /**
     * 函数类型：[Receiver.] (A, name: B) -&gt; R
     */
    private SyntaxNode parseFunctionType(SyntaxNode receiver) {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        if (receiver != null) {
            parts.add(receiver);
            parts.add(parser.expect(DOT, "Expected '.'"));
        }
        parts.add(parser.expect(LPAREN, "Expected '('"));
        parser.enterParens();
        while (!parser.check(RPAREN)) {
            if (parser.check(IDENTIFIER) && parser.peekType(1) == COLON) {
                List<SyntaxNode> param = new ArrayList<SyntaxNode>();
                param.add(parser.advance());
                param.add(parser.advance());
                param.add(parseTypeReference());
                parts.add(SyntaxNode.node(NodeKind.PARAMETER, param));
            } else {
                parts.add(parseTypeReference());
            }
            if (!parser.match(parts, COMMA)) {
                break;
            }
        }
        parts.add(parser.expect(RPAREN, "Expected ')'"));
        parser.exitScope();
        parts.add(parser.expect(ARROW, "Expected '->'"));
        parts.add(parseTypeReference());
        return SyntaxNode.node(NodeKind.FUNCTION_TYPE, parts);
    }

    private SyntaxNode parseParenthesizedType() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(LPAREN, "Expected '('"));
        parser.enterParens();
        parts.add(parseTypeReference());
        parts.add(parser.expect(RPAREN, "Expected ')'"));
        parser.exitScope();
        return SyntaxNode.node(NodeKind.PARENTHESIZED_TYPE, parts);
    }
}
