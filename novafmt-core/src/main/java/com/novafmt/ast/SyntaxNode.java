package com.novafmt.ast;

import com.novafmt.lexer.Token;
import com.novafmt.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 具体语法树节点
 *
 * <p>叶子节点（{@link NodeKind#TOKEN}）包装一个代码 Token；内部节点按源码顺序持有子节点，
 * 因此按先序遍历叶子即可得到全部代码 Token。</p>
 */
public final class SyntaxNode {
    private final NodeKind kind;
    private final List<SyntaxNode> children;
    private final Token token;

    private SyntaxNode(NodeKind kind, List<SyntaxNode> children, Token token) {
        this.kind = kind;
        this.children = children;
        this.token = token;
    }

    public static SyntaxNode leaf(Token token) {
        return new SyntaxNode(NodeKind.TOKEN, Collections.<SyntaxNode>emptyList(), token);
    }

    public static SyntaxNode node(NodeKind kind, List<SyntaxNode> children) {
        // 只有空文件允许没有子节点
        if (children.isEmpty() && kind != NodeKind.FILE) {
            throw new IllegalArgumentException("Empty " + kind + " node");
        }
        return new SyntaxNode(kind, Collections.unmodifiableList(new ArrayList<>(children)), null);
    }

    public NodeKind getKind() {
        return kind;
    }

    public List<SyntaxNode> getChildren() {
        return children;
    }

    public SyntaxNode child(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    /** 叶子节点的 Token；内部节点返回 null */
    public Token getToken() {
        return token;
    }

    public boolean isToken() {
        return kind == NodeKind.TOKEN;
    }

    public boolean isToken(TokenType type) {
        return token != null && token.getType() == type;
    }

    public boolean is(NodeKind kind) {
        return this.kind == kind;
    }

    public Token firstToken() {
        SyntaxNode node = this;
        while (!node.isToken()) {
            node = node.children.get(0);
        }
        return node.token;
    }

    public Token lastToken() {
        SyntaxNode node = this;
        while (!node.isToken()) {
            node = node.children.get(node.children.size() - 1);
        }
        return node.token;
    }

    public int getStart() {
        return firstToken().getStart();
    }

    public int getEnd() {
        return lastToken().getEnd();
    }

    /** 第一个指定种类的直接子节点 */
    public SyntaxNode findChild(NodeKind kind) {
        for (SyntaxNode child : children) {
            if (child.kind == kind) {
                return child;
            }
        }
        return null;
    }

    /** 第一个指定类型的直接子 Token */
    public SyntaxNode findToken(TokenType type) {
        for (SyntaxNode child : children) {
            if (child.isToken(type)) {
                return child;
            }
        }
        return null;
    }

    public List<SyntaxNode> childrenOf(NodeKind kind) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (child.kind == kind) {
                result.add(child);
            }
        }
        return result;
    }

    /** 先序收集子树内全部代码 Token */
    public List<Token> tokens() {
        List<Token> result = new ArrayList<>();
        collectTokens(this, result);
        return result;
    }

    private static void collectTokens(SyntaxNode node, List<Token> out) {
        if (node.isToken()) {
            out.add(node.token);
            return;
        }
        for (SyntaxNode child : node.children) {
            collectTokens(child, out);
        }
    }

    /** 对应的原文片段 */
    public String getText(String source) {
        return source.substring(getStart(), getEnd());
    }

    @Override
    public String toString() {
        if (isToken()) {
            return token.getText();
        }
        StringBuilder sb = new StringBuilder();
        sb.append(kind).append('[');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(children.get(i));
        }
        return sb.append(']').toString();
    }
}
