package com.novafmt.ops;

import com.novafmt.lexer.Token;

/**
 * 输出一段文本；源自原文 Token 时携带该 Token
 */
public final class LiteralOp extends Op {
    private final String text;
    private final Token token;

    public LiteralOp(String text, Token token) {
        this.text = text;
        this.token = token;
    }

    public String getText() {
        return text;
    }

    /** 对应的原文 Token，合成文本为 null */
    public Token getToken() {
        return token;
    }

    @Override
    public OpKind getKind() {
        return OpKind.LITERAL;
    }

    @Override
    public String toString() {
        return "Literal(" + text + ")";
    }
}
