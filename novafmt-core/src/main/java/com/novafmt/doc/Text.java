package com.novafmt.doc;

import com.novafmt.lexer.Token;

/**
 * 不可分割的文本；来自原文 Token 时携带该 Token（输出时记录其原文区间）
 */
public final class Text extends Doc {
    private final String text;
    private final Token token;

    public Text(String text, Token token) {
        super(text.indexOf('\n') >= 0 ? INFINITE : text.length());
        this.text = text;
        this.token = token;
    }

    public String getText() {
        return text;
    }

    public Token getToken() {
        return token;
    }

    public boolean isAnchored() {
        return token != null;
    }

    @Override
    public void appendFlat(StringBuilder out) {
        out.append(text);
    }

    @Override
    public String toString() {
        return "Text(" + text + ")";
    }
}
