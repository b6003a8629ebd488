package com.novafmt.lexer;

/**
 * 词法单元，覆盖原文中的区间 [start, end)
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final int start;
    private final int line;
    private final int column;

    public Token(TokenType type, String text, int start, int line, int column) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    public TokenKind getKind() {
        return type.kind();
    }

    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return start + text.length();
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    public boolean isCode() {
        return getKind() == TokenKind.CODE;
    }

    public boolean isComment() {
        return getKind() == TokenKind.COMMENT;
    }

    public boolean isWhitespace() {
        return getKind() == TokenKind.WHITESPACE;
    }

    /** 文本中是否含换行（多行字符串、跨行块注释、换行符本身） */
    public boolean containsNewline() {
        return text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
    }

    @Override
    public String toString() {
        return String.format("%s(%s) at %d:%d", type, text, line, column);
    }
}
