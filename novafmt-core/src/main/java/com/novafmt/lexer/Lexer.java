package com.novafmt.lexer;

import com.novafmt.SyntaxException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Nova 全保真词法分析器
 *
 * <p>原文的每个字符恰好属于一个 Token：代码、空白（含换行）或注释。
 * 末尾追加一个零宽的 EOF。</p>
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("val", TokenType.KW_VAL);
        map.put("var", TokenType.KW_VAR);
        map.put("fun", TokenType.KW_FUN);
        map.put("class", TokenType.KW_CLASS);
        map.put("interface", TokenType.KW_INTERFACE);
        map.put("object", TokenType.KW_OBJECT);
        map.put("typealias", TokenType.KW_TYPEALIAS);
        map.put("package", TokenType.KW_PACKAGE);
        map.put("import", TokenType.KW_IMPORT);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("when", TokenType.KW_WHEN);
        map.put("for", TokenType.KW_FOR);
        map.put("while", TokenType.KW_WHILE);
        map.put("do", TokenType.KW_DO);
        map.put("return", TokenType.KW_RETURN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("throw", TokenType.KW_THROW);
        map.put("try", TokenType.KW_TRY);
        // "catch"/"finally" 是软关键词，由解析器在 try 之后识别

        // 类型操作
        map.put("is", TokenType.KW_IS);
        map.put("as", TokenType.KW_AS);
        map.put("in", TokenType.KW_IN);
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("null", TokenType.KW_NULL);

        // 特殊
        map.put("this", TokenType.KW_THIS);
        map.put("super", TokenType.KW_SUPER);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有硬关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source) {
        this.source = source;
    }

    /**
     * 执行词法分析，返回覆盖全文的 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", current, line, column));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '@': addToken(TokenType.AT); break;

            // 可能是多字符的 Token
            case '.':
                if (match('.')) {
                    addToken(match('<') ? TokenType.RANGE_EXCLUSIVE : TokenType.RANGE);
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case ':':
                addToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON);
                break;

            case '+':
                if (match('+')) addToken(TokenType.INC);
                else if (match('=')) addToken(TokenType.PLUS_ASSIGN);
                else addToken(TokenType.PLUS);
                break;

            case '-':
                if (match('-')) addToken(TokenType.DEC);
                else if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                addToken(match('=') ? TokenType.MUL_ASSIGN : TokenType.MUL);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释（不含行尾换行）
                    while (peek() != '\n' && peek() != '\r' && !isAtEnd()) advance();
                    addToken(TokenType.LINE_COMMENT);
                } else if (match('*')) {
                    blockComment();
                } else if (match('=')) {
                    addToken(TokenType.DIV_ASSIGN);
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.MOD_ASSIGN : TokenType.MOD);
                break;

            case '=':
                if (match('=')) {
                    addToken(match('=') ? TokenType.REF_EQ : TokenType.EQ);
                } else {
                    addToken(TokenType.ASSIGN);
                }
                break;

            case '!':
                if (match('=')) {
                    addToken(match('=') ? TokenType.REF_NE : TokenType.NE);
                } else if (match('!')) {
                    addToken(TokenType.NOT_NULL);
                } else {
                    addToken(TokenType.NOT);
                }
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    error("Unexpected character '&'. Did you mean '&&'?");
                }
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    error("Unexpected character '|'. Did you mean '||'?");
                }
                break;

            case '?':
                if (match('.')) {
                    addToken(TokenType.SAFE_DOT);
                } else if (match(':')) {
                    addToken(TokenType.ELVIS);
                } else {
                    addToken(TokenType.QUESTION);
                }
                break;

            // 空白字符
            case ' ':
            case '\t':
            case '\f':
                while (peek() == ' ' || peek() == '\t' || peek() == '\f') advance();
                addToken(TokenType.WHITESPACE);
                break;

            case '\r':
                match('\n');
                addToken(TokenType.NEWLINE);
                newLine();
                break;

            case '\n':
                addToken(TokenType.NEWLINE);
                newLine();
                break;

            // 字符串
            case '"':
                // 使用 peek 检查多行字符串，避免消耗字符
                if (peek() == '"' && peekNext() == '"') {
                    advance(); // 消耗第二个 "
                    advance(); // 消耗第三个 "
                    multilineString();
                } else {
                    string();
                }
                break;

            // 字符
            case '\'':
                character();
                break;

            // 反引号标识符
            case '`':
                while (peek() != '`' && peek() != '\n' && !isAtEnd()) advance();
                if (peek() != '`') {
                    error("Unterminated backtick identifier");
                }
                advance();
                addToken(TokenType.IDENTIFIER);
                break;

            // 原始字符串 r"..."
            case 'r':
                if (peek() == '"') {
                    advance();
                    rawString();
                } else {
                    identifier();
                }
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    /** 消耗一个字符，必要时更新行号（用于可跨行的 Token 内部） */
    private void advanceTrackingLines() {
        char c = advance();
        if (c == '\n' || (c == '\r' && peek() != '\n')) {
            newLine();
        }
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, start, startLine, startColumn));
    }

    // === 复杂 Token 扫描 ===

    private void string() {
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n' || peek() == '\r') {
                error("Unterminated string");
            }
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
                advance();
            } else if (peek() == '$' && peekNext() == '{') {
                advance();
                advance();
                templateExpression();
            } else {
                advance();
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL);
    }

    /**
     * 扫描 ${...} 插值内部，直到匹配的 }（支持嵌套字符串与花括号）
     */
    private void templateExpression() {
        int depth = 1;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '{') {
                depth++;
                advance();
            } else if (c == '}') {
                advance();
                if (--depth == 0) return;
            } else if (c == '"') {
                advance();
                if (peek() == '"' && peekNext() == '"') {
                    advance();
                    advance();
                    skipMultilineBody();
                } else {
                    skipStringBody();
                }
            } else {
                advanceTrackingLines();
            }
        }
        error("Unterminated string template");
    }

    private void skipStringBody() {
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\') {
                advance();
            } else if (peek() == '$' && peekNext() == '{') {
                advance();
                advance();
                templateExpression();
                continue;
            }
            if (!isAtEnd()) advance();
        }
        if (isAtEnd()) {
            error("Unterminated string");
        }
        advance();
    }

    private void skipMultilineBody() {
        while (!isAtEnd()) {
            if (peek() == '"' && current + 2 < source.length()
                    && source.charAt(current + 1) == '"'
                    && source.charAt(current + 2) == '"') {
                advance();
                advance();
                advance();
                // 结尾多余的引号属于字符串内容
                while (peek() == '"') advance();
                return;
            }
            if (peek() == '$' && peekNext() == '{') {
                advance();
                advance();
                templateExpression();
                continue;
            }
            advanceTrackingLines();
        }
        error("Unterminated multiline string");
    }

    private void rawString() {
        while (peek() != '"' && !isAtEnd()) {
            advanceTrackingLines();
        }

        if (isAtEnd()) {
            error("Unterminated raw string");
        }

        advance(); // 闭合的 "
        addToken(TokenType.RAW_STRING);
    }

    private void multilineString() {
        skipMultilineBody();
        addToken(TokenType.MULTILINE_STRING);
    }

    private void character() {
        if (isAtEnd()) {
            error("Unterminated character literal");
        }

        if (peek() == '\\') {
            advance();
            if (peek() == 'u') {
                advance();
                for (int i = 0; i < 4; i++) {
                    if (isAtEnd()) {
                        error("Invalid unicode escape");
                    }
                    advance();
                }
            } else if (!isAtEnd()) {
                advance();
            }
        } else {
            advance();
        }

        if (peek() != '\'') {
            error("Unterminated character literal");
        }
        advance();

        addToken(TokenType.CHAR_LITERAL);
    }

    /** 消耗数字字符和下划线分隔符 */
    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    private void number() {
        // 检查进制
        if (source.charAt(start) == '0' && current < source.length()) {
            char next = Character.toLowerCase(peek());
            if (next == 'x') {
                advance();
                while (isHexDigit(peek()) || peek() == '_') advance();
                integerSuffix();
                return;
            } else if (next == 'b') {
                advance();
                while (peek() == '0' || peek() == '1' || peek() == '_') advance();
                integerSuffix();
                return;
            }
        }

        advanceDigits();

        boolean floating = false;
        // 小数部分（1..2 是区间，不是小数）
        if (peek() == '.' && isDigit(peekNext())) {
            floating = true;
            advance(); // 消费 .
            advanceDigits();
        }

        // 指数部分
        if (peek() == 'e' || peek() == 'E') {
            floating = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            advanceDigits();
        }

        if (peek() == 'f' || peek() == 'F') {
            advance();
            addToken(TokenType.FLOAT_LITERAL);
        } else if (floating) {
            addToken(TokenType.DOUBLE_LITERAL);
        } else {
            integerSuffix();
        }
    }

    private void integerSuffix() {
        if (peek() == 'u' || peek() == 'U') {
            advance();
        }
        if (peek() == 'L' || peek() == 'l') {
            advance();
            addToken(TokenType.LONG_LITERAL);
        } else {
            addToken(TokenType.INT_LITERAL);
        }
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) ||
               (c >= 'a' && c <= 'f') ||
               (c >= 'A' && c <= 'F');
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (peek() == '/' && peekNext() == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                depth--;
            } else {
                advanceTrackingLines();
            }
        }
        if (depth > 0) {
            error("Unterminated block comment");
        }
        addToken(TokenType.BLOCK_COMMENT);
    }

    private void error(String message) {
        throw new SyntaxException("Lexer error: " + message, startLine, startColumn);
    }
}
