package com.novafmt.lexer;

/**
 * Nova 词法单元类型
 *
 * <p>软关键词（data、override、get、set、by 等）按 IDENTIFIER 扫描，由解析器按上下文识别。</p>
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    LONG_LITERAL,
    FLOAT_LITERAL,
    DOUBLE_LITERAL,
    CHAR_LITERAL,
    STRING_LITERAL,
    RAW_STRING,             // r"..."
    MULTILINE_STRING,       // """..."""

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 声明 ===
    KW_VAL, KW_VAR, KW_FUN, KW_CLASS, KW_INTERFACE,
    KW_OBJECT, KW_TYPEALIAS, KW_PACKAGE, KW_IMPORT,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELSE, KW_WHEN, KW_FOR, KW_WHILE,
    KW_DO, KW_RETURN, KW_BREAK, KW_CONTINUE, KW_THROW,
    KW_TRY,

    // === 关键词 - 类型 ===
    KW_IS, KW_AS, KW_IN,
    KW_TRUE, KW_FALSE, KW_NULL,

    // === 关键词 - 特殊 ===
    KW_THIS, KW_SUPER,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %
    INC,            // ++
    DEC,            // --

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    REF_EQ,         // ===
    REF_NE,         // !==
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 操作符 - 赋值 ===
    ASSIGN,                 // =
    PLUS_ASSIGN,            // +=
    MINUS_ASSIGN,           // -=
    MUL_ASSIGN,             // *=
    DIV_ASSIGN,             // /=
    MOD_ASSIGN,             // %=

    // === 操作符 - 空安全 ===
    QUESTION,           // ?
    SAFE_DOT,           // ?.
    ELVIS,              // ?:
    NOT_NULL,           // !!

    // === 操作符 - 范围 ===
    RANGE,              // ..
    RANGE_EXCLUSIVE,    // ..<

    // === 操作符 - 特殊 ===
    DOUBLE_COLON,   // ::
    ARROW,          // ->
    AT,             // @

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    DOT,            // .
    COLON,          // :
    SEMICOLON,      // ;

    // === 空白与注释 ===
    WHITESPACE,     // 空格、制表符
    NEWLINE,        // \n、\r\n、\r
    LINE_COMMENT,   // // ...
    BLOCK_COMMENT,  // /* ... */（含文档注释）

    // === 特殊 ===
    EOF;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为赋值操作符
     */
    public boolean isAssignmentOp() {
        switch (this) {
            case ASSIGN:
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
            case MUL_ASSIGN:
            case DIV_ASSIGN:
            case MOD_ASSIGN:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为字面量
     */
    public boolean isLiteral() {
        switch (this) {
            case INT_LITERAL:
            case LONG_LITERAL:
            case FLOAT_LITERAL:
            case DOUBLE_LITERAL:
            case CHAR_LITERAL:
            case STRING_LITERAL:
            case RAW_STRING:
            case MULTILINE_STRING:
            case KW_TRUE:
            case KW_FALSE:
            case KW_NULL:
                return true;
            default:
                return false;
        }
    }

    /**
     * 所属大类
     */
    public TokenKind kind() {
        switch (this) {
            case WHITESPACE:
            case NEWLINE:
                return TokenKind.WHITESPACE;
            case LINE_COMMENT:
            case BLOCK_COMMENT:
                return TokenKind.COMMENT;
            case EOF:
                return TokenKind.EOF;
            default:
                return TokenKind.CODE;
        }
    }
}
