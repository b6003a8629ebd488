package com.novafmt.ast;

/**
 * 语法树节点种类（封闭集合，格式化器按此穷举分派）
 */
public enum NodeKind {
    /** 叶子：单个代码 Token */
    TOKEN,

    // === 文件结构 ===
    FILE,
    PACKAGE_HEADER,
    IMPORT_LIST,
    IMPORT_DIRECTIVE,
    NAME_PATH,

    // === 声明 ===
    MODIFIER_LIST,
    ANNOTATION,
    CLASS,
    OBJECT,
    CLASS_BODY,
    ENUM_ENTRY,
    PRIMARY_CONSTRUCTOR,
    SECONDARY_CONSTRUCTOR,
    INITIALIZER,
    SUPER_TYPE_LIST,
    SUPER_TYPE,
    FUNCTION,
    PROPERTY,
    PROPERTY_ACCESSOR,
    TYPE_ALIAS,
    PARAMETER_LIST,
    PARAMETER,
    DESTRUCTURING,
    TYPE_PARAMETERS,
    TYPE_PARAMETER,

    // === 类型 ===
    TYPE_REFERENCE,
    USER_TYPE,
    TYPE_ARGUMENTS,
    FUNCTION_TYPE,
    PARENTHESIZED_TYPE,

    // === 语句 ===
    BLOCK,
    ASSIGNMENT,
    RETURN,
    THROW,
    JUMP,
    IF,
    WHILE,
    DO_WHILE,
    FOR,
    WHEN,
    WHEN_ENTRY,
    WHEN_CONDITION,
    TRY,
    CATCH,
    FINALLY,
    LABELED,

    // === 表达式 ===
    BINARY,
    IS_EXPRESSION,
    AS_EXPRESSION,
    PREFIX,
    POSTFIX,
    CALL,
    VALUE_ARGUMENTS,
    VALUE_ARGUMENT,
    INDEX,
    DOT_QUALIFIED,
    CALLABLE_REFERENCE,
    PARENTHESIZED,
    THIS_EXPRESSION,
    LAMBDA,
    LAMBDA_PARAMETERS,
    OBJECT_LITERAL
}
