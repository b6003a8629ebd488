package com.novafmt;

/**
 * 格式化失败的错误类别
 */
public enum ErrorKind {
    /** 源码无法解析为语法树 */
    SYNTAX,
    /** 变换的结构前提被破坏（如 import 块不连续） */
    STRUCTURAL,
    /** 输入包含保留的内部哨兵字符 */
    UNSUPPORTED_INPUT
}
