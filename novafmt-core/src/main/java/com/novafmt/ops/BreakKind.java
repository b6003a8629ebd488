package com.novafmt.ops;

/**
 * 断点种类
 */
public enum BreakKind {
    /** 不换行的分隔，始终输出平铺文本 */
    SPACE,
    /** 所在组展开时换行，否则输出平铺文本 */
    LINE,
    /** 总是换行 */
    FORCED_LINE
}
