package org.deduction.symbolic;

/**
 * 相继式的语义分类。
 */
public enum SemanticStatus {
    /** 前提与结论之否定不可同时满足 */
    VALID,
    /** 存在反模型 */
    INVALID,
    /** 含量词，不在命题判定范围内 */
    NOT_APPLICABLE,
    /** 变量或子句数超出上限，或请求被取消；不说明有效或无效 */
    BOUND_EXCEEDED,
    /** 证明已被接受，未做语义分析 */
    NOT_CHECKED
}
