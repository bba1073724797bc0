package org.deduction.solver;

/**
 * 证明搜索的结局。除 FOUND 外都只说明在给定界限内没有找到证明，不说明相继式不可证。
 */
public enum SolverStatus {
    FOUND,
    /** 直到 maxDepth 都没有找到 */
    NOT_FOUND_WITHIN_BOUND,
    /** 搜索节点数达到上限 */
    NODE_BUDGET_EXHAUSTED,
    CANCELLED,
    /** 前提或结论无法解析 */
    INVALID_INPUT
}
