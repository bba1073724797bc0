package org.deduction.symbolic;

/**
 * 可满足性查询的结果状态。UNKNOWN 表示查询因取消或超时而中止。
 */
public enum SatStatus {
    SATISFIABLE,
    UNSATISFIABLE,
    UNKNOWN
}
