package org.deduction.syntax;

public enum ScopeKind {
    ROOT,
    /** 由假设开启的 Fitch 子证明 */
    SUBPROOF,
    /** Show φ 之后的证明块，由关闭标记或隐式 DD 结束 */
    SHOW
}
