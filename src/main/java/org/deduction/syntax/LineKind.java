package org.deduction.syntax;

public enum LineKind {
    PREMISE,
    FORMULA,
    /** Show φ 头部行 */
    SHOW,
    /** :CD n 之类只关闭 Show 块、不带公式的行 */
    CLOSING
}
