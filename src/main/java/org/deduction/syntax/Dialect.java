package org.deduction.syntax;

/**
 * 证明脚本方言。
 */
public enum Dialect {
    /** formula [RULE refs]，子证明由单独一行的 { 与 } 界定 */
    BRACKET("bracket"),
    /** formula :RULE refs，Show 块与按缩进嵌套的 Fitch 子证明 */
    COLON("colon");

    private final String label;

    Dialect(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
