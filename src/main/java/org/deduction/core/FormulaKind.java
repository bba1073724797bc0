package org.deduction.core;

/**
 * 公式 AST 节点的种类标签。
 * 二元联结词携带规范符号、ASCII 符号以及优先级 (数值越大结合越紧)。
 */
public enum FormulaKind {

    ATOM("", "", 6),
    PREDICATE("", "", 6),
    BOTTOM("⊥", "_|_", 6),
    NEGATION("¬", "~", 5),
    UNIVERSAL("∀", "forall ", 5),
    EXISTENTIAL("∃", "exists ", 5),
    CONJUNCTION("∧", "&", 4),
    DISJUNCTION("∨", "|", 3),
    IMPLICATION("→", "->", 2),
    BICONDITIONAL("↔", "<->", 1);

    private final String symbol;
    private final String asciiSymbol;
    private final int precedence;

    FormulaKind(String symbol, String asciiSymbol, int precedence) {
        this.symbol = symbol;
        this.asciiSymbol = asciiSymbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getAsciiSymbol() {
        return asciiSymbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isBinary() {
        return switch (this) {
            case CONJUNCTION, DISJUNCTION, IMPLICATION, BICONDITIONAL -> true;
            case ATOM, PREDICATE, BOTTOM, NEGATION, UNIVERSAL, EXISTENTIAL -> false;
        };
    }

    public boolean isQuantifier() {
        return this == UNIVERSAL || this == EXISTENTIAL;
    }
}
