package org.deduction.syntax;

import lombok.Getter;
import org.deduction.core.Formula;

import java.util.Objects;

/**
 * 证明脚本中的一行。
 * CLOSING 行没有公式，closesScope 指向被它关闭的 SHOW 作用域；其它行的 closesScope 为 -1。
 * sourceText 仅用于报错，不参与相等比较。
 */
@Getter
public final class ProofLine {

    public static final int NO_SCOPE = -1;

    private final int number;
    private final LineKind kind;
    private final Formula formula;
    private final Justification justification;
    private final int scopeId;
    private final int depth;
    private final int closesScope;
    private final String sourceText;

    public ProofLine(int number, LineKind kind, Formula formula, Justification justification,
                     int scopeId, int depth, int closesScope, String sourceText) {
        if (number <= 0) {
            throw new IllegalArgumentException("Line number must be positive: " + number);
        }
        this.number = number;
        this.kind = Objects.requireNonNull(kind, "Line kind cannot be null.");
        this.justification = Objects.requireNonNull(justification, "Justification cannot be null.");
        if (kind != LineKind.CLOSING) {
            Objects.requireNonNull(formula, "Formula cannot be null on a " + kind + " line.");
        }
        this.formula = formula;
        this.scopeId = scopeId;
        this.depth = depth;
        this.closesScope = closesScope;
        this.sourceText = sourceText == null ? "" : sourceText;
    }

    public boolean isPremise() {
        return kind == LineKind.PREMISE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ProofLine that = (ProofLine) o;
        return number == that.number
                && kind == that.kind
                && scopeId == that.scopeId
                && depth == that.depth
                && closesScope == that.closesScope
                && Objects.equals(formula, that.formula)
                && justification.equals(that.justification);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, kind, formula, justification, scopeId, depth, closesScope);
    }

    @Override
    public String toString() {
        String body = switch (kind) {
            case CLOSING -> ":" + justification;
            case SHOW -> "Show " + formula;
            case PREMISE, FORMULA -> formula + " [" + justification + "]";
        };
        return number + ". " + "  ".repeat(depth) + body;
    }
}
