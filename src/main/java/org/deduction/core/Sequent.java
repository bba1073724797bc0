package org.deduction.core;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 代表一个相继式：有序的前提列表与一个结论。
 * 此类是不可变的。
 */
@Getter
public final class Sequent {

    private final List<Formula> premises;
    private final Formula conclusion;
    private final int hashCode;

    private Sequent(List<Formula> premises, Formula conclusion) {
        Objects.requireNonNull(premises, "Premises cannot be null.");
        this.conclusion = Objects.requireNonNull(conclusion, "Conclusion cannot be null.");
        for (Formula premise : premises) {
            Objects.requireNonNull(premise, "Premise cannot be null.");
        }
        this.premises = Collections.unmodifiableList(new ArrayList<>(premises));
        this.hashCode = Objects.hash(this.premises, conclusion);
    }

    public static Sequent of(List<Formula> premises, Formula conclusion) {
        return new Sequent(premises, conclusion);
    }

    public boolean isQuantifierFree() {
        return !conclusion.containsQuantifier() && premises.stream().noneMatch(Formula::containsQuantifier);
    }

    /**
     * 前提在前、结论在后的全部公式。
     */
    public List<Formula> allFormulas() {
        List<Formula> all = new ArrayList<>(premises);
        all.add(conclusion);
        return all;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Sequent that = (Sequent) o;
        return premises.equals(that.premises) && conclusion.equals(that.conclusion);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        String left = premises.stream().map(Formula::toString).collect(Collectors.joining(", "));
        return left.isEmpty() ? "⊢ " + conclusion : left + " ⊢ " + conclusion;
    }
}
