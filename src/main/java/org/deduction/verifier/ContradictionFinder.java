package org.deduction.verifier;

import org.deduction.core.Formula;
import org.deduction.core.FormulaKind;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * 在一组公式中查找矛盾：⊥ 本身，或某个 ψ 与 ¬ψ 同时出现。
 */
public final class ContradictionFinder {

    private ContradictionFinder() {
    }

    public static boolean containsContradiction(Collection<Formula> formulas) {
        Set<Formula> seen = new HashSet<>(formulas);
        for (Formula f : seen) {
            if (f.isBottom()) {
                return true;
            }
            if (f.is(FormulaKind.NEGATION) && seen.contains(f.getChild())) {
                return true;
            }
        }
        return false;
    }
}
