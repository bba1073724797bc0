package org.deduction.verifier;

import lombok.Getter;
import org.deduction.core.Formula;
import org.deduction.syntax.LineRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 已关闭的子证明。
 * assumption 为开头的 AS 行公式；
 * conclusion 为最后一行的公式，仅当最后一行位于该子证明自身的作用域时存在；
 * formulas 为其自身作用域内已确立的全部公式。
 */
@Getter
public final class Subproof {

    private final int scopeId;
    private final int parentId;
    private final int start;
    private final int end;
    private final Formula assumption;
    private final Formula conclusion;
    private final List<Formula> formulas;

    public Subproof(int scopeId, int parentId, int start, int end, Formula assumption, Formula conclusion,
                    List<Formula> formulas) {
        this.scopeId = scopeId;
        this.parentId = parentId;
        this.start = start;
        this.end = end;
        this.assumption = assumption;
        this.conclusion = conclusion;
        this.formulas = Collections.unmodifiableList(new ArrayList<>(formulas));
    }

    public LineRange range() {
        return LineRange.of(start, end);
    }

    public boolean hasAssumption() {
        return assumption != null;
    }

    public boolean hasConclusion() {
        return conclusion != null;
    }

    /**
     * 子证明自身作用域内是否出现 ⊥，或同时出现某个 ψ 与 ¬ψ。
     */
    public boolean reachesContradiction() {
        return ContradictionFinder.containsContradiction(formulas);
    }

    @Override
    public String toString() {
        return "Subproof[" + start + "-" + end + ", assume " + assumption + ", ends " + conclusion + "]";
    }
}
