package org.deduction.verifier;

import lombok.Getter;
import org.deduction.core.Formula;
import org.deduction.syntax.ScopeDecl;
import org.deduction.syntax.ScopeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 校验过程中作用域栈上的一帧。记录本层的假设、已确立的公式以及最后一个确立公式所在的行。
 */
@Getter
public final class ScopeFrame {

    private final ScopeDecl decl;
    /** Show 块的目标公式，其它帧为 null */
    private final Formula goal;
    private final List<Formula> formulas = new ArrayList<>();

    private int firstLine;
    private int lineCount;
    private Formula assumption;
    private Formula lastFormula;
    private int lastFormulaLine;

    public ScopeFrame(ScopeDecl decl, Formula goal) {
        this.decl = Objects.requireNonNull(decl, "Scope declaration cannot be null.");
        this.goal = goal;
    }

    public int getId() {
        return decl.getId();
    }

    public ScopeKind getKind() {
        return decl.getKind();
    }

    public boolean isEmpty() {
        return lineCount == 0;
    }

    /**
     * 记录本层的一行。formula 为 null 表示该行没有确立公式 (例如尚未关闭的 Show 头部)。
     */
    public void record(int line, Formula formula) {
        if (lineCount == 0) {
            firstLine = line;
        }
        lineCount++;
        lastFormula = formula;
        lastFormulaLine = line;
        if (formula != null) {
            formulas.add(formula);
        }
    }

    /**
     * 隐式关闭的 Show 块把目标交给父层：视作父层在 line 处确立了 formula，但不计为父层的一行。
     */
    public void settle(int line, Formula formula) {
        lastFormula = formula;
        lastFormulaLine = line;
        formulas.add(formula);
    }

    public void assume(Formula formula) {
        this.assumption = formula;
    }

    /**
     * 本层最后一行确立的公式；若最后一行属于更深的子证明或不带公式，返回 null。
     */
    public Formula conclusionAt(int lastLine) {
        return lastFormulaLine == lastLine ? lastFormula : null;
    }

    public List<Formula> getFormulas() {
        return Collections.unmodifiableList(formulas);
    }

    @Override
    public String toString() {
        return decl + (assumption == null ? "" : " assuming " + assumption);
    }
}
