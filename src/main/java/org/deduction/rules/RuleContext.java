package org.deduction.rules;

import lombok.Getter;
import org.deduction.core.Formula;
import org.deduction.verifier.Subproof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 校验一行时交给规则校验器的全部信息。
 * citedFormulas 与 citedSubproofs 保持书写顺序；
 * openAssumptions 为当前仍未关闭的各层假设，premises 为声明的前提。
 */
@Getter
public final class RuleContext {

    private final int line;
    private final RuleKind rule;
    private final Formula formula;
    private final List<Formula> citedFormulas;
    private final List<Subproof> citedSubproofs;
    private final List<Formula> openAssumptions;
    private final List<Formula> premises;

    public RuleContext(int line, RuleKind rule, Formula formula, List<Formula> citedFormulas,
                       List<Subproof> citedSubproofs, List<Formula> openAssumptions, List<Formula> premises) {
        this.line = line;
        this.rule = Objects.requireNonNull(rule, "Rule cannot be null.");
        this.formula = Objects.requireNonNull(formula, "Formula cannot be null.");
        this.citedFormulas = Collections.unmodifiableList(new ArrayList<>(citedFormulas));
        this.citedSubproofs = Collections.unmodifiableList(new ArrayList<>(citedSubproofs));
        this.openAssumptions = Collections.unmodifiableList(new ArrayList<>(openAssumptions));
        this.premises = Collections.unmodifiableList(new ArrayList<>(premises));
    }

    public Formula cited(int index) {
        return citedFormulas.get(index);
    }

    public Subproof subproof(int index) {
        return citedSubproofs.get(index);
    }

    /**
     * 若引用的行数与区间数不符合要求，返回描述数量问题的拒绝原因；符合时返回 null。
     */
    public String arityProblem(int expectedLines, int expectedRanges) {
        if (citedFormulas.size() == expectedLines && citedSubproofs.size() == expectedRanges) {
            return null;
        }
        return rule.getTag() + " requires " + describe(expectedLines, "line") + " and "
                + describe(expectedRanges, "subproof range") + ", got "
                + describe(citedFormulas.size(), "line") + " and " + describe(citedSubproofs.size(), "subproof range");
    }

    private static String describe(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }

    /**
     * 前提与仍然有效的假设，量词规则的新鲜性检查以此为上下文。
     */
    public List<Formula> context() {
        List<Formula> all = new ArrayList<>(premises);
        all.addAll(openAssumptions);
        return all;
    }
}
