package org.deduction.verifier;

import org.deduction.core.Formula;
import org.deduction.core.FormulaKind;
import org.deduction.errors.ErrorKind;
import org.deduction.rules.RuleCheck;
import org.deduction.rules.RuleKind;

import java.util.List;

/**
 * 检查关闭 Show 块的标记是否与块的内容相符。
 * <ul>
 *     <li>:CD 要求目标为 A→B，块以假设 A 开头，并且 B 在块内确立 (引用时须为被引用的行)。</li>
 *     <li>:DD 要求目标本身在块内确立，且块内没有假设。</li>
 *     <li>:ID 要求块假设目标的否定 (或目标为 ¬A 时假设 A)，并在引用的行或块内得到矛盾。</li>
 * </ul>
 * →I、¬I、PBC 作为标记时分别按 :CD、:ID 的对应情形检查。
 */
public final class ShowBlockCloser {

    private ShowBlockCloser() {
    }

    /**
     * @param frame  即将关闭的 Show 块。
     * @param marker 关闭标记的规则。
     * @param cited  标记引用的行 (区间按其末行计) 的公式，按书写顺序。
     */
    public static RuleCheck close(ScopeFrame frame, RuleKind marker, List<Formula> cited) {
        Formula goal = frame.getGoal();
        if (!marker.isShowClosing()) {
            return RuleCheck.fail(ErrorKind.SCOPE_ERROR,
                    "':" + marker.getTag() + "' cannot close a Show block; use :CD, :DD or :ID");
        }
        List<Formula> evidence = cited.isEmpty() ? frame.getFormulas() : cited;
        return switch (marker) {
            case COND_INTRO -> conditional(frame, goal, evidence);
            case DIRECT_DERIVATION -> direct(frame, goal, evidence, cited.isEmpty());
            case NEG_INTRO -> indirect(frame, goal, evidence, true, false);
            case INDIRECT_PROOF -> indirect(frame, goal, evidence, false, true);
            case INDIRECT_DERIVATION -> indirect(frame, goal, evidence, true, true);
            default -> RuleCheck.fail(ErrorKind.SCOPE_ERROR, "':" + marker.getTag() + "' cannot close a Show block");
        };
    }

    /**
     * 没有关闭标记的 Show 块在结束时按 DD 隐式关闭：块的最后一行必须就是目标，且块内没有假设。
     */
    public static RuleCheck closeImplicitly(ScopeFrame frame, int lastLine) {
        Formula goal = frame.getGoal();
        if (frame.getAssumption() != null) {
            return undischarged(frame);
        }
        if (goal.equals(frame.conclusionAt(lastLine))) {
            return RuleCheck.ok();
        }
        return RuleCheck.fail(ErrorKind.SCOPE_ERROR, "Show " + goal + " was never closed");
    }

    private static RuleCheck direct(ScopeFrame frame, Formula goal, List<Formula> evidence, boolean uncited) {
        if (frame.getAssumption() != null) {
            return undischarged(frame);
        }
        return RuleCheck.require(evidence.contains(goal),
                uncited ? "The Show block never derives " + goal : "The cited line is not " + goal);
    }

    // DD 不解除假设
    private static RuleCheck undischarged(ScopeFrame frame) {
        return RuleCheck.fail(ErrorKind.SCOPE_ERROR, "Show " + frame.getGoal() + " assumes "
                + frame.getAssumption() + ", which DD cannot discharge; close it with :CD or :ID");
    }

    private static RuleCheck conditional(ScopeFrame frame, Formula goal, List<Formula> evidence) {
        if (!goal.is(FormulaKind.IMPLICATION)) {
            return RuleCheck.violation("CD closes a Show of a conditional, not " + goal);
        }
        if (!goal.getLeft().equals(frame.getAssumption())) {
            return RuleCheck.violation("CD needs the Show block to assume " + goal.getLeft()
                    + (frame.getAssumption() == null ? "" : ", got " + frame.getAssumption()));
        }
        return RuleCheck.require(evidence.contains(goal.getRight()),
                "CD needs " + goal.getRight() + " to be derived in the Show block");
    }

    private static RuleCheck indirect(ScopeFrame frame, Formula goal, List<Formula> evidence,
                                      boolean allowNegation, boolean allowRefutation) {
        Formula assumption = frame.getAssumption();
        boolean negates = allowNegation && goal.is(FormulaKind.NEGATION) && goal.getChild().equals(assumption);
        boolean refutes = allowRefutation && Formula.not(goal).equals(assumption);
        if (!negates && !refutes) {
            return RuleCheck.violation("An indirect derivation of " + goal + " must assume "
                    + (goal.is(FormulaKind.NEGATION) && allowNegation ? goal.getChild() : Formula.not(goal)));
        }
        return RuleCheck.require(ContradictionFinder.containsContradiction(evidence),
                "The Show block does not reach a contradiction");
    }
}
