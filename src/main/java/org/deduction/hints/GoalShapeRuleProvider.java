package org.deduction.hints;

import org.deduction.core.Formula;
import org.deduction.rules.RuleKind;

import java.util.ArrayList;
import java.util.List;

/**
 * 只看目标公式的主联结词给出引入规则。总是成功，作为提供者链的最后一环。
 */
public class GoalShapeRuleProvider implements RuleSuggestionProvider {

    @Override
    public String getName() {
        return "goal-shape";
    }

    @Override
    public ProviderResult suggest(HintContext context) {
        return ProviderResult.success(getName(), forGoal(context.currentGoal()));
    }

    /**
     * 适合以 goal 为结论的引入规则；PBC 对任何目标都可用，放在最后。
     */
    static List<RuleSuggestion> forGoal(Formula goal) {
        List<RuleSuggestion> suggestions = new ArrayList<>();
        switch (goal.getKind()) {
            case CONJUNCTION -> suggestions.add(RuleSuggestion.rule(RuleKind.CONJ_INTRO));
            case DISJUNCTION -> suggestions.add(RuleSuggestion.rule(RuleKind.DISJ_INTRO));
            case IMPLICATION -> suggestions.add(RuleSuggestion.rule(RuleKind.COND_INTRO));
            case BICONDITIONAL -> suggestions.add(RuleSuggestion.rule(RuleKind.BICOND_INTRO));
            case NEGATION -> suggestions.add(RuleSuggestion.rule(RuleKind.NEG_INTRO));
            case UNIVERSAL -> suggestions.add(RuleSuggestion.rule(RuleKind.UNIV_INTRO));
            case EXISTENTIAL -> suggestions.add(RuleSuggestion.rule(RuleKind.EXIST_INTRO));
            case BOTTOM -> suggestions.add(RuleSuggestion.rule(RuleKind.NEG_ELIM));
            case ATOM, PREDICATE -> {
            }
        }
        if (!goal.isBottom()) {
            suggestions.add(RuleSuggestion.rule(RuleKind.INDIRECT_PROOF));
        }
        return suggestions;
    }
}
