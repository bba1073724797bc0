package org.deduction.hints;

import org.deduction.core.Formula;
import org.deduction.core.FormulaKind;
import org.deduction.rules.RuleKind;
import org.deduction.verifier.ProofState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 根据重放后可见的行给出规则：前提齐备的消去规则，加上当前目标适用的引入规则。
 * 部分证明无法解析或重放中出错时失败。
 */
public class StateRuleProvider implements RuleSuggestionProvider {

    @Override
    public String getName() {
        return "proof-state";
    }

    @Override
    public ProviderResult suggest(HintContext context) {
        ProofState state = context.getState();
        if (state == null) {
            return ProviderResult.failure(getName(), "The partial proof could not be parsed");
        }
        if (!state.isConsistent()) {
            return ProviderResult.failure(getName(), "Replay stopped at line " + state.getError().getLine());
        }
        Map<Formula, Integer> lineOf = new HashMap<>();
        state.getVisibleLines().forEach((number, formula) -> lineOf.putIfAbsent(formula, number));

        Set<RuleSuggestion> suggestions = new LinkedHashSet<>();
        Formula goal = context.currentGoal();
        Integer goalLine = lineOf.get(goal);
        if (goalLine != null) {
            suggestions.add(RuleSuggestion.of(RuleKind.REITERATION, goal, goalLine));
        }
        state.getVisibleLines().forEach((number, formula) -> eliminations(formula, number, lineOf, suggestions));
        suggestions.addAll(GoalShapeRuleProvider.forGoal(goal));
        return ProviderResult.success(getName(), new ArrayList<>(suggestions));
    }

    private static void eliminations(Formula f, int line, Map<Formula, Integer> lineOf, Set<RuleSuggestion> out) {
        switch (f.getKind()) {
            case CONJUNCTION -> {
                out.add(RuleSuggestion.of(RuleKind.CONJ_ELIM, f.getLeft(), line));
                out.add(RuleSuggestion.of(RuleKind.CONJ_ELIM, f.getRight(), line));
            }
            case IMPLICATION -> {
                Integer antecedent = lineOf.get(f.getLeft());
                if (antecedent != null) {
                    out.add(RuleSuggestion.of(RuleKind.MODUS_PONENS, f.getRight(), line, antecedent));
                }
                Integer denial = lineOf.get(Formula.not(f.getRight()));
                if (denial != null) {
                    out.add(RuleSuggestion.of(RuleKind.MODUS_TOLLENS, Formula.not(f.getLeft()), line, denial));
                }
            }
            case DISJUNCTION -> {
                Integer notLeft = lineOf.get(Formula.not(f.getLeft()));
                if (notLeft != null) {
                    out.add(RuleSuggestion.of(RuleKind.DISJ_SYLLOGISM, f.getRight(), line, notLeft));
                }
                Integer notRight = lineOf.get(Formula.not(f.getRight()));
                if (notRight != null) {
                    out.add(RuleSuggestion.of(RuleKind.DISJ_SYLLOGISM, f.getLeft(), line, notRight));
                }
                out.add(RuleSuggestion.of(RuleKind.DISJ_ELIM, null, line));
            }
            case BICONDITIONAL -> {
                out.add(RuleSuggestion.of(RuleKind.BICOND_ELIM, Formula.implies(f.getLeft(), f.getRight()), line));
                out.add(RuleSuggestion.of(RuleKind.BICOND_ELIM, Formula.implies(f.getRight(), f.getLeft()), line));
            }
            case NEGATION -> {
                if (f.getChild().is(FormulaKind.NEGATION)) {
                    out.add(RuleSuggestion.of(RuleKind.DOUBLE_NEG_ELIM, f.getChild().getChild(), line));
                }
                Integer positive = lineOf.get(f.getChild());
                if (positive != null) {
                    out.add(RuleSuggestion.of(RuleKind.NEG_ELIM, Formula.bottom(), positive, line));
                }
            }
            case BOTTOM -> out.add(RuleSuggestion.of(RuleKind.BOTTOM_ELIM, null, line));
            case UNIVERSAL -> out.add(RuleSuggestion.of(RuleKind.UNIV_ELIM, null, line));
            case EXISTENTIAL -> out.add(RuleSuggestion.of(RuleKind.EXIST_ELIM, null, line));
            case ATOM, PREDICATE -> {
            }
        }
    }
}
