package org.deduction.hints;

import lombok.Getter;
import org.deduction.core.Formula;
import org.deduction.rules.RuleKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一条可用规则：规则本身、可引用的行，以及能推出的公式 (引入规则或需要子证明时可能未知)。
 */
@Getter
public final class RuleSuggestion {

    private final RuleKind rule;
    private final List<Integer> citedLines;
    private final Formula result;

    private RuleSuggestion(RuleKind rule, List<Integer> citedLines, Formula result) {
        this.rule = Objects.requireNonNull(rule, "Rule cannot be null.");
        this.citedLines = Collections.unmodifiableList(new ArrayList<>(citedLines));
        this.result = result;
    }

    public static RuleSuggestion of(RuleKind rule, Formula result, Integer... citedLines) {
        return new RuleSuggestion(rule, List.of(citedLines), result);
    }

    /**
     * 只给出规则，不涉及具体的行。
     */
    public static RuleSuggestion rule(RuleKind rule) {
        return new RuleSuggestion(rule, List.of(), null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RuleSuggestion that = (RuleSuggestion) o;
        return rule == that.rule && citedLines.equals(that.citedLines) && Objects.equals(result, that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rule, citedLines, result);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(rule.getTag());
        if (!citedLines.isEmpty()) {
            sb.append(' ').append(citedLines);
        }
        if (result != null) {
            sb.append(" ⇒ ").append(result);
        }
        return sb.toString();
    }
}
