package org.deduction.hints;

import lombok.Getter;
import org.deduction.rules.RuleKind;
import org.deduction.verifier.VerificationError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 可用规则查询的回答。rules 按首次出现的顺序去重；provider 为给出回答的提供者；
 * 部分证明本身有问题时 error 说明问题所在。
 */
@Getter
public final class ApplicableRules {

    private final List<RuleKind> rules;
    private final List<RuleSuggestion> suggestions;
    private final String provider;
    private final int nextLine;
    private final int depth;
    private final VerificationError error;

    public ApplicableRules(List<RuleSuggestion> suggestions, String provider, int nextLine, int depth,
                           VerificationError error) {
        this.suggestions = Collections.unmodifiableList(new ArrayList<>(suggestions));
        Set<RuleKind> distinct = new LinkedHashSet<>();
        for (RuleSuggestion suggestion : suggestions) {
            distinct.add(suggestion.getRule());
        }
        this.rules = List.copyOf(distinct);
        this.provider = Objects.requireNonNull(provider, "Provider name cannot be null.");
        this.nextLine = nextLine;
        this.depth = depth;
        this.error = error;
    }

    public List<String> tags() {
        return rules.stream().map(RuleKind::getTag).toList();
    }

    public Optional<VerificationError> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "ApplicableRules{" + tags() + " via " + provider + ", next=" + nextLine
                + (error == null ? "" : ", error=" + error) + '}';
    }
}
