package org.deduction.syntax;

import lombok.Getter;
import org.deduction.rules.RuleKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 一行的依据：规则以及按书写顺序引用的行号和子证明区间。
 * ruleText 保留原始拼写，仅用于报错，不参与相等比较。
 */
@Getter
public final class Justification {

    private final RuleKind rule;
    private final String ruleText;
    private final List<Integer> lines;
    private final List<LineRange> ranges;

    private Justification(RuleKind rule, String ruleText, List<Integer> lines, List<LineRange> ranges) {
        this.rule = Objects.requireNonNull(rule, "Rule cannot be null.");
        this.ruleText = ruleText == null ? rule.getTag() : ruleText;
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
        this.ranges = Collections.unmodifiableList(new ArrayList<>(ranges));
    }

    public static Justification of(RuleKind rule, String ruleText, List<Integer> lines, List<LineRange> ranges) {
        return new Justification(rule, ruleText, lines, ranges);
    }

    public static Justification of(RuleKind rule, List<Integer> lines, List<LineRange> ranges) {
        return new Justification(rule, null, lines, ranges);
    }

    public static Justification bare(RuleKind rule) {
        return new Justification(rule, null, Collections.emptyList(), Collections.emptyList());
    }

    public boolean hasCitations() {
        return !lines.isEmpty() || !ranges.isEmpty();
    }

    /**
     * 以规范形式渲染引用部分，如 "1,2" 或 "3-5,7"。
     */
    public String citationText() {
        return Stream.concat(lines.stream().map(String::valueOf), ranges.stream().map(LineRange::toString))
                .collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Justification that = (Justification) o;
        return rule == that.rule && lines.equals(that.lines) && ranges.equals(that.ranges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rule, lines, ranges);
    }

    @Override
    public String toString() {
        String refs = citationText();
        return refs.isEmpty() ? rule.getTag() : rule.getTag() + " " + refs;
    }
}
