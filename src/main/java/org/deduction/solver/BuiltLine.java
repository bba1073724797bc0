package org.deduction.solver;

import lombok.Getter;
import org.deduction.core.Formula;
import org.deduction.rules.RuleKind;
import org.deduction.syntax.LineRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 求解器构造出的一行证明。depth 为子证明嵌套层数，顶层为 0。
 */
@Getter
public final class BuiltLine {

    private final int number;
    private final Formula formula;
    private final RuleKind rule;
    private final List<Integer> lines;
    private final List<LineRange> ranges;
    private final int depth;

    public BuiltLine(int number, Formula formula, RuleKind rule, List<Integer> lines, List<LineRange> ranges,
                     int depth) {
        this.number = number;
        this.formula = Objects.requireNonNull(formula, "Formula cannot be null.");
        this.rule = Objects.requireNonNull(rule, "Rule cannot be null.");
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
        this.ranges = Collections.unmodifiableList(new ArrayList<>(ranges));
        this.depth = depth;
    }

    /**
     * 重新编号后的副本。
     */
    BuiltLine renumber(int newNumber, List<Integer> newLines, List<LineRange> newRanges) {
        return new BuiltLine(newNumber, formula, rule, newLines, newRanges, depth);
    }

    /**
     * 计入证明长度的行：前提与假设不计。
     */
    public boolean countsTowardLength() {
        return rule != RuleKind.PREMISE && rule != RuleKind.ASSUMPTION;
    }

    @Override
    public String toString() {
        return number + ". " + "  ".repeat(depth) + formula + " [" + rule.getTag()
                + (lines.isEmpty() && ranges.isEmpty() ? "" : " ") + citations() + "]";
    }

    String citations() {
        List<String> parts = new ArrayList<>();
        for (Integer line : lines) {
            parts.add(String.valueOf(line));
        }
        for (LineRange range : ranges) {
            parts.add(range.toString());
        }
        return String.join(",", parts);
    }
}
