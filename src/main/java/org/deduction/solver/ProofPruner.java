package org.deduction.solver;

import org.deduction.rules.RuleKind;
import org.deduction.syntax.LineRange;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 删除最终行用不到的行并重新编号。
 * 前提行总是保留；被区间引用的子证明保留其假设行与最后一行，中间只保留被引用到的行。
 */
final class ProofPruner {

    private ProofPruner() {
    }

    static List<BuiltLine> prune(List<BuiltLine> lines, int finalLine) {
        boolean[] needed = new boolean[lines.size() + 1];
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(finalLine);
        for (BuiltLine line : lines) {
            if (line.getRule() == RuleKind.PREMISE) {
                pending.push(line.getNumber());
            }
        }
        while (!pending.isEmpty()) {
            int number = pending.pop();
            if (needed[number]) {
                continue;
            }
            needed[number] = true;
            BuiltLine line = lines.get(number - 1);
            for (int cited : line.getLines()) {
                pending.push(cited);
            }
            for (LineRange range : line.getRanges()) {
                pending.push(range.getStart());
                pending.push(range.getEnd());
            }
        }
        Map<Integer, Integer> renumbered = new HashMap<>();
        List<BuiltLine> kept = new ArrayList<>();
        for (BuiltLine line : lines) {
            if (!needed[line.getNumber()] || line.getNumber() > finalLine) {
                continue;
            }
            int number = kept.size() + 1;
            renumbered.put(line.getNumber(), number);
            List<Integer> cited = new ArrayList<>();
            for (int old : line.getLines()) {
                cited.add(renumbered.get(old));
            }
            List<LineRange> ranges = new ArrayList<>();
            for (LineRange old : line.getRanges()) {
                ranges.add(LineRange.of(renumbered.get(old.getStart()), renumbered.get(old.getEnd())));
            }
            kept.add(line.renumber(number, cited, ranges));
        }
        return kept;
    }
}
