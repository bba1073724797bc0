package org.deduction.solver;

import org.deduction.core.Formula;
import org.deduction.rules.RuleKind;
import org.deduction.syntax.LineRange;

import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 搜索过程中逐行构造的证明。
 * <p>
 * 维护一个作用域栈，每层记录本层已确立的公式到行号的映射；查找从最内层向外进行，
 * 已关闭子证明中的行不再可见。{@link #mark()} 与 {@link #rollback(Mark)} 用于撤销一次失败的尝试。
 */
final class ProofBuilder {

    private final List<BuiltLine> lines = new ArrayList<>();
    private final Deque<Scope> scopes = new ArrayDeque<>();

    ProofBuilder(List<Formula> premises) {
        scopes.push(new Scope(1));
        for (Formula premise : premises) {
            add(premise, RuleKind.PREMISE, List.of(), List.of());
        }
    }

    int add(Formula formula, RuleKind rule, List<Integer> cited, List<LineRange> ranges) {
        int number = lines.size() + 1;
        lines.add(new BuiltLine(number, formula, rule, cited, ranges, scopes.size() - 1));
        scopes.peek().known.putIfAbsent(formula, number);
        return number;
    }

    int add(Formula formula, RuleKind rule, Integer... cited) {
        return add(formula, rule, List.of(cited), List.of());
    }

    /**
     * 开启一个以 assumption 为假设的子证明，返回假设所在的行号。
     */
    int open(Formula assumption) {
        scopes.push(new Scope(lines.size() + 1));
        return add(assumption, RuleKind.ASSUMPTION, List.of(), List.of());
    }

    /**
     * 关闭最内层子证明，返回其行区间。
     */
    LineRange close() {
        if (scopes.size() <= 1) {
            throw new IllegalStateException("ProofBuilder: no open subproof to close");
        }
        Scope scope = scopes.pop();
        return LineRange.of(scope.start, lines.size());
    }

    Integer lookup(Formula formula) {
        for (Scope scope : scopes) {
            Integer number = scope.known.get(formula);
            if (number != null) {
                return number;
            }
        }
        return null;
    }

    boolean isVisible(Formula formula) {
        return lookup(formula) != null;
    }

    /**
     * 当前可见的全部公式及其行号，由外到内。返回的是快照。
     */
    List<Map.Entry<Formula, Integer>> visible() {
        List<Map.Entry<Formula, Integer>> result = new ArrayList<>();
        Iterator<Scope> it = scopes.descendingIterator();
        while (it.hasNext()) {
            for (Map.Entry<Formula, Integer> entry : it.next().known.entrySet()) {
                result.add(new AbstractMap.SimpleImmutableEntry<>(entry));
            }
        }
        return result;
    }

    /**
     * 最后一行是否就是当前作用域内的 formula。
     */
    boolean endsWith(Formula formula) {
        if (lines.isEmpty()) {
            return false;
        }
        BuiltLine last = lines.get(lines.size() - 1);
        return last.getDepth() == scopes.size() - 1 && last.getFormula().equals(formula)
                && last.getNumber() >= scopes.peek().start;
    }

    int depth() {
        return scopes.size() - 1;
    }

    boolean isPremiseLine(int number) {
        return lines.get(number - 1).getRule() == RuleKind.PREMISE;
    }

    Mark mark() {
        return new Mark(lines.size(), scopes.size());
    }

    void rollback(Mark mark) {
        while (scopes.size() > mark.scopeCount) {
            scopes.pop();
        }
        while (lines.size() > mark.lineCount) {
            lines.remove(lines.size() - 1);
        }
        for (Scope scope : scopes) {
            scope.known.values().removeIf(number -> number > mark.lineCount);
        }
    }

    List<BuiltLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    static final class Mark {
        private final int lineCount;
        private final int scopeCount;

        private Mark(int lineCount, int scopeCount) {
            this.lineCount = lineCount;
            this.scopeCount = scopeCount;
        }
    }

    private static final class Scope {
        private final int start;
        private final Map<Formula, Integer> known = new LinkedHashMap<>();

        private Scope(int start) {
            this.start = start;
        }
    }
}
