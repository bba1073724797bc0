package org.deduction.symbolic;

import org.deduction.utils.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * 完备的 DPLL 判定过程：单元传播加按时间顺序回溯。
 * 决策与回溯用显式的轨迹和决策栈表示，不使用递归。
 * 每次决策前查询取消令牌，被取消时返回 UNKNOWN。
 */
public class DpllSolver implements SatisfiabilityBackend {

    private static final Logger logger = LoggerFactory.getLogger(DpllSolver.class);

    private static final int UNASSIGNED = 0;

    @Override
    public SatResult solve(ClauseSet clauseSet, CancellationToken token) {
        Objects.requireNonNull(clauseSet, "Clause set cannot be null.");
        Objects.requireNonNull(token, "Cancellation token cannot be null.");
        Search search = new Search(clauseSet.getClauses(), clauseSet.getVariableCount());
        SatResult result = search.run(token);
        logger.debug("DpllSolver.solve: {} 个变量, {} 个子句, {} 次决策, 结果 {}",
                clauseSet.getVariableCount(), clauseSet.getClauseCount(), search.decisions, result.getStatus());
        return result;
    }

    @Override
    public String getName() {
        return SatBackendKind.DPLL.getLabel();
    }

    /**
     * 一次求解的可变状态。values[v] 为 1 (真)、-1 (假) 或 0 (未赋值)。
     */
    private static final class Search {

        private final List<int[]> clauses;
        private final int variableCount;
        private final int[] values;
        private final int[] trail;
        private int trailSize;
        private final Deque<Decision> decisionStack = new ArrayDeque<>();
        private long decisions;

        private Search(List<int[]> clauses, int variableCount) {
            this.clauses = clauses;
            this.variableCount = variableCount;
            this.values = new int[variableCount + 1];
            this.trail = new int[variableCount];
        }

        private SatResult run(CancellationToken token) {
            while (true) {
                if (!propagate()) {
                    if (!backtrack()) {
                        return SatResult.unsatisfiable();
                    }
                    continue;
                }
                int variable = nextUnassigned();
                if (variable == 0) {
                    return SatResult.satisfiable(model());
                }
                if (token.isCancelled()) {
                    return SatResult.unknown("cancelled after " + decisions + " decisions");
                }
                decisions++;
                decisionStack.push(new Decision(trailSize, variable));
                assign(variable);
            }
        }

        /**
         * 反复扫描子句直到不动点。
         * @return false 如果出现冲突 (某个子句的文字全部为假)。
         */
        private boolean propagate() {
            boolean changed = true;
            while (changed) {
                changed = false;
                for (int[] clause : clauses) {
                    int unassignedLiteral = 0;
                    int unassignedCount = 0;
                    boolean satisfied = false;
                    for (int literal : clause) {
                        int value = valueOf(literal);
                        if (value > 0) {
                            satisfied = true;
                            break;
                        }
                        if (value == UNASSIGNED) {
                            unassignedCount++;
                            unassignedLiteral = literal;
                        }
                    }
                    if (satisfied) {
                        continue;
                    }
                    if (unassignedCount == 0) {
                        return false;
                    }
                    if (unassignedCount == 1) {
                        assign(unassignedLiteral);
                        changed = true;
                    }
                }
            }
            return true;
        }

        /**
         * 撤销到最近一个尚未翻转的决策并改取其反面。
         * @return false 如果所有决策都已翻转过 (搜索空间耗尽)。
         */
        private boolean backtrack() {
            while (!decisionStack.isEmpty()) {
                Decision decision = decisionStack.peek();
                undoTo(decision.trailIndex);
                if (!decision.flipped) {
                    decision.flipped = true;
                    assign(-decision.literal);
                    return true;
                }
                decisionStack.pop();
            }
            return false;
        }

        private void assign(int literal) {
            values[Math.abs(literal)] = literal > 0 ? 1 : -1;
            trail[trailSize++] = literal;
        }

        private void undoTo(int trailIndex) {
            while (trailSize > trailIndex) {
                values[Math.abs(trail[--trailSize])] = UNASSIGNED;
            }
        }

        private int valueOf(int literal) {
            int value = values[Math.abs(literal)];
            return literal > 0 ? value : -value;
        }

        private int nextUnassigned() {
            for (int v = 1; v <= variableCount; v++) {
                if (values[v] == UNASSIGNED) {
                    return v;
                }
            }
            return 0;
        }

        private boolean[] model() {
            boolean[] model = new boolean[variableCount + 1];
            for (int v = 1; v <= variableCount; v++) {
                model[v] = values[v] > 0;
            }
            return model;
        }
    }

    private static final class Decision {
        private final int trailIndex;
        private final int literal;
        private boolean flipped;

        private Decision(int trailIndex, int literal) {
            this.trailIndex = trailIndex;
            this.literal = literal;
        }
    }
}
