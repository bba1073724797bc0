package org.deduction.solver;

import org.deduction.core.Formula;
import org.deduction.core.FormulaKind;
import org.deduction.core.Sequent;
import org.deduction.rules.RuleKind;
import org.deduction.syntax.LineRange;
import org.deduction.syntax.ParsedProof;
import org.deduction.syntax.ProofScriptParser;
import org.deduction.utils.CancellationToken;
import org.deduction.verifier.ProofVerifier;
import org.deduction.verifier.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 自动证明搜索。
 * <p>
 * 每个目标先做前向饱和 (∧E、MP、MT、DS、¬¬E、↔E、¬E、⊥E)，已可见的公式不会重复推出；
 * 仍未得到目标时按目标形状做反向步骤：条件目标开启条件子证明，否定目标开启归谬子证明，
 * 合取与双条件分别证明两部分，析取尝试任一支，另有反向 MP、∨E 分情况与作为最后手段的 PBC。
 * 每个反向步骤消耗一层深度，深度从 0 逐层加深直到 maxDepth。
 * <p>
 * 找到的证明先删去无用的行，再交给 {@link ProofVerifier} 复核后才报告为 FOUND。
 * 量词公式只作为不透明的整体参与上述规则。
 */
public class MachineSolver {

    private static final Logger logger = LoggerFactory.getLogger(MachineSolver.class);

    private final long maxNodes;
    private final ProofVerifier verifier = new ProofVerifier();

    public MachineSolver(long maxNodes) {
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("Node budget must be positive: " + maxNodes);
        }
        this.maxNodes = maxNodes;
    }

    public SolverResult findProof(Sequent sequent, int maxDepth, CancellationToken token) {
        Objects.requireNonNull(sequent, "Sequent cannot be null.");
        Objects.requireNonNull(token, "Cancellation token cannot be null.");
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        long nodes = 0;
        for (int depth = 0; depth <= maxDepth; depth++) {
            Search search = new Search(sequent, token, maxNodes - nodes);
            int line = search.prove(sequent.getConclusion(), depth);
            nodes += search.nodes;
            if (line > 0) {
                return finish(sequent, search.builder, line, depth, nodes);
            }
            if (search.stop != null) {
                logger.info("MachineSolver.findProof: {} 在深度 {} 中止 ({})", sequent, depth, search.stop);
                return SolverResult.notFound(search.stop, depth, nodes, search.stop == SolverStatus.CANCELLED
                        ? "Search cancelled at depth " + depth
                        : "Search node budget of " + maxNodes + " exhausted at depth " + depth);
            }
        }
        logger.info("MachineSolver.findProof: {} 在深度 {} 内未找到证明", sequent, maxDepth);
        return SolverResult.notFound(SolverStatus.NOT_FOUND_WITHIN_BOUND, maxDepth, nodes,
                "No proof found within depth " + maxDepth);
    }

    /**
     * 重新搜索并把找到的证明长度与声称的最优长度比较。
     */
    public OptimalLengthReport verifyOptimalLength(Sequent sequent, int claimedLength, int maxDepth,
                                                   CancellationToken token) {
        SolverResult result = findProof(sequent, maxDepth, token);
        if (!result.isFound()) {
            return OptimalLengthReport.failed(claimedLength, result.getMessage());
        }
        OptimalLengthReport report = OptimalLengthReport.found(result.getLength(), claimedLength, result.getProofText());
        logger.info("MachineSolver.verifyOptimalLength: {} -> {}", sequent, report);
        return report;
    }

    private SolverResult finish(Sequent sequent, ProofBuilder builder, int line, int depth, long nodes) {
        int finalLine = line;
        if (builder.isPremiseLine(line)) {
            finalLine = builder.add(sequent.getConclusion(), RuleKind.REITERATION, line);
        }
        List<BuiltLine> pruned = ProofPruner.prune(builder.getLines(), finalLine);
        String text = ProofRenderer.renderBracket(pruned);
        ParsedProof parsed = ProofScriptParser.parse(text, sequent.getPremises());
        VerificationResult check = verifier.verify(parsed, sequent);
        if (!check.isValid()) {
            logger.error("MachineSolver: 构造的证明未通过复核: {}\n{}", check.getError(), text);
            return SolverResult.notFound(SolverStatus.NOT_FOUND_WITHIN_BOUND, depth, nodes,
                    "The constructed proof failed verification: " + check.getError().getMessage());
        }
        SolverResult result = SolverResult.found(pruned, text, depth, nodes);
        logger.info("MachineSolver.findProof: {} 找到证明 {}", sequent, result);
        return result;
    }

    /**
     * 固定深度下的一次搜索。
     */
    private static final class Search {

        private final ProofBuilder builder;
        private final CancellationToken token;
        private final long nodeBudget;
        private final Set<Integer> splitting = new HashSet<>();
        private long nodes;
        private SolverStatus stop;

        private Search(Sequent sequent, CancellationToken token, long nodeBudget) {
            this.builder = new ProofBuilder(sequent.getPremises());
            this.token = token;
            this.nodeBudget = nodeBudget;
        }

        /**
         * 在当前作用域中确立 goal。
         * @return goal 所在的行号；失败时为 -1，此时 builder 的内容由调用者回滚。
         */
        private int prove(Formula goal, int depth) {
            if (stop != null) {
                return -1;
            }
            if (++nodes > nodeBudget) {
                stop = SolverStatus.NODE_BUDGET_EXHAUSTED;
                return -1;
            }
            if (token.isCancelled()) {
                stop = SolverStatus.CANCELLED;
                return -1;
            }
            Integer known = builder.lookup(goal);
            if (known != null) {
                return known;
            }
            saturate();
            known = builder.lookup(goal);
            if (known != null) {
                return known;
            }
            Integer bottom = builder.lookup(Formula.bottom());
            if (bottom != null) {
                return builder.add(goal, RuleKind.BOTTOM_ELIM, bottom);
            }
            if (depth == 0) {
                return -1;
            }
            ProofBuilder.Mark mark = builder.mark();
            int line = introduce(goal, depth - 1);
            if (line > 0 || stop != null) {
                return line;
            }
            builder.rollback(mark);
            line = backwardModusPonens(goal, depth - 1, mark);
            if (line > 0 || stop != null) {
                return line;
            }
            if (goal.isBottom()) {
                line = refute(depth - 1, mark);
                if (line > 0 || stop != null) {
                    return line;
                }
            }
            line = splitCases(goal, depth - 1, mark);
            if (line > 0 || stop != null) {
                return line;
            }
            if (!goal.isBottom() && !goal.is(FormulaKind.NEGATION) && !builder.isVisible(Formula.not(goal))) {
                LineRange range = subproof(Formula.not(goal), Formula.bottom(), depth - 1);
                if (range != null) {
                    return builder.add(goal, RuleKind.INDIRECT_PROOF, List.of(), List.of(range));
                }
                builder.rollback(mark);
            }
            return -1;
        }

        // --- 前向饱和 ---

        private void saturate() {
            boolean changed = true;
            while (changed) {
                changed = false;
                for (Map.Entry<Formula, Integer> entry : builder.visible()) {
                    changed |= forward(entry.getKey(), entry.getValue());
                }
            }
        }

        private boolean forward(Formula f, int line) {
            boolean changed = false;
            switch (f.getKind()) {
                case CONJUNCTION -> {
                    changed |= derive(f.getLeft(), RuleKind.CONJ_ELIM, line);
                    changed |= derive(f.getRight(), RuleKind.CONJ_ELIM, line);
                }
                case IMPLICATION -> {
                    Integer antecedent = builder.lookup(f.getLeft());
                    if (antecedent != null) {
                        changed |= derive(f.getRight(), RuleKind.MODUS_PONENS, line, antecedent);
                    }
                    Integer denial = builder.lookup(Formula.not(f.getRight()));
                    if (denial != null) {
                        changed |= derive(Formula.not(f.getLeft()), RuleKind.MODUS_TOLLENS, line, denial);
                    }
                }
                case DISJUNCTION -> {
                    Integer notLeft = builder.lookup(Formula.not(f.getLeft()));
                    if (notLeft != null) {
                        changed |= derive(f.getRight(), RuleKind.DISJ_SYLLOGISM, line, notLeft);
                    }
                    Integer notRight = builder.lookup(Formula.not(f.getRight()));
                    if (notRight != null) {
                        changed |= derive(f.getLeft(), RuleKind.DISJ_SYLLOGISM, line, notRight);
                    }
                }
                case BICONDITIONAL -> {
                    changed |= derive(Formula.implies(f.getLeft(), f.getRight()), RuleKind.BICOND_ELIM, line);
                    changed |= derive(Formula.implies(f.getRight(), f.getLeft()), RuleKind.BICOND_ELIM, line);
                }
                case NEGATION -> {
                    Formula child = f.getChild();
                    if (child.is(FormulaKind.NEGATION)) {
                        changed |= derive(child.getChild(), RuleKind.DOUBLE_NEG_ELIM, line);
                    }
                    Integer positive = builder.lookup(child);
                    if (positive != null) {
                        changed |= derive(Formula.bottom(), RuleKind.NEG_ELIM, positive, line);
                    }
                }
                default -> {
                }
            }
            return changed;
        }

        private boolean derive(Formula formula, RuleKind rule, Integer... cited) {
            if (builder.isVisible(formula)) {
                return false;
            }
            builder.add(formula, rule, cited);
            return true;
        }

        // --- 反向步骤 ---

        private int introduce(Formula goal, int depth) {
            return switch (goal.getKind()) {
                case CONJUNCTION -> {
                    int left = prove(goal.getLeft(), depth);
                    if (left < 0) {
                        yield -1;
                    }
                    int right = prove(goal.getRight(), depth);
                    yield right < 0 ? -1 : builder.add(goal, RuleKind.CONJ_INTRO, left, right);
                }
                case IMPLICATION -> {
                    LineRange range = subproof(goal.getLeft(), goal.getRight(), depth);
                    yield range == null ? -1 : builder.add(goal, RuleKind.COND_INTRO, List.of(), List.of(range));
                }
                case NEGATION -> {
                    LineRange range = subproof(goal.getChild(), Formula.bottom(), depth);
                    yield range == null ? -1 : builder.add(goal, RuleKind.NEG_INTRO, List.of(), List.of(range));
                }
                case BICONDITIONAL -> {
                    int forward = prove(Formula.implies(goal.getLeft(), goal.getRight()), depth);
                    if (forward < 0) {
                        yield -1;
                    }
                    int backward = prove(Formula.implies(goal.getRight(), goal.getLeft()), depth);
                    yield backward < 0 ? -1 : builder.add(goal, RuleKind.BICOND_INTRO, forward, backward);
                }
                case DISJUNCTION -> {
                    ProofBuilder.Mark mark = builder.mark();
                    int left = prove(goal.getLeft(), depth);
                    if (left > 0) {
                        yield builder.add(goal, RuleKind.DISJ_INTRO, left);
                    }
                    builder.rollback(mark);
                    if (stop != null) {
                        yield -1;
                    }
                    int right = prove(goal.getRight(), depth);
                    yield right < 0 ? -1 : builder.add(goal, RuleKind.DISJ_INTRO, right);
                }
                case ATOM, PREDICATE, BOTTOM, UNIVERSAL, EXISTENTIAL -> -1;
            };
        }

        private int backwardModusPonens(Formula goal, int depth, ProofBuilder.Mark mark) {
            for (Map.Entry<Formula, Integer> entry : builder.visible()) {
                Formula f = entry.getKey();
                if (!f.is(FormulaKind.IMPLICATION) || !f.getRight().equals(goal)) {
                    continue;
                }
                int antecedent = prove(f.getLeft(), depth);
                if (antecedent > 0) {
                    return builder.add(goal, RuleKind.MODUS_PONENS, entry.getValue(), antecedent);
                }
                builder.rollback(mark);
                if (stop != null) {
                    return -1;
                }
            }
            return -1;
        }

        /**
         * 目标为 ⊥：对可见的 ¬A 证明 A。
         */
        private int refute(int depth, ProofBuilder.Mark mark) {
            for (Map.Entry<Formula, Integer> entry : builder.visible()) {
                Formula f = entry.getKey();
                if (!f.is(FormulaKind.NEGATION) || f.getChild().isBottom()) {
                    continue;
                }
                int positive = prove(f.getChild(), depth);
                if (positive > 0) {
                    return builder.add(Formula.bottom(), RuleKind.NEG_ELIM, entry.getValue(), positive);
                }
                builder.rollback(mark);
                if (stop != null) {
                    return -1;
                }
            }
            return -1;
        }

        private int splitCases(Formula goal, int depth, ProofBuilder.Mark mark) {
            for (Map.Entry<Formula, Integer> entry : builder.visible()) {
                Formula f = entry.getKey();
                int line = entry.getValue();
                if (!f.is(FormulaKind.DISJUNCTION) || splitting.contains(line)) {
                    continue;
                }
                splitting.add(line);
                LineRange first = subproof(f.getLeft(), goal, depth);
                LineRange second = first == null ? null : subproof(f.getRight(), goal, depth);
                splitting.remove(line);
                if (second != null) {
                    return builder.add(goal, RuleKind.DISJ_ELIM, List.of(line), List.of(first, second));
                }
                builder.rollback(mark);
                if (stop != null) {
                    return -1;
                }
            }
            return -1;
        }

        /**
         * 开启以 assumption 为假设的子证明并在其中确立 target，使其成为子证明的最后一行。
         * @return 子证明的行区间；失败时为 null。
         */
        private LineRange subproof(Formula assumption, Formula target, int depth) {
            builder.open(assumption);
            int line = prove(target, depth);
            if (line < 0) {
                return null;
            }
            if (!builder.endsWith(target)) {
                builder.add(target, RuleKind.REITERATION, line);
            }
            return builder.close();
        }
    }
}
