package org.deduction.symbolic;

import com.microsoft.z3.Status;
import org.deduction.core.Formula;
import org.deduction.core.Sequent;
import org.deduction.utils.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 判定命题相继式 premises ⊢ conclusion 的语义有效性。
 * <p>
 * 断言全部前提与结论的否定，编码为 CNF 后交给可满足性后端：
 * 不可满足说明相继式有效；可满足时把模型限制到原子上作为反模型。
 * 含量词的相继式不在此判定范围内，返回 NOT_APPLICABLE。
 */
public class CountermodelEngine {

    private static final Logger logger = LoggerFactory.getLogger(CountermodelEngine.class);

    private final int maxVariables;
    private final int maxClauses;
    private final SatBackendKind backendKind;
    private final long timeoutMillis;

    public CountermodelEngine(int maxVariables, int maxClauses, SatBackendKind backendKind, long timeoutMillis) {
        if (maxVariables <= 0 || maxClauses <= 0) {
            throw new IllegalArgumentException("SAT ceilings must be positive: " + maxVariables + "/" + maxClauses);
        }
        this.maxVariables = maxVariables;
        this.maxClauses = maxClauses;
        this.backendKind = Objects.requireNonNull(backendKind, "Backend kind cannot be null.");
        this.timeoutMillis = timeoutMillis;
    }

    public CountermodelResult check(Sequent sequent, CancellationToken token) {
        Objects.requireNonNull(sequent, "Sequent cannot be null.");
        Objects.requireNonNull(token, "Cancellation token cannot be null.");
        if (!sequent.isQuantifierFree()) {
            logger.info("CountermodelEngine.check: {} 含量词，不做命题判定", sequent);
            return CountermodelResult.notApplicable("Quantified formulas are outside the propositional check");
        }
        TseitinEncoder encoder = new TseitinEncoder();
        for (Formula premise : sequent.getPremises()) {
            encoder.assertTrue(premise);
        }
        encoder.assertTrue(Formula.not(sequent.getConclusion()));
        ClauseSet clauses = encoder.getClauseSet();
        int variables = clauses.getVariableCount();
        int clauseCount = clauses.getClauseCount();
        if (variables > maxVariables || clauseCount > maxClauses) {
            logger.warn("CountermodelEngine.check: {} 超出上限 ({} 变量, {} 子句)", sequent, variables, clauseCount);
            return CountermodelResult.boundExceeded(variables, clauseCount, backendKind.getLabel(),
                    "The encoding needs " + variables + " variables and " + clauseCount
                            + " clauses, above the ceiling of " + maxVariables + "/" + maxClauses);
        }
        CountermodelResult result = switch (backendKind) {
            case DPLL -> classify(sequent, clauses, new DpllSolver().solve(clauses, token));
            case Z3 -> {
                try (Z3Oracle oracle = new Z3Oracle(timeoutMillis)) {
                    CountermodelResult classified = classify(sequent, clauses, oracle.solve(clauses, token));
                    crossCheck(oracle, sequent, classified);
                    yield classified;
                }
            }
        };
        logger.info("CountermodelEngine.check: {} -> {}", sequent, result);
        return result;
    }

    private CountermodelResult classify(Sequent sequent, ClauseSet clauses, SatResult sat) {
        int variables = clauses.getVariableCount();
        int clauseCount = clauses.getClauseCount();
        return switch (sat.getStatus()) {
            case UNSATISFIABLE -> CountermodelResult.valid(variables, clauseCount, backendKind.getLabel());
            case SATISFIABLE -> CountermodelResult.invalid(restrictToAtoms(clauses, sat, sequent),
                    variables, clauseCount, backendKind.getLabel());
            case UNKNOWN -> CountermodelResult.boundExceeded(variables, clauseCount, backendKind.getLabel(),
                    "The satisfiability search stopped before an answer: " + sat.getReason());
        };
    }

    /**
     * 用未经 Tseitin 编码的公式复核 Z3 的结论：有效时否定形式不可满足，无效时反模型在原公式上成立。
     */
    static void crossCheck(Z3Oracle oracle, Sequent sequent, CountermodelResult result) {
        Status expected;
        Map<String, Boolean> fixed;
        switch (result.getStatus()) {
            case VALID -> {
                expected = Status.UNSATISFIABLE;
                fixed = Map.of();
            }
            case INVALID -> {
                expected = Status.SATISFIABLE;
                fixed = result.counterModel().orElseThrow();
            }
            default -> {
                return;
            }
        }
        Status actual = oracle.checkSequent(sequent, fixed);
        if (actual == Status.UNKNOWN) {
            logger.warn("CountermodelEngine.crossCheck: Z3 未能复核 {}", sequent);
            return;
        }
        if (actual != expected) {
            throw new IllegalStateException("Z3 disagrees with the clause encoding on " + sequent
                    + ": expected " + expected + ", got " + actual);
        }
        logger.debug("CountermodelEngine.crossCheck: {} 复核通过", sequent);
    }

    /**
     * 把模型限制到原子上，并确认它确实使前提全真、结论为假。
     */
    private static Map<String, Boolean> restrictToAtoms(ClauseSet clauses, SatResult sat, Sequent sequent) {
        Map<String, Boolean> model = new TreeMap<>();
        for (Map.Entry<String, Integer> entry : clauses.getAtomVariables().entrySet()) {
            model.put(entry.getKey(), sat.valueOf(entry.getValue()));
        }
        for (Formula premise : sequent.getPremises()) {
            if (!premise.evaluate(model)) {
                throw new IllegalStateException("Countermodel " + model + " falsifies premise " + premise);
            }
        }
        if (sequent.getConclusion().evaluate(model)) {
            throw new IllegalStateException("Countermodel " + model + " satisfies the conclusion " + sequent.getConclusion());
        }
        return model;
    }
}
