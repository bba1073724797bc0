package org.deduction.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.Getter;
import org.deduction.core.Formula;
import org.deduction.core.Sequent;
import org.deduction.utils.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 Z3 的可满足性后端。
 * <p>
 * 每个实例持有自己的 Z3 Context，Context 不是线程安全的，因此一个实例只在一个请求内使用，
 * 用完后通过 {@link #close()} 释放本地资源。
 */
@Getter
public class Z3Oracle implements SatisfiabilityBackend, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    private final Context context;
    private final Z3VariableManager varManager;
    private final long timeoutMillis;

    /**
     * @param timeoutMillis 单次查询的时限，非正数表示不设时限。
     */
    public Z3Oracle(long timeoutMillis) {
        this.context = new Context();
        this.varManager = new Z3VariableManager(context);
        this.timeoutMillis = timeoutMillis;
        logger.debug("Z3Oracle 初始化完成，时限 {} ms", timeoutMillis);
    }

    /**
     * 检查单个布尔表达式的可满足性。
     */
    public Status check(BoolExpr expr) {
        Objects.requireNonNull(expr, "Expression cannot be null.");
        Solver solver = newSolver();
        solver.add(expr);
        Status status = solver.check();
        logger.debug("Z3Oracle.check: {} -> {}", expr, status);
        return status;
    }

    /**
     * 直接在公式层面检查 premises ∧ ¬conclusion，并把 fixed 中的原子固定为给定的真值。
     * fixed 为空时只判定否定形式本身是否可满足。
     * @param sequent 不含量词的相继式。
     * @param fixed   原子键到真值的映射。
     * @return Z3 给出的状态。
     */
    public Status checkSequent(Sequent sequent, Map<String, Boolean> fixed) {
        Objects.requireNonNull(sequent, "Sequent cannot be null.");
        Objects.requireNonNull(fixed, "Fixed valuation cannot be null.");
        List<BoolExpr> conjuncts = new ArrayList<>();
        for (Formula premise : sequent.getPremises()) {
            conjuncts.add(premise.toZ3BoolExpr(context, varManager));
        }
        conjuncts.add(context.mkNot(sequent.getConclusion().toZ3BoolExpr(context, varManager)));
        for (Map.Entry<String, Boolean> entry : fixed.entrySet()) {
            BoolExpr atom = varManager.getZ3Var(entry.getKey());
            conjuncts.add(entry.getValue() ? atom : context.mkNot(atom));
        }
        return check(context.mkAnd(conjuncts.toArray(new BoolExpr[0])));
    }

    @Override
    public SatResult solve(ClauseSet clauses, CancellationToken token) {
        Objects.requireNonNull(clauses, "Clause set cannot be null.");
        Objects.requireNonNull(token, "Cancellation token cannot be null.");
        if (token.isCancelled()) {
            return SatResult.unknown("cancelled before the query started");
        }
        Solver solver = newSolver();
        for (int[] clause : clauses.getClauses()) {
            BoolExpr[] literals = new BoolExpr[clause.length];
            for (int i = 0; i < clause.length; i++) {
                literals[i] = varManager.literal(clause[i]);
            }
            solver.add(literals.length == 0 ? context.mkFalse() : context.mkOr(literals));
        }
        Status status = solver.check();
        logger.debug("Z3Oracle.solve: {} 个变量, {} 个子句 -> {}",
                clauses.getVariableCount(), clauses.getClauseCount(), status);
        return switch (status) {
            case SATISFIABLE -> SatResult.satisfiable(readModel(solver.getModel(), clauses.getVariableCount()));
            case UNSATISFIABLE -> SatResult.unsatisfiable();
            case UNKNOWN -> SatResult.unknown(solver.getReasonUnknown());
        };
    }

    private boolean[] readModel(Model model, int variableCount) {
        boolean[] assignment = new boolean[variableCount + 1];
        for (int v = 1; v <= variableCount; v++) {
            Expr<?> value = model.evaluate(varManager.getZ3Var(v), true);
            assignment[v] = value.isTrue();
        }
        return assignment;
    }

    private Solver newSolver() {
        Solver solver = context.mkSolver();
        if (timeoutMillis > 0) {
            Params params = context.mkParams();
            params.add("timeout", (int) Math.min(Integer.MAX_VALUE, timeoutMillis));
            solver.setParameters(params);
        }
        return solver;
    }

    @Override
    public String getName() {
        return SatBackendKind.Z3.getLabel();
    }

    @Override
    public void close() {
        context.close();
        logger.debug("Z3Oracle: Context 已释放");
    }
}
