package org.deduction.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;

/**
 * 可以不经 CNF 编码、直接交给 Z3 的命题对象。
 * {@link Z3Oracle#checkSequent} 借此在公式层面复核子句集上的判定结果。
 */
public interface ToZ3BoolExpr {

    /**
     * @param ctx        当前请求的 Z3 Context。
     * @param varManager 原子键到 Z3 常量的映射；同一键在一个 Context 内只对应一个常量。
     * @return 与对象真值条件相同的 BoolExpr。
     * @throws IllegalStateException 对象含量词时。
     */
    BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager);
}
