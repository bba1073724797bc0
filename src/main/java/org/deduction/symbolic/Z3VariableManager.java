package org.deduction.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 负责管理命题变元 (原子名或 Tseitin 变量编号) 到 Z3 BoolExpr 常量的映射。
 * 确保每个变元在 Z3 Context 中有唯一的对应 Z3 变量。
 * 每个实例只服务于一次查询，不会被并发访问。
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    private final Map<String, BoolExpr> atomZ3Vars;
    private final Map<Integer, BoolExpr> tseitinZ3Vars;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     */
    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.atomZ3Vars = new LinkedHashMap<>();
        this.tseitinZ3Vars = new LinkedHashMap<>();
        logger.debug("Z3VariableManager 初始化完成。");
    }

    /**
     * 获取命题键对应的 Z3 布尔变量，不存在时创建并缓存。
     * @param key 原子名或无量词谓词的规范文本。
     * @return 对应的 Z3 BoolExpr 变量。
     */
    public BoolExpr getZ3Var(String key) {
        return atomZ3Vars.computeIfAbsent(key, k -> {
            logger.debug("创建 Z3 命题变量: {}", k);
            return ctx.mkBoolConst(k);
        });
    }

    /**
     * 获取子句集中编号为 variable 的变量对应的 Z3 布尔变量。
     * @param variable 正整数变量编号。
     * @return 对应的 Z3 BoolExpr 变量。
     */
    public BoolExpr getZ3Var(int variable) {
        if (variable <= 0) {
            throw new IllegalArgumentException("Variable id must be positive: " + variable);
        }
        return tseitinZ3Vars.computeIfAbsent(variable, v -> ctx.mkBoolConst("t" + v));
    }

    /**
     * 将带符号的文字转换为 Z3 表达式：正数为变量本身，负数为其否定。
     */
    public BoolExpr literal(int literal) {
        BoolExpr var = getZ3Var(Math.abs(literal));
        return literal > 0 ? var : ctx.mkNot(var);
    }
}
