package org.deduction.symbolic;

import org.deduction.core.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tseitin 编码器。每个结构上不同的子公式分配一个变量 v，并添加定义 v ↔ 节点 的等价子句：
 * <pre>
 *   v ↔ ¬c        : (¬v ∨ ¬c) (v ∨ c)
 *   v ↔ l ∧ r     : (¬v ∨ l) (¬v ∨ r) (v ∨ ¬l ∨ ¬r)
 *   v ↔ l ∨ r     : (¬v ∨ l ∨ r) (v ∨ ¬l) (v ∨ ¬r)
 *   v ↔ l → r     : (¬v ∨ ¬l ∨ r) (v ∨ l) (v ∨ ¬r)
 *   v ↔ l ↔ r     : (¬v ∨ ¬l ∨ r) (¬v ∨ l ∨ ¬r) (v ∨ ¬l ∨ ¬r) (v ∨ l ∨ r)
 *   v ↔ ⊥         : (¬v)
 * </pre>
 * 被断言的公式再加一个单元子句 (v)。一个编码器实例只服务于一次查询。
 */
public class TseitinEncoder {

    private static final Logger logger = LoggerFactory.getLogger(TseitinEncoder.class);

    private final ClauseSet clauseSet = new ClauseSet();
    private final Map<Formula, Integer> memo = new HashMap<>();

    /**
     * 断言公式为真。
     * @throws IllegalArgumentException 如果公式含量词。
     */
    public void assertTrue(Formula formula) {
        Objects.requireNonNull(formula, "Formula cannot be null.");
        if (formula.containsQuantifier()) {
            throw new IllegalArgumentException("Cannot encode quantified formula " + formula);
        }
        int root = encode(formula);
        clauseSet.addClause(root);
        logger.debug("TseitinEncoder: 断言 {} (变量 {})", formula, root);
    }

    /**
     * 返回公式节点对应的变量，必要时分配新变量并添加定义子句。
     */
    public int encode(Formula formula) {
        Integer known = memo.get(formula);
        if (known != null) {
            return known;
        }
        int variable;
        switch (formula.getKind()) {
            case ATOM, PREDICATE -> variable = clauseSet.newVariable(formula);
            case BOTTOM -> {
                variable = clauseSet.newVariable(formula);
                clauseSet.addClause(-variable);
            }
            case NEGATION -> {
                int c = encode(formula.getChild());
                variable = clauseSet.newVariable(formula);
                clauseSet.addClause(-variable, -c);
                clauseSet.addClause(variable, c);
            }
            case CONJUNCTION -> {
                int l = encode(formula.getLeft());
                int r = encode(formula.getRight());
                variable = clauseSet.newVariable(formula);
                clauseSet.addClause(-variable, l);
                clauseSet.addClause(-variable, r);
                clauseSet.addClause(variable, -l, -r);
            }
            case DISJUNCTION -> {
                int l = encode(formula.getLeft());
                int r = encode(formula.getRight());
                variable = clauseSet.newVariable(formula);
                clauseSet.addClause(-variable, l, r);
                clauseSet.addClause(variable, -l);
                clauseSet.addClause(variable, -r);
            }
            case IMPLICATION -> {
                int l = encode(formula.getLeft());
                int r = encode(formula.getRight());
                variable = clauseSet.newVariable(formula);
                clauseSet.addClause(-variable, -l, r);
                clauseSet.addClause(variable, l);
                clauseSet.addClause(variable, -r);
            }
            case BICONDITIONAL -> {
                int l = encode(formula.getLeft());
                int r = encode(formula.getRight());
                variable = clauseSet.newVariable(formula);
                clauseSet.addClause(-variable, -l, r);
                clauseSet.addClause(-variable, l, -r);
                clauseSet.addClause(variable, -l, -r);
                clauseSet.addClause(variable, l, r);
            }
            case UNIVERSAL, EXISTENTIAL ->
                    throw new IllegalArgumentException("Cannot encode quantified formula " + formula);
            default -> throw new IllegalStateException("Unhandled formula kind " + formula.getKind());
        }
        memo.put(formula, variable);
        return variable;
    }

    public ClauseSet getClauseSet() {
        return clauseSet;
    }
}
