package org.deduction.symbolic;

import org.deduction.core.Formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CNF 子句集合。变量从 1 开始编号，文字用带符号的整数表示 (DIMACS 约定)。
 * <p>
 * 每个变量对应节点表中的一个公式节点；结构相同的子公式共享同一个变量。
 * 原子表记录命题键到变量的映射，用于把模型限制到原子上。
 */
public final class ClauseSet {

    private final List<int[]> clauses = new ArrayList<>();
    private final List<Formula> nodes = new ArrayList<>();
    private final Map<String, Integer> atomVariables = new LinkedHashMap<>();

    /**
     * 为节点分配一个新变量。
     * @return 新变量的编号。
     */
    int newVariable(Formula node) {
        nodes.add(Objects.requireNonNull(node, "Node cannot be null."));
        int variable = nodes.size();
        if (node.isAtomic()) {
            atomVariables.put(node.propositionalKey(), variable);
        }
        return variable;
    }

    void addClause(int... literals) {
        for (int literal : literals) {
            if (literal == 0 || Math.abs(literal) > nodes.size()) {
                throw new IllegalArgumentException("Literal " + literal + " refers to an unknown variable");
            }
        }
        clauses.add(literals.clone());
    }

    public int getVariableCount() {
        return nodes.size();
    }

    public int getClauseCount() {
        return clauses.size();
    }

    public List<int[]> getClauses() {
        return Collections.unmodifiableList(clauses);
    }

    /**
     * 变量 variable 所代表的公式节点。
     */
    public Formula node(int variable) {
        return nodes.get(variable - 1);
    }

    public Map<String, Integer> getAtomVariables() {
        return Collections.unmodifiableMap(atomVariables);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ClauseSet{vars=").append(nodes.size()).append(", clauses=[");
        for (int i = 0; i < clauses.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(Arrays.toString(clauses.get(i)));
        }
        return sb.append("]}").toString();
    }
}
