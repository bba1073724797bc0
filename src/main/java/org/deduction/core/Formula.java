package org.deduction.core;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.deduction.symbolic.ToZ3BoolExpr;
import org.deduction.symbolic.Z3VariableManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 代表一个公式的抽象语法树节点。
 * 节点由 {@link FormulaKind} 标记，按结构比较 (而非按输入拼写)：
 * 解析阶段已经把所有联结词同义写法归一，因此 "P->Q" 与 "P → Q" 得到相等的节点。
 * 此类是不可变的，哈希码在构造时计算。
 */
@Getter
public final class Formula implements ToZ3BoolExpr {

    private static final Formula BOTTOM = new Formula(FormulaKind.BOTTOM, null, Collections.emptyList(), null, null, null);

    private final FormulaKind kind;
    /** 原子或谓词的名字，其余种类为 null */
    private final String name;
    /** 谓词的参数项 */
    private final List<Term> terms;
    /** 二元联结词的左侧；否定与量词的唯一子节点也存放在这里 */
    private final Formula left;
    private final Formula right;
    /** 量词约束的变元 */
    private final String variable;

    private final boolean quantified;
    private final int size;
    private final int hashCode;

    private Formula(FormulaKind kind, String name, List<Term> terms, Formula left, Formula right, String variable) {
        this.kind = Objects.requireNonNull(kind, "Formula kind cannot be null.");
        this.name = name;
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
        this.left = left;
        this.right = right;
        this.variable = variable;

        boolean q = kind.isQuantifier();
        int s = 1;
        if (left != null) {
            q |= left.quantified;
            s += left.size;
        }
        if (right != null) {
            q |= right.quantified;
            s += right.size;
        }
        this.quantified = q;
        this.size = s;
        this.hashCode = Objects.hash(kind, name, this.terms, left, right, variable);
    }

    // --- 工厂方法 ---

    public static Formula atom(String name) {
        requireName(name);
        return new Formula(FormulaKind.ATOM, name, Collections.emptyList(), null, null, null);
    }

    public static Formula predicate(String name, List<Term> terms) {
        requireName(name);
        Objects.requireNonNull(terms, "Predicate terms cannot be null.");
        if (terms.isEmpty()) {
            return atom(name);
        }
        return new Formula(FormulaKind.PREDICATE, name, terms, null, null, null);
    }

    public static Formula bottom() {
        return BOTTOM;
    }

    public static Formula not(Formula child) {
        Objects.requireNonNull(child, "Negated formula cannot be null.");
        return new Formula(FormulaKind.NEGATION, null, Collections.emptyList(), child, null, null);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(FormulaKind.CONJUNCTION, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(FormulaKind.DISJUNCTION, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return binary(FormulaKind.IMPLICATION, left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(FormulaKind.BICONDITIONAL, left, right);
    }

    public static Formula forall(String variable, Formula body) {
        return quantifier(FormulaKind.UNIVERSAL, variable, body);
    }

    public static Formula exists(String variable, Formula body) {
        return quantifier(FormulaKind.EXISTENTIAL, variable, body);
    }

    public static Formula binary(FormulaKind kind, Formula left, Formula right) {
        if (!kind.isBinary()) {
            throw new IllegalArgumentException("Formula-binary: " + kind + " 不是二元联结词");
        }
        Objects.requireNonNull(left, "Left operand cannot be null.");
        Objects.requireNonNull(right, "Right operand cannot be null.");
        return new Formula(kind, null, Collections.emptyList(), left, right, null);
    }

    public static Formula quantifier(FormulaKind kind, String variable, Formula body) {
        if (!kind.isQuantifier()) {
            throw new IllegalArgumentException("Formula-quantifier: " + kind + " 不是量词");
        }
        requireName(variable);
        Objects.requireNonNull(body, "Quantifier body cannot be null.");
        return new Formula(kind, null, Collections.emptyList(), body, null, variable);
    }

    private static void requireName(String name) {
        Objects.requireNonNull(name, "Name cannot be null.");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Name cannot be empty.");
        }
    }

    // --- 结构查询 ---

    public boolean is(FormulaKind k) {
        return kind == k;
    }

    public boolean isBinary() {
        return kind.isBinary();
    }

    public boolean isAtomic() {
        return kind == FormulaKind.ATOM || kind == FormulaKind.PREDICATE;
    }

    public boolean isBottom() {
        return kind == FormulaKind.BOTTOM;
    }

    /** 否定的子公式 */
    public Formula getChild() {
        return left;
    }

    /** 量词的主体 */
    public Formula getBody() {
        return left;
    }

    /**
     * 判断公式中是否含有量词 (在任意深度)。
     */
    public boolean containsQuantifier() {
        return quantified;
    }

    /**
     * 判断 other 是否恰为此公式的否定 ¬this。
     */
    public boolean isNegationOf(Formula other) {
        return kind == FormulaKind.NEGATION && left.equals(other);
    }

    // --- 自由变元、代入与捕获 ---

    /**
     * 收集自由出现的项标识符 (受外层量词约束的不计)。
     */
    public Set<String> freeVariables() {
        Set<String> acc = new TreeSet<>();
        collectFree(this, new HashSet<>(), acc);
        return acc;
    }

    private static void collectFree(Formula f, Set<String> bound, Set<String> acc) {
        switch (f.kind) {
            case ATOM, BOTTOM -> {
            }
            case PREDICATE -> {
                for (Term t : f.terms) {
                    for (String n : t.names()) {
                        if (!bound.contains(n)) {
                            acc.add(n);
                        }
                    }
                }
            }
            case NEGATION -> collectFree(f.left, bound, acc);
            case CONJUNCTION, DISJUNCTION, IMPLICATION, BICONDITIONAL -> {
                collectFree(f.left, bound, acc);
                collectFree(f.right, bound, acc);
            }
            case UNIVERSAL, EXISTENTIAL -> {
                Set<String> inner = new HashSet<>(bound);
                inner.add(f.variable);
                collectFree(f.left, inner, acc);
            }
        }
    }

    public boolean occursFree(String identifier) {
        return freeVariables().contains(identifier);
    }

    /**
     * 将 variable 的自由出现替换为 term。
     * 被同名量词约束的出现保持不变；是否发生捕获由调用方通过 {@link #wouldCapture} 检查。
     */
    public Formula substitute(String variable, Term term) {
        Objects.requireNonNull(variable, "Variable cannot be null.");
        Objects.requireNonNull(term, "Term cannot be null.");
        return switch (kind) {
            case ATOM, BOTTOM -> this;
            case PREDICATE -> predicate(name, terms.stream().map(t -> t.substitute(variable, term)).toList());
            case NEGATION -> not(left.substitute(variable, term));
            case CONJUNCTION, DISJUNCTION, IMPLICATION, BICONDITIONAL ->
                    binary(kind, left.substitute(variable, term), right.substitute(variable, term));
            case UNIVERSAL, EXISTENTIAL -> this.variable.equals(variable)
                    ? this
                    : quantifier(kind, this.variable, left.substitute(variable, term));
        };
    }

    /**
     * 判断用 term 代入 variable 是否会让 term 中的某个标识符落入新的量词约束范围。
     * 返回 true 时调用方必须拒绝或先改名。
     */
    public boolean wouldCapture(String variable, Term term) {
        return captures(this, variable, term.names(), Collections.emptySet());
    }

    private static boolean captures(Formula f, String variable, Set<String> termNames, Set<String> binders) {
        return switch (f.kind) {
            case ATOM, BOTTOM -> false;
            case PREDICATE -> f.terms.stream().anyMatch(t -> t.mentions(variable))
                    && !Collections.disjoint(binders, termNames);
            case NEGATION -> captures(f.left, variable, termNames, binders);
            case CONJUNCTION, DISJUNCTION, IMPLICATION, BICONDITIONAL ->
                    captures(f.left, variable, termNames, binders) || captures(f.right, variable, termNames, binders);
            case UNIVERSAL, EXISTENTIAL -> {
                if (f.variable.equals(variable)) {
                    yield false;
                }
                Set<String> inner = new HashSet<>(binders);
                inner.add(f.variable);
                yield captures(f.left, variable, termNames, inner);
            }
        };
    }

    /**
     * 寻找项 t 使得 this[variable := t] 与 target 结构相等。
     * 此公式通常是某个量词公式的主体。
     */
    public InstanceMatch matchInstance(String variable, Formula target) {
        Objects.requireNonNull(target, "Target formula cannot be null.");
        Term[] binding = new Term[1];
        if (!matchNode(this, target, variable, binding)) {
            return InstanceMatch.failed();
        }
        return binding[0] == null ? InstanceMatch.vacuous() : InstanceMatch.of(binding[0]);
    }

    private static boolean matchNode(Formula p, Formula t, String variable, Term[] binding) {
        if (p.kind != t.kind) {
            return false;
        }
        return switch (p.kind) {
            case ATOM, BOTTOM -> p.equals(t);
            case PREDICATE -> {
                if (!p.name.equals(t.name) || p.terms.size() != t.terms.size()) {
                    yield false;
                }
                for (int i = 0; i < p.terms.size(); i++) {
                    if (!matchTerm(p.terms.get(i), t.terms.get(i), variable, binding)) {
                        yield false;
                    }
                }
                yield true;
            }
            case NEGATION -> matchNode(p.left, t.left, variable, binding);
            case CONJUNCTION, DISJUNCTION, IMPLICATION, BICONDITIONAL ->
                    matchNode(p.left, t.left, variable, binding) && matchNode(p.right, t.right, variable, binding);
            case UNIVERSAL, EXISTENTIAL -> {
                if (!p.variable.equals(t.variable)) {
                    yield false;
                }
                if (p.variable.equals(variable)) {
                    yield p.left.equals(t.left);
                }
                yield matchNode(p.left, t.left, variable, binding);
            }
        };
    }

    private static boolean matchTerm(Term p, Term t, String variable, Term[] binding) {
        if (!p.isCompound() && p.getName().equals(variable)) {
            if (binding[0] == null) {
                binding[0] = t;
                return true;
            }
            return binding[0].equals(t);
        }
        if (!p.getName().equals(t.getName()) || p.getArguments().size() != t.getArguments().size()) {
            return false;
        }
        for (int i = 0; i < p.getArguments().size(); i++) {
            if (!matchTerm(p.getArguments().get(i), t.getArguments().get(i), variable, binding)) {
                return false;
            }
        }
        return true;
    }

    // --- 命题语义 ---

    /**
     * 命题变元的键：原子为其名字，无量词的谓词为其规范文本 (如 "P(a)")。
     */
    public String propositionalKey() {
        if (!isAtomic()) {
            throw new IllegalStateException("Formula-propositionalKey: " + this + " 不是原子公式");
        }
        return toString();
    }

    public Set<String> propositionalAtoms() {
        Set<String> acc = new TreeSet<>();
        collectAtoms(this, acc);
        return acc;
    }

    private static void collectAtoms(Formula f, Set<String> acc) {
        if (f.isAtomic()) {
            acc.add(f.propositionalKey());
            return;
        }
        if (f.left != null) {
            collectAtoms(f.left, acc);
        }
        if (f.right != null) {
            collectAtoms(f.right, acc);
        }
    }

    /**
     * 在给定赋值下求值。仅适用于不含量词的公式。
     *
     * @param valuation 从命题键到真值的映射。
     * @throws IllegalStateException    如果公式含量词。
     * @throws IllegalArgumentException 如果某个原子没有赋值。
     */
    public boolean evaluate(Map<String, Boolean> valuation) {
        return switch (kind) {
            case ATOM, PREDICATE -> {
                Boolean value = valuation.get(propositionalKey());
                if (value == null) {
                    throw new IllegalArgumentException("No truth value for atom " + propositionalKey());
                }
                yield value;
            }
            case BOTTOM -> false;
            case NEGATION -> !left.evaluate(valuation);
            case CONJUNCTION -> left.evaluate(valuation) && right.evaluate(valuation);
            case DISJUNCTION -> left.evaluate(valuation) || right.evaluate(valuation);
            case IMPLICATION -> !left.evaluate(valuation) || right.evaluate(valuation);
            case BICONDITIONAL -> left.evaluate(valuation) == right.evaluate(valuation);
            case UNIVERSAL, EXISTENTIAL ->
                    throw new IllegalStateException("Cannot evaluate quantified formula " + this + " propositionally");
        };
    }

    // --- Z3 转换 ---
    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        return switch (kind) {
            case ATOM, PREDICATE -> varManager.getZ3Var(propositionalKey());
            case BOTTOM -> ctx.mkFalse();
            case NEGATION -> ctx.mkNot(left.toZ3BoolExpr(ctx, varManager));
            case CONJUNCTION -> ctx.mkAnd(left.toZ3BoolExpr(ctx, varManager), right.toZ3BoolExpr(ctx, varManager));
            case DISJUNCTION -> ctx.mkOr(left.toZ3BoolExpr(ctx, varManager), right.toZ3BoolExpr(ctx, varManager));
            case IMPLICATION -> ctx.mkImplies(left.toZ3BoolExpr(ctx, varManager), right.toZ3BoolExpr(ctx, varManager));
            case BICONDITIONAL -> ctx.mkIff(left.toZ3BoolExpr(ctx, varManager), right.toZ3BoolExpr(ctx, varManager));
            case UNIVERSAL, EXISTENTIAL ->
                    throw new IllegalStateException("Quantified formula " + this + " is outside the propositional fragment");
        };
    }

    // --- Object 方法 ---
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Formula that = (Formula) o;
        return hashCode == that.hashCode
                && kind == that.kind
                && Objects.equals(name, that.name)
                && terms.equals(that.terms)
                && Objects.equals(variable, that.variable)
                && Objects.equals(left, that.left)
                && Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 规范的 unicode 文本；二元子公式一律加括号，因此重新解析得到同一棵树。
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        render(sb, false);
        return sb.toString();
    }

    public String toAsciiString() {
        StringBuilder sb = new StringBuilder();
        render(sb, true);
        return sb.toString();
    }

    private void render(StringBuilder sb, boolean ascii) {
        switch (kind) {
            case ATOM -> sb.append(name);
            case PREDICATE -> sb.append(name)
                    .append(terms.stream().map(Term::toString).collect(Collectors.joining(",", "(", ")")));
            case BOTTOM -> sb.append(ascii ? kind.getAsciiSymbol() : kind.getSymbol());
            case NEGATION -> {
                sb.append(ascii ? kind.getAsciiSymbol() : kind.getSymbol());
                left.renderOperand(sb, ascii);
            }
            case UNIVERSAL, EXISTENTIAL -> {
                sb.append(ascii ? kind.getAsciiSymbol() : kind.getSymbol()).append(variable).append('.');
                left.renderOperand(sb, ascii);
            }
            case CONJUNCTION, DISJUNCTION, IMPLICATION, BICONDITIONAL -> {
                left.renderOperand(sb, ascii);
                sb.append(' ').append(ascii ? kind.getAsciiSymbol() : kind.getSymbol()).append(' ');
                right.renderOperand(sb, ascii);
            }
        }
    }

    private void renderOperand(StringBuilder sb, boolean ascii) {
        if (isBinary()) {
            sb.append('(');
            render(sb, ascii);
            sb.append(')');
        } else {
            render(sb, ascii);
        }
    }
}
