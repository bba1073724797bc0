package org.deduction.rules;

import org.deduction.core.Formula;
import org.deduction.core.FormulaKind;
import org.deduction.core.InstanceMatch;
import org.deduction.core.Term;
import org.deduction.errors.ErrorKind;
import org.deduction.verifier.Subproof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 规则到校验器的完整映射。表由穷尽的 switch 构建，新增规则而未给出校验器时无法通过编译。
 * 这里只校验出现在公式行上的规则；Show 块的关闭标记由 {@code ShowBlockCloser} 处理。
 */
public final class RuleValidators {

    private static final Map<RuleKind, RuleValidator> TABLE = new EnumMap<>(RuleKind.class);

    static {
        for (RuleKind kind : RuleKind.values()) {
            TABLE.put(kind, validatorFor(kind));
        }
    }

    private RuleValidators() {
    }

    public static RuleValidator get(RuleKind kind) {
        return TABLE.get(kind);
    }

    public static RuleCheck check(RuleContext context) {
        return get(context.getRule()).check(context);
    }

    private static RuleValidator validatorFor(RuleKind kind) {
        return switch (kind) {
            case PREMISE, ASSUMPTION -> RuleValidators::noCitations;
            case SHOW -> ctx -> RuleCheck.violation("Show is a block header, not a justification");
            case REITERATION -> RuleValidators::reiteration;
            case MODUS_PONENS -> RuleValidators::modusPonens;
            case MODUS_TOLLENS -> RuleValidators::modusTollens;
            case CONJ_INTRO -> RuleValidators::conjunctionIntro;
            case CONJ_ELIM -> RuleValidators::conjunctionElim;
            case DISJ_INTRO -> RuleValidators::disjunctionIntro;
            case DISJ_ELIM -> RuleValidators::disjunctionElim;
            case DISJ_SYLLOGISM -> RuleValidators::disjunctiveSyllogism;
            case COND_INTRO -> RuleValidators::conditionalIntro;
            case BICOND_INTRO -> RuleValidators::biconditionalIntro;
            case BICOND_ELIM -> RuleValidators::biconditionalElim;
            case NEG_INTRO -> RuleValidators::negationIntro;
            case NEG_ELIM -> RuleValidators::negationElim;
            case BOTTOM_ELIM -> RuleValidators::bottomElim;
            case DOUBLE_NEG_ELIM -> RuleValidators::doubleNegationElim;
            case DOUBLE_NEG_INTRO -> RuleValidators::doubleNegationIntro;
            case INDIRECT_PROOF -> RuleValidators::proofByContradiction;
            case INDIRECT_DERIVATION -> RuleValidators::indirectDerivation;
            case DIRECT_DERIVATION -> ctx -> RuleCheck.fail(ErrorKind.SCOPE_ERROR,
                    "DD only closes a Show block and cannot justify a formula line");
            case UNIV_INTRO -> RuleValidators::universalIntro;
            case UNIV_ELIM -> RuleValidators::universalElim;
            case EXIST_INTRO -> RuleValidators::existentialIntro;
            case EXIST_ELIM -> RuleValidators::existentialElim;
        };
    }

    // --- 结构规则 ---

    private static RuleCheck noCitations(RuleContext ctx) {
        return RuleCheck.require(ctx.getCitedFormulas().isEmpty() && ctx.getCitedSubproofs().isEmpty(),
                ctx.getRule().getTag() + " takes no citations");
    }

    private static RuleCheck reiteration(RuleContext ctx) {
        String arity = ctx.arityProblem(1, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        return RuleCheck.require(ctx.cited(0).equals(ctx.getFormula()),
                "Reiterated line is " + ctx.cited(0) + ", not " + ctx.getFormula());
    }

    // --- 条件 ---

    private static RuleCheck modusPonens(RuleContext ctx) {
        String arity = ctx.arityProblem(2, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula a = ctx.cited(0);
        Formula b = ctx.cited(1);
        if (isConditional(a, b, ctx.getFormula()) || isConditional(b, a, ctx.getFormula())) {
            return RuleCheck.ok();
        }
        if (!a.is(FormulaKind.IMPLICATION) && !b.is(FormulaKind.IMPLICATION)) {
            return RuleCheck.violation("MP needs a conditional among the cited lines");
        }
        return RuleCheck.violation("Cited lines do not have the shape A→" + ctx.getFormula() + " and A");
    }

    private static boolean isConditional(Formula conditional, Formula antecedent, Formula consequent) {
        return conditional.is(FormulaKind.IMPLICATION)
                && conditional.getLeft().equals(antecedent)
                && conditional.getRight().equals(consequent);
    }

    private static RuleCheck modusTollens(RuleContext ctx) {
        String arity = ctx.arityProblem(2, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula target = ctx.getFormula();
        if (!target.is(FormulaKind.NEGATION)) {
            return RuleCheck.violation("MT concludes a negation ¬A");
        }
        for (int i = 0; i < 2; i++) {
            Formula conditional = ctx.cited(i);
            Formula denial = ctx.cited(1 - i);
            if (conditional.is(FormulaKind.IMPLICATION)
                    && conditional.getLeft().equals(target.getChild())
                    && denial.isNegationOf(conditional.getRight())) {
                return RuleCheck.ok();
            }
        }
        return RuleCheck.violation("MT needs " + target.getChild() + "→B and ¬B");
    }

    private static RuleCheck conditionalIntro(RuleContext ctx) {
        String arity = ctx.arityProblem(0, 1);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula target = ctx.getFormula();
        if (!target.is(FormulaKind.IMPLICATION)) {
            return RuleCheck.violation("→I concludes a conditional A→B");
        }
        Subproof sub = ctx.subproof(0);
        if (!target.getLeft().equals(sub.getAssumption())) {
            return RuleCheck.violation("Subproof " + sub.range() + " assumes " + sub.getAssumption()
                    + ", not " + target.getLeft());
        }
        return RuleCheck.require(target.getRight().equals(sub.getConclusion()),
                "Subproof " + sub.range() + " ends with " + sub.getConclusion() + ", not " + target.getRight());
    }

    // --- 合取 ---

    private static RuleCheck conjunctionIntro(RuleContext ctx) {
        String arity = ctx.arityProblem(2, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula target = ctx.getFormula();
        if (!target.is(FormulaKind.CONJUNCTION)) {
            return RuleCheck.violation("∧I concludes a conjunction");
        }
        Formula a = ctx.cited(0);
        Formula b = ctx.cited(1);
        boolean inOrder = target.getLeft().equals(a) && target.getRight().equals(b);
        boolean swapped = target.getLeft().equals(b) && target.getRight().equals(a);
        return RuleCheck.require(inOrder || swapped, "Cited lines " + a + " and " + b + " do not form " + target);
    }

    private static RuleCheck conjunctionElim(RuleContext ctx) {
        String arity = ctx.arityProblem(1, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula c = ctx.cited(0);
        if (!c.is(FormulaKind.CONJUNCTION)) {
            return RuleCheck.violation("∧E needs a conjunction, got " + c);
        }
        return RuleCheck.require(c.getLeft().equals(ctx.getFormula()) || c.getRight().equals(ctx.getFormula()),
                ctx.getFormula() + " is not a conjunct of " + c);
    }

    // --- 析取 ---

    private static RuleCheck disjunctionIntro(RuleContext ctx) {
        String arity = ctx.arityProblem(1, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula target = ctx.getFormula();
        if (!target.is(FormulaKind.DISJUNCTION)) {
            return RuleCheck.violation("∨I concludes a disjunction");
        }
        Formula c = ctx.cited(0);
        return RuleCheck.require(target.getLeft().equals(c) || target.getRight().equals(c),
                c + " is not a disjunct of " + target);
    }

    private static RuleCheck disjunctionElim(RuleContext ctx) {
        String arity = ctx.arityProblem(1, 2);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula d = ctx.cited(0);
        if (!d.is(FormulaKind.DISJUNCTION)) {
            return RuleCheck.violation("∨E needs a disjunction, got " + d);
        }
        Subproof first = ctx.subproof(0);
        Subproof second = ctx.subproof(1);
        boolean inOrder = d.getLeft().equals(first.getAssumption()) && d.getRight().equals(second.getAssumption());
        boolean swapped = d.getLeft().equals(second.getAssumption()) && d.getRight().equals(first.getAssumption());
        if (!inOrder && !swapped) {
            return RuleCheck.violation("The subproofs must assume " + d.getLeft() + " and " + d.getRight()
                    + ", got " + first.getAssumption() + " and " + second.getAssumption());
        }
        Formula target = ctx.getFormula();
        if (!target.equals(first.getConclusion())) {
            return RuleCheck.violation("Subproof " + first.range() + " ends with " + first.getConclusion()
                    + ", not " + target);
        }
        return RuleCheck.require(target.equals(second.getConclusion()),
                "Subproof " + second.range() + " ends with " + second.getConclusion() + ", not " + target);
    }

    private static RuleCheck disjunctiveSyllogism(RuleContext ctx) {
        String arity = ctx.arityProblem(2, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula target = ctx.getFormula();
        for (int i = 0; i < 2; i++) {
            Formula d = ctx.cited(i);
            Formula denial = ctx.cited(1 - i);
            if (!d.is(FormulaKind.DISJUNCTION)) {
                continue;
            }
            if (denial.isNegationOf(d.getLeft()) && d.getRight().equals(target)) {
                return RuleCheck.ok();
            }
            if (denial.isNegationOf(d.getRight()) && d.getLeft().equals(target)) {
                return RuleCheck.ok();
            }
        }
        return RuleCheck.violation("DS needs A∨B and the negation of the other disjunct of " + target);
    }

    // --- 双条件 ---

    private static RuleCheck biconditionalIntro(RuleContext ctx) {
        String arity = ctx.arityProblem(2, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula target = ctx.getFormula();
        if (!target.is(FormulaKind.BICONDITIONAL)) {
            return RuleCheck.violation("↔I concludes a biconditional");
        }
        Formula forward = Formula.implies(target.getLeft(), target.getRight());
        Formula backward = Formula.implies(target.getRight(), target.getLeft());
        List<Formula> cited = ctx.getCitedFormulas();
        return RuleCheck.require(cited.contains(forward) && cited.contains(backward),
                "↔I needs " + forward + " and " + backward);
    }

    private static RuleCheck biconditionalElim(RuleContext ctx) {
        Formula target = ctx.getFormula();
        if (ctx.getCitedSubproofs().isEmpty() && ctx.getCitedFormulas().size() == 1) {
            Formula b = ctx.cited(0);
            if (!b.is(FormulaKind.BICONDITIONAL)) {
                return RuleCheck.violation("↔E needs a biconditional, got " + b);
            }
            return RuleCheck.require(target.equals(Formula.implies(b.getLeft(), b.getRight()))
                            || target.equals(Formula.implies(b.getRight(), b.getLeft())),
                    target + " is not a direction of " + b);
        }
        String arity = ctx.arityProblem(2, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        for (int i = 0; i < 2; i++) {
            Formula b = ctx.cited(i);
            Formula side = ctx.cited(1 - i);
            if (!b.is(FormulaKind.BICONDITIONAL)) {
                continue;
            }
            if (b.getLeft().equals(side) && b.getRight().equals(target)) {
                return RuleCheck.ok();
            }
            if (b.getRight().equals(side) && b.getLeft().equals(target)) {
                return RuleCheck.ok();
            }
        }
        return RuleCheck.violation("↔E needs A↔B with one side cited to conclude the other");
    }

    // --- 否定与 ⊥ ---

    private static RuleCheck negationIntro(RuleContext ctx) {
        String arity = ctx.arityProblem(0, 1);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula target = ctx.getFormula();
        if (!target.is(FormulaKind.NEGATION)) {
            return RuleCheck.violation("¬I concludes a negation ¬A");
        }
        Subproof sub = ctx.subproof(0);
        if (!target.getChild().equals(sub.getAssumption())) {
            return RuleCheck.violation("Subproof " + sub.range() + " assumes " + sub.getAssumption()
                    + ", not " + target.getChild());
        }
        return RuleCheck.require(sub.hasConclusion() && sub.getConclusion().isBottom(),
                "Subproof " + sub.range() + " must end with ⊥");
    }

    private static RuleCheck negationElim(RuleContext ctx) {
        String arity = ctx.arityProblem(2, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        if (!ctx.getFormula().isBottom()) {
            return RuleCheck.violation("¬E concludes ⊥");
        }
        Formula a = ctx.cited(0);
        Formula b = ctx.cited(1);
        return RuleCheck.require(a.isNegationOf(b) || b.isNegationOf(a), a + " and " + b + " do not contradict");
    }

    private static RuleCheck bottomElim(RuleContext ctx) {
        String arity = ctx.arityProblem(1, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        return RuleCheck.require(ctx.cited(0).isBottom(), "⊥E needs ⊥, got " + ctx.cited(0));
    }

    private static RuleCheck doubleNegationElim(RuleContext ctx) {
        String arity = ctx.arityProblem(1, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula expected = Formula.not(Formula.not(ctx.getFormula()));
        return RuleCheck.require(ctx.cited(0).equals(expected), "DNE needs " + expected + ", got " + ctx.cited(0));
    }

    private static RuleCheck doubleNegationIntro(RuleContext ctx) {
        String arity = ctx.arityProblem(1, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula expected = Formula.not(Formula.not(ctx.cited(0)));
        return RuleCheck.require(ctx.getFormula().equals(expected), "DNI concludes " + expected);
    }

    private static RuleCheck proofByContradiction(RuleContext ctx) {
        String arity = ctx.arityProblem(0, 1);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Subproof sub = ctx.subproof(0);
        Formula expected = Formula.not(ctx.getFormula());
        if (!expected.equals(sub.getAssumption())) {
            return RuleCheck.violation("Subproof " + sub.range() + " must assume " + expected
                    + ", got " + sub.getAssumption());
        }
        return RuleCheck.require(sub.hasConclusion() && sub.getConclusion().isBottom(),
                "Subproof " + sub.range() + " must end with ⊥");
    }

    /**
     * ID 用在公式行上时兼具 ¬I 与 PBC：假设 A 得 ¬A，或假设 ¬A 得 A；子证明须以 ⊥ 结束或含有一对 ψ/¬ψ。
     */
    private static RuleCheck indirectDerivation(RuleContext ctx) {
        String arity = ctx.arityProblem(0, 1);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Subproof sub = ctx.subproof(0);
        Formula target = ctx.getFormula();
        boolean negates = target.is(FormulaKind.NEGATION) && target.getChild().equals(sub.getAssumption());
        boolean refutes = Formula.not(target).equals(sub.getAssumption());
        if (!negates && !refutes) {
            return RuleCheck.violation("Subproof " + sub.range() + " assumes " + sub.getAssumption()
                    + ", which is neither the negation of " + target + " nor what " + target + " negates");
        }
        return RuleCheck.require(sub.reachesContradiction(),
                "Subproof " + sub.range() + " does not reach a contradiction");
    }

    // --- 量词 ---

    private static RuleCheck universalIntro(RuleContext ctx) {
        String arity = ctx.arityProblem(1, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula target = ctx.getFormula();
        if (!target.is(FormulaKind.UNIVERSAL)) {
            return RuleCheck.violation("∀I concludes a universal formula");
        }
        Formula instance = ctx.cited(0);
        InstanceMatch match = target.getBody().matchInstance(target.getVariable(), instance);
        if (!match.isMatched()) {
            return RuleCheck.violation(instance + " is not an instance of " + target);
        }
        Optional<Term> term = match.getTerm();
        if (term.isEmpty()) {
            return RuleCheck.ok();
        }
        if (term.get().isCompound()) {
            return RuleCheck.fail(ErrorKind.FRESHNESS_ERROR,
                    "∀I generalizes over a constant, not the compound term " + term.get());
        }
        String constant = term.get().getName();
        if (target.occursFree(constant)) {
            return RuleCheck.fail(ErrorKind.FRESHNESS_ERROR,
                    "Constant " + constant + " still occurs in " + target);
        }
        return freshInContext(ctx, constant, "∀I");
    }

    private static RuleCheck universalElim(RuleContext ctx) {
        String arity = ctx.arityProblem(1, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula universal = ctx.cited(0);
        if (!universal.is(FormulaKind.UNIVERSAL)) {
            return RuleCheck.violation("∀E needs a universal formula, got " + universal);
        }
        return instantiation(universal, ctx.getFormula(), "∀E");
    }

    private static RuleCheck existentialIntro(RuleContext ctx) {
        String arity = ctx.arityProblem(1, 0);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula target = ctx.getFormula();
        if (!target.is(FormulaKind.EXISTENTIAL)) {
            return RuleCheck.violation("∃I concludes an existential formula");
        }
        return instantiation(target, ctx.cited(0), "∃I");
    }

    /**
     * 检查 instance 是否为 quantified 主体代入某个项的结果，且代入不发生捕获。
     */
    private static RuleCheck instantiation(Formula quantified, Formula instance, String tag) {
        Formula body = quantified.getBody();
        String variable = quantified.getVariable();
        InstanceMatch match = body.matchInstance(variable, instance);
        if (!match.isMatched()) {
            return RuleCheck.violation(instance + " is not an instance of " + quantified);
        }
        Optional<Term> term = match.getTerm();
        if (term.isPresent() && body.wouldCapture(variable, term.get())) {
            return RuleCheck.violation(tag + ": substituting " + term.get() + " for " + variable
                    + " in " + quantified + " would capture a variable");
        }
        return RuleCheck.ok();
    }

    private static RuleCheck existentialElim(RuleContext ctx) {
        String arity = ctx.arityProblem(1, 1);
        if (arity != null) {
            return RuleCheck.violation(arity);
        }
        Formula existential = ctx.cited(0);
        if (!existential.is(FormulaKind.EXISTENTIAL)) {
            return RuleCheck.violation("∃E needs an existential formula, got " + existential);
        }
        Subproof sub = ctx.subproof(0);
        Formula target = ctx.getFormula();
        if (!target.equals(sub.getConclusion())) {
            return RuleCheck.violation("Subproof " + sub.range() + " ends with " + sub.getConclusion()
                    + ", not " + target);
        }
        if (!sub.hasAssumption()) {
            return RuleCheck.violation("Subproof " + sub.range() + " has no assumption");
        }
        InstanceMatch match = existential.getBody().matchInstance(existential.getVariable(), sub.getAssumption());
        if (!match.isMatched()) {
            return RuleCheck.violation("Subproof assumption " + sub.getAssumption()
                    + " is not an instance of " + existential);
        }
        Optional<Term> term = match.getTerm();
        if (term.isEmpty()) {
            return RuleCheck.ok();
        }
        if (term.get().isCompound()) {
            return RuleCheck.fail(ErrorKind.FRESHNESS_ERROR,
                    "∃E instantiates with a constant, not the compound term " + term.get());
        }
        String constant = term.get().getName();
        if (existential.occursFree(constant)) {
            return RuleCheck.fail(ErrorKind.FRESHNESS_ERROR, "Constant " + constant + " occurs in " + existential);
        }
        if (target.occursFree(constant)) {
            return RuleCheck.fail(ErrorKind.FRESHNESS_ERROR, "Constant " + constant + " occurs in " + target);
        }
        return freshInContext(ctx, constant, "∃E");
    }

    private static RuleCheck freshInContext(RuleContext ctx, String constant, String tag) {
        List<Formula> offending = new ArrayList<>();
        for (Formula f : ctx.context()) {
            if (f.occursFree(constant)) {
                offending.add(f);
            }
        }
        if (offending.isEmpty()) {
            return RuleCheck.ok();
        }
        return RuleCheck.fail(ErrorKind.FRESHNESS_ERROR, tag + ": constant " + constant
                + " is not arbitrary, it occurs in " + Collections.unmodifiableList(offending));
    }
}
