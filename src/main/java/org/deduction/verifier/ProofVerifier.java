package org.deduction.verifier;

import org.deduction.core.Formula;
import org.deduction.core.Sequent;
import org.deduction.errors.ErrorKind;
import org.deduction.rules.RuleCheck;
import org.deduction.rules.RuleContext;
import org.deduction.rules.RuleKind;
import org.deduction.rules.RuleValidators;
import org.deduction.syntax.Justification;
import org.deduction.syntax.LineKind;
import org.deduction.syntax.LineRange;
import org.deduction.syntax.ParsedProof;
import org.deduction.syntax.ProofLine;
import org.deduction.syntax.ScopeDecl;
import org.deduction.syntax.ScopeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * 作用域感知的证明校验器。
 * <p>
 * 对每一行执行一次状态转移：先根据行的作用域调整作用域栈 (关闭或开启帧)，
 * 再在可见性规则下解析引用，最后交给规则表校验。第一个错误即停止。
 * 一行可以引用同一作用域或祖先作用域中更早的行；已关闭子证明内部的行不可再引用，
 * 只能以区间形式引用整个子证明。
 * <p>
 * 此类无状态，可被多个线程共享。
 */
public class ProofVerifier {

    private static final Logger logger = LoggerFactory.getLogger(ProofVerifier.class);

    /**
     * 校验整份证明，并检查最终顶层行是否确立了结论。
     */
    public VerificationResult verify(ParsedProof proof, Sequent sequent) {
        Objects.requireNonNull(proof, "Parsed proof cannot be null.");
        Objects.requireNonNull(sequent, "Sequent cannot be null.");
        int lines = proof.derivedLines().size();
        int depth = proof.getLines().stream().mapToInt(ProofLine::getDepth).max().orElse(0);
        if (proof.isEmpty()) {
            VerificationError error = VerificationError.of(ErrorKind.CONCLUSION_MISMATCH, 0, null,
                    "No proof lines were supplied");
            return VerificationResult.rejected(error, 0, 0, List.of(), proof.getDialect());
        }
        Run run = new Run(proof, sequent);
        VerificationError error = run.replayAll();
        if (error == null) {
            error = run.finish();
        }
        List<String> used = new ArrayList<>(run.rulesUsed);
        if (error != null) {
            logger.info("ProofVerifier.verify: {} 被拒绝，{}", sequent, error);
            return VerificationResult.rejected(error, lines, depth, used, proof.getDialect());
        }
        logger.info("ProofVerifier.verify: {} 通过校验，{} 行，深度 {}", sequent, lines, depth);
        return VerificationResult.accepted(lines, depth, used, proof.getDialect());
    }

    /**
     * 重放部分证明而不检查结论，返回下一行可用的状态。
     */
    public ProofState replay(ParsedProof proof, Sequent sequent) {
        Objects.requireNonNull(proof, "Parsed proof cannot be null.");
        Objects.requireNonNull(sequent, "Sequent cannot be null.");
        Run run = new Run(proof, sequent);
        VerificationError error = run.replayAll();
        logger.debug("ProofVerifier.replay: 重放至第 {} 行{}", run.lastLine, error == null ? "" : "，遇到错误 " + error);
        return run.state(error);
    }

    /**
     * 单次校验的可变状态。
     */
    private static final class Run {

        private final ParsedProof proof;
        private final Sequent sequent;
        private final ScopeStack stack = new ScopeStack();
        private final Map<Integer, Formula> established = new HashMap<>();
        private final Map<Integer, Integer> lineScope = new HashMap<>();
        private final Map<LineRange, Subproof> closedSubproofs = new HashMap<>();
        private final Set<String> rulesUsed = new LinkedHashSet<>();
        private int lastLine;

        private Run(ParsedProof proof, Sequent sequent) {
            this.proof = proof;
            this.sequent = sequent;
            stack.push(new ScopeFrame(proof.scope(0), null));
        }

        private VerificationError replayAll() {
            for (ProofLine line : proof.getLines()) {
                VerificationError error = step(line);
                if (error != null) {
                    return error;
                }
                lastLine = line.getNumber();
            }
            return null;
        }

        private VerificationError step(ProofLine line) {
            if (line.getKind() == LineKind.CLOSING) {
                return closeShow(line);
            }
            VerificationError error = enter(line);
            if (error != null) {
                return error;
            }
            ScopeFrame frame = stack.peek();
            return switch (line.getKind()) {
                case PREMISE -> {
                    establish(line, frame);
                    yield null;
                }
                case SHOW -> {
                    frame.record(line.getNumber(), null);
                    lineScope.put(line.getNumber(), frame.getId());
                    yield null;
                }
                case FORMULA -> formulaLine(line, frame);
                case CLOSING -> throw new IllegalStateException("closing lines are handled before scope entry");
            };
        }

        // --- 作用域转移 ---

        private VerificationError enter(ProofLine line) {
            int scopeId = line.getScopeId();
            if (stack.contains(scopeId)) {
                while (stack.peek().getId() != scopeId) {
                    VerificationError error = closeTop();
                    if (error != null) {
                        return error;
                    }
                }
                return null;
            }
            ScopeDecl decl = proof.scope(scopeId);
            if (!stack.contains(decl.getParentId())) {
                return error(ErrorKind.SCOPE_ERROR, line, "Line " + line.getNumber() + " is not nested correctly");
            }
            while (stack.peek().getId() != decl.getParentId()) {
                VerificationError error = closeTop();
                if (error != null) {
                    return error;
                }
            }
            Formula goal = decl.getKind() == ScopeKind.SHOW
                    ? proof.line(decl.getShowLine()).map(ProofLine::getFormula).orElse(null)
                    : null;
            stack.push(new ScopeFrame(decl, goal));
            boolean assumption = line.getKind() == LineKind.FORMULA
                    && line.getJustification().getRule() == RuleKind.ASSUMPTION;
            if (decl.getKind() == ScopeKind.SUBPROOF && !assumption) {
                return error(ErrorKind.SCOPE_ERROR, line,
                        "Line " + line.getNumber() + ": a subproof must begin with an assumption (AS)");
            }
            return null;
        }

        /**
         * 关闭栈顶帧：Fitch 子证明登记为可按区间引用；没有关闭标记的 Show 块按 DD 隐式关闭。
         */
        private VerificationError closeTop() {
            ScopeFrame frame = stack.pop();
            switch (frame.getKind()) {
                case SUBPROOF -> {
                    Subproof subproof = new Subproof(frame.getId(), frame.getDecl().getParentId(),
                            frame.getFirstLine(), lastLine, frame.getAssumption(), frame.conclusionAt(lastLine),
                            frame.getFormulas());
                    closedSubproofs.put(subproof.range(), subproof);
                    logger.debug("ProofVerifier: 关闭子证明 {}", subproof);
                }
                case SHOW -> {
                    int showLine = frame.getDecl().getShowLine();
                    RuleCheck check = ShowBlockCloser.closeImplicitly(frame, lastLine);
                    if (!check.isPassed()) {
                        return VerificationError.of(check.getKind(), showLine, RuleKind.SHOW.getTag(),
                                "Line " + showLine + ": " + check.getReason());
                    }
                    established.put(showLine, frame.getGoal());
                    stack.peek().settle(lastLine, frame.getGoal());
                    rulesUsed.add(RuleKind.DIRECT_DERIVATION.getTag());
                }
                case ROOT -> throw new IllegalStateException("the root frame is never closed");
            }
            return null;
        }

        private VerificationError closeShow(ProofLine line) {
            int showScope = line.getClosesScope();
            ScopeDecl decl = proof.scope(showScope);
            Formula goal = proof.line(decl.getShowLine()).map(ProofLine::getFormula).orElse(null);
            if (!stack.contains(showScope)) {
                // Show 块内没有任何行
                if (!stack.contains(decl.getParentId())) {
                    return error(ErrorKind.SCOPE_ERROR, line, "Line " + line.getNumber() + " is not nested correctly");
                }
                while (stack.peek().getId() != decl.getParentId()) {
                    VerificationError error = closeTop();
                    if (error != null) {
                        return error;
                    }
                }
                stack.push(new ScopeFrame(decl, goal));
            }
            // 内层帧先关闭，标记只能引用 Show 块自身或外层可见的行
            ScopeFrame show = stack.find(showScope);
            while (stack.peek() != show) {
                VerificationError error = closeTop();
                if (error != null) {
                    return error;
                }
            }
            Justification justification = line.getJustification();
            List<Integer> refs = new ArrayList<>(justification.getLines());
            for (LineRange range : justification.getRanges()) {
                refs.add(range.getEnd());
            }
            List<Formula> cited = new ArrayList<>();
            VerificationError error = resolveLines(line, refs, cited);
            if (error != null) {
                return error;
            }
            RuleKind marker = justification.getRule();
            RuleCheck check = ShowBlockCloser.close(show, marker, cited);
            if (!check.isPassed()) {
                return error(check.getKind(), line, "Line " + line.getNumber() + ": " + check.getReason());
            }
            stack.pop();
            established.put(decl.getShowLine(), goal);
            ScopeFrame parent = stack.peek();
            parent.record(line.getNumber(), goal);
            lineScope.put(line.getNumber(), parent.getId());
            rulesUsed.add(marker.getTag());
            return null;
        }

        // --- 公式行 ---

        private VerificationError formulaLine(ProofLine line, ScopeFrame frame) {
            Justification justification = line.getJustification();
            RuleKind rule = justification.getRule();
            int number = line.getNumber();
            if (rule == RuleKind.PREMISE) {
                return error(ErrorKind.RULE_VIOLATION, line,
                        "Line " + number + ": PR lines are only allowed in the leading premise block");
            }
            if (rule == RuleKind.ASSUMPTION && (frame.getKind() == ScopeKind.ROOT || !frame.isEmpty())) {
                return error(ErrorKind.SCOPE_ERROR, line,
                        "Line " + number + ": AS is only allowed as the first line of a subproof or Show block");
            }
            List<Formula> cited = new ArrayList<>();
            VerificationError error = resolveLines(line, justification.getLines(), cited);
            if (error != null) {
                return error;
            }
            List<Subproof> subproofs = new ArrayList<>();
            for (LineRange range : justification.getRanges()) {
                if (range.getEnd() >= number) {
                    return error(ErrorKind.SCOPE_ERROR, line,
                            "Line " + number + " cannot cite lines " + range + ": only earlier lines may be cited");
                }
                Subproof subproof = closedSubproofs.get(range);
                if (subproof == null) {
                    return error(ErrorKind.SCOPE_ERROR, line,
                            "Line " + number + ": lines " + range + " do not form a closed subproof");
                }
                if (!stack.contains(subproof.getParentId())) {
                    return error(ErrorKind.SCOPE_ERROR, line,
                            "Line " + number + ": subproof " + range + " is not visible here");
                }
                subproofs.add(subproof);
            }
            RuleContext context = new RuleContext(number, rule, line.getFormula(), cited, subproofs,
                    stack.openAssumptions(), sequent.getPremises());
            RuleCheck check = RuleValidators.check(context);
            if (!check.isPassed()) {
                return error(check.getKind(), line, "Line " + number + ": " + check.getReason());
            }
            if (rule == RuleKind.ASSUMPTION) {
                frame.assume(line.getFormula());
            }
            establish(line, frame);
            rulesUsed.add(rule.getTag());
            logger.debug("ProofVerifier: 第 {} 行 {} [{}] 通过", number, line.getFormula(), justification);
            return null;
        }

        private void establish(ProofLine line, ScopeFrame frame) {
            frame.record(line.getNumber(), line.getFormula());
            established.put(line.getNumber(), line.getFormula());
            lineScope.put(line.getNumber(), frame.getId());
        }

        private VerificationError resolveLines(ProofLine line, List<Integer> refs, List<Formula> out) {
            int number = line.getNumber();
            for (int ref : refs) {
                if (ref >= number) {
                    return error(ErrorKind.SCOPE_ERROR, line,
                            "Line " + number + " cannot cite line " + ref + ": only earlier lines may be cited");
                }
                ProofLine target = proof.line(ref).orElse(null);
                if (target == null) {
                    return error(ErrorKind.SCOPE_ERROR, line, "Line " + number + " cites missing line " + ref);
                }
                if (target.getKind() == LineKind.CLOSING) {
                    return error(ErrorKind.SCOPE_ERROR, line,
                            "Line " + number + ": line " + ref + " is a closing marker, cite the Show line instead");
                }
                Formula formula = established.get(ref);
                if (formula == null) {
                    return error(ErrorKind.SCOPE_ERROR, line,
                            "Line " + number + ": Show line " + ref + " is not closed yet");
                }
                if (!stack.contains(lineScope.get(ref))) {
                    return error(ErrorKind.SCOPE_ERROR, line,
                            "Line " + number + ": line " + ref + " is inside a closed subproof and cannot be cited");
                }
                out.add(formula);
            }
            return null;
        }

        // --- 结束 ---

        private VerificationError finish() {
            List<ProofLine> lines = proof.getLines();
            ProofLine last = lines.get(lines.size() - 1);
            ScopeDecl decl = proof.scope(last.getScopeId());
            while (decl.getKind() != ScopeKind.ROOT) {
                if (decl.getKind() == ScopeKind.SUBPROOF) {
                    return VerificationError.of(ErrorKind.SCOPE_ERROR, last.getNumber(), null,
                            "The proof ends inside the subproof opened at line " + firstLineOf(decl.getId()));
                }
                decl = proof.scope(decl.getParentId());
            }
            while (stack.size() > 1) {
                VerificationError error = closeTop();
                if (error != null) {
                    return error;
                }
            }
            ProofLine top = null;
            for (int i = lines.size() - 1; i >= 0 && top == null; i--) {
                if (lines.get(i).getScopeId() == 0) {
                    top = lines.get(i);
                }
            }
            Formula achieved = top == null ? null : switch (top.getKind()) {
                case PREMISE, FORMULA -> top.getFormula();
                case SHOW -> established.get(top.getNumber());
                case CLOSING -> established.get(proof.scope(top.getClosesScope()).getShowLine());
            };
            Formula conclusion = sequent.getConclusion();
            if (achieved == null) {
                return VerificationError.of(ErrorKind.CONCLUSION_MISMATCH, last.getNumber(), null,
                        "The proof never establishes " + conclusion + " at the top level");
            }
            if (!achieved.equals(conclusion)) {
                return VerificationError.of(ErrorKind.CONCLUSION_MISMATCH, top.getNumber(), null,
                        "The final top-level line establishes " + achieved + ", not the conclusion " + conclusion);
            }
            return null;
        }

        private int firstLineOf(int scopeId) {
            for (ProofLine line : proof.getLines()) {
                if (line.getScopeId() == scopeId) {
                    return line.getNumber();
                }
            }
            return 0;
        }

        private ProofState state(VerificationError error) {
            TreeMap<Integer, Formula> visible = new TreeMap<>();
            for (Map.Entry<Integer, Formula> entry : established.entrySet()) {
                if (stack.contains(lineScope.get(entry.getKey()))) {
                    visible.put(entry.getKey(), entry.getValue());
                }
            }
            return new ProofState(visible, stack.openAssumptions(), stack.openGoals(), error,
                    proof.lastNumber() + 1, stack.size() - 1);
        }

        private static VerificationError error(ErrorKind kind, ProofLine line, String message) {
            return VerificationError.of(kind, line.getNumber(), line.getJustification().getRule().getTag(), message);
        }
    }
}
