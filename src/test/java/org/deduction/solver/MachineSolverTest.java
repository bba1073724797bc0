package org.deduction.solver;

import org.deduction.core.Formula;
import org.deduction.core.Sequent;
import org.deduction.rules.RuleKind;
import org.deduction.syntax.FormulaParser;
import org.deduction.syntax.LineRange;
import org.deduction.syntax.ProofScriptParser;
import org.deduction.utils.CancellationToken;
import org.deduction.verifier.ProofVerifier;
import org.deduction.verifier.VerificationResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MachineSolverTest {

    private static MachineSolver solver;
    private static Sequent chain;

    @BeforeAll
    static void setUp() {
        solver = new MachineSolver(200_000);
        chain = sequent(List.of("P -> Q", "Q -> R"), "P -> R");
    }

    private static Sequent sequent(List<String> premises, String conclusion) {
        return Sequent.of(FormulaParser.parseAll(premises), FormulaParser.parse(conclusion));
    }

    private static SolverResult solve(Sequent sequent, int maxDepth) {
        return solver.findProof(sequent, maxDepth, CancellationToken.none());
    }

    @Nested
    @DisplayName("找到证明 (Proofs Found)")
    class FoundTests {

        @Test
        @DisplayName("假言三段论：假设 P、两次 MP、→I")
        void testHypotheticalSyllogism() {
            SolverResult result = solve(chain, 10);
            List<RuleKind> rules = result.getLines().stream().map(BuiltLine::getRule).toList();
            assertAll(
                    () -> assertEquals(SolverStatus.FOUND, result.getStatus()),
                    () -> assertEquals(3, result.getLength()),
                    () -> assertEquals(1, result.getDepthReached()),
                    () -> assertEquals(List.of(RuleKind.PREMISE, RuleKind.PREMISE, RuleKind.ASSUMPTION,
                            RuleKind.MODUS_PONENS, RuleKind.MODUS_PONENS, RuleKind.COND_INTRO), rules),
                    () -> assertTrue(result.proof().orElseThrow().contains("P → R [→I 3-5]"))
            );
        }

        @Test
        @DisplayName("输出的文本可被解析并通过校验")
        void testRenderedProofVerifies() {
            for (Sequent s : List.of(chain,
                    sequent(List.of("P -> Q"), "~Q -> ~P"),
                    sequent(List.of("P & Q"), "Q & P"),
                    sequent(List.of("P | Q"), "Q | P"),
                    sequent(List.of("P <-> Q", "Q"), "P"))) {
                SolverResult result = solve(s, 6);
                assertTrue(result.isFound(), () -> "no proof for " + s + ": " + result);
                VerificationResult check = new ProofVerifier()
                        .verify(ProofScriptParser.parse(result.getProofText(), s.getPremises()), s);
                assertTrue(check.isValid(), () -> s + " produced an invalid proof: " + check);
            }
        }

        @Test
        @DisplayName("排中律需要嵌套的反证")
        void testExcludedMiddle() {
            SolverResult result = solve(sequent(List.of(), "P | ~P"), 8);
            assertAll(
                    () -> assertTrue(result.isFound(), result::toString),
                    () -> assertTrue(result.getLines().stream().anyMatch(l -> l.getRule() == RuleKind.INDIRECT_PROOF))
            );
        }

        @Test
        @DisplayName("结论本身是前提时补一行 R")
        void testConclusionIsPremise() {
            SolverResult result = solve(sequent(List.of("P"), "P"), 2);
            assertAll(
                    () -> assertTrue(result.isFound()),
                    () -> assertEquals(1, result.getLength()),
                    () -> assertEquals(RuleKind.REITERATION, result.getLines().get(1).getRule())
            );
        }
    }

    @Nested
    @DisplayName("搜索界限 (Search Bounds)")
    class BoundTests {

        @Test
        @DisplayName("无效的相继式在深度界限内找不到证明")
        void testNotFoundWithinBound() {
            SolverResult result = solve(sequent(List.of("P"), "Q"), 3);
            assertAll(
                    () -> assertEquals(SolverStatus.NOT_FOUND_WITHIN_BOUND, result.getStatus()),
                    () -> assertTrue(result.proof().isEmpty()),
                    () -> assertEquals(3, result.getDepthReached())
            );
        }

        @Test
        @DisplayName("节点预算耗尽")
        void testNodeBudget() {
            SolverResult result = new MachineSolver(1).findProof(chain, 10, CancellationToken.none());
            assertEquals(SolverStatus.NODE_BUDGET_EXHAUSTED, result.getStatus());
        }

        @Test
        @DisplayName("已取消的令牌立即停止搜索")
        void testCancelled() {
            CancellationToken token = CancellationToken.manual();
            token.cancel();
            SolverResult result = solver.findProof(chain, 10, token);
            assertEquals(SolverStatus.CANCELLED, result.getStatus());
        }

        @Test
        @DisplayName("参数检查")
        void testArguments() {
            assertAll(
                    () -> assertThrows(IllegalArgumentException.class, () -> new MachineSolver(0)),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> solver.findProof(chain, -1, CancellationToken.none()))
            );
        }
    }

    @Nested
    @DisplayName("最优长度核对 (Optimal Length)")
    class OptimalLengthTests {

        @Test
        @DisplayName("与声称的长度比较")
        void testVerifyOptimalLength() {
            OptimalLengthReport exact = solver.verifyOptimalLength(chain, 3, 10, CancellationToken.none());
            OptimalLengthReport generous = solver.verifyOptimalLength(chain, 5, 10, CancellationToken.none());
            OptimalLengthReport tight = solver.verifyOptimalLength(chain, 2, 10, CancellationToken.none());
            assertAll(
                    () -> assertTrue(exact.isValid()),
                    () -> assertTrue(exact.isOptimal()),
                    () -> assertFalse(exact.isShorterProofExists()),
                    () -> assertTrue(generous.isShorterProofExists()),
                    () -> assertFalse(tight.isOptimal()),
                    () -> assertEquals(3, tight.getFoundLength())
            );
        }

        @Test
        @DisplayName("找不到证明时报告错误")
        void testNoProof() {
            OptimalLengthReport report = solver.verifyOptimalLength(sequent(List.of("P"), "Q"), 2, 3,
                    CancellationToken.none());
            assertAll(
                    () -> assertFalse(report.isValid()),
                    () -> assertFalse(report.isOptimal()),
                    () -> assertNotNull(report.getError())
            );
        }
    }

    @Nested
    @DisplayName("裁剪与输出 (Pruning and Rendering)")
    class RenderTests {

        @Test
        @DisplayName("删去无用的行并重新编号")
        void testPrune() {
            Formula p = Formula.atom("P");
            Formula q = Formula.atom("Q");
            Formula pq = Formula.and(p, q);
            List<BuiltLine> lines = List.of(
                    new BuiltLine(1, pq, RuleKind.PREMISE, List.of(), List.of(), 0),
                    new BuiltLine(2, p, RuleKind.CONJ_ELIM, List.of(1), List.of(), 0),
                    new BuiltLine(3, q, RuleKind.CONJ_ELIM, List.of(1), List.of(), 0),
                    new BuiltLine(4, Formula.or(q, p), RuleKind.DISJ_INTRO, List.of(3), List.of(), 0));
            List<BuiltLine> pruned = ProofPruner.prune(lines, 4);
            assertAll(
                    () -> assertEquals(3, pruned.size()),
                    () -> assertEquals(List.of(2), pruned.get(2).getLines()),
                    () -> assertEquals(q, pruned.get(1).getFormula())
            );
        }

        @Test
        @DisplayName("子证明以花括号包围并缩进")
        void testRenderBracket() {
            Formula p = Formula.atom("P");
            List<BuiltLine> lines = List.of(
                    new BuiltLine(1, p, RuleKind.ASSUMPTION, List.of(), List.of(), 1),
                    new BuiltLine(2, Formula.implies(p, p), RuleKind.COND_INTRO, List.of(), List.of(LineRange.of(1, 1)), 0));
            assertEquals("{\n  P [AS]\n}\nP → P [→I 1-1]\n", ProofRenderer.renderBracket(lines));
        }
    }
}
