package org.deduction.verifier;

import org.deduction.core.Formula;
import org.deduction.core.Sequent;
import org.deduction.errors.ErrorKind;
import org.deduction.symbolic.CountermodelEngine;
import org.deduction.symbolic.CountermodelResult;
import org.deduction.symbolic.SatBackendKind;
import org.deduction.symbolic.SemanticStatus;
import org.deduction.syntax.FormulaParser;
import org.deduction.syntax.ParsedProof;
import org.deduction.syntax.ProofScriptParser;
import org.deduction.utils.CancellationToken;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProofVerifierTest {

    private static ProofVerifier verifier;

    @BeforeAll
    static void setUp() {
        verifier = new ProofVerifier();
    }

    private static Sequent sequent(List<String> premises, String conclusion) {
        return Sequent.of(FormulaParser.parseAll(premises), FormulaParser.parse(conclusion));
    }

    private static VerificationResult verify(List<String> premises, String conclusion, String script) {
        Sequent sequent = sequent(premises, conclusion);
        ParsedProof proof = ProofScriptParser.parse(script, sequent.getPremises());
        return verifier.verify(proof, sequent);
    }

    private static ErrorKind errorKind(VerificationResult result) {
        return result.error().map(VerificationError::getKind).orElse(null);
    }

    @Nested
    @DisplayName("有效证明 (Valid Proofs)")
    class ValidTests {

        @Test
        @DisplayName("一步 MP")
        void testModusPonens() {
            VerificationResult result = verify(List.of("P -> Q", "P"), "Q", "Q [MP 1,2]");
            assertAll(
                    () -> assertTrue(result.isValid(), result::toString),
                    () -> assertEquals(1, result.getLines()),
                    () -> assertEquals(0, result.getDepth()),
                    () -> assertEquals(List.of("MP"), result.getRulesUsed())
            );
        }

        @Test
        @DisplayName("冒号方言中以 :CD 关闭的 Show 块")
        void testConditionalShowBlock() {
            VerificationResult result = verify(List.of(), "P -> P", "Show P->P / P :AS / :CD 2");
            assertAll(
                    () -> assertTrue(result.isValid(), result::toString),
                    () -> assertEquals(3, result.getLines()),
                    () -> assertEquals(1, result.getDepth()),
                    () -> assertTrue(result.getRulesUsed().contains("→I"))
            );
        }

        @Test
        @DisplayName("全称消去")
        void testUniversalElim() {
            VerificationResult result = verify(List.of("forall x.P(x)"), "P(a)", "P(a) :UE 1");
            assertAll(
                    () -> assertTrue(result.isValid(), result::toString),
                    () -> assertEquals(List.of("∀E"), result.getRulesUsed())
            );
        }

        @Test
        @DisplayName("括号方言的 →I 子证明")
        void testBracketSubproof() {
            String script = String.join("\n",
                    "{",
                    "P [AS]",
                    "Q [MP 1,3]",
                    "R [MP 2,4]",
                    "}",
                    "P -> R [->I 3-5]");
            VerificationResult result = verify(List.of("P -> Q", "Q -> R"), "P -> R", script);
            assertAll(
                    () -> assertTrue(result.isValid(), result::toString),
                    () -> assertEquals(4, result.getLines()),
                    () -> assertEquals(1, result.getDepth()),
                    () -> assertEquals(List.of("AS", "MP", "→I"), result.getRulesUsed())
            );
        }

        @Test
        @DisplayName("两个相邻子证明上的 ∨E")
        void testDisjunctionElim() {
            String script = String.join("\n",
                    "{",
                    "P [AS]",
                    "Q | P [VI 2]",
                    "}",
                    "{",
                    "Q [AS]",
                    "Q | P [VI 4]",
                    "}",
                    "Q | P [VE 1, 2-3, 4-5]");
            VerificationResult result = verify(List.of("P | Q"), "Q | P", script);
            assertAll(
                    () -> assertTrue(result.isValid(), result::toString),
                    () -> assertEquals(5, result.getLines()),
                    () -> assertTrue(result.getRulesUsed().contains("∨E"))
            );
        }

        @Test
        @DisplayName("没有关闭标记的 Show 块按 DD 隐式关闭")
        void testImplicitDirectDerivation() {
            VerificationResult result = verify(List.of("P -> Q", "P"), "Q", "Show Q\nQ :MP 1,2");
            assertAll(
                    () -> assertTrue(result.isValid(), result::toString),
                    () -> assertEquals(List.of("MP", "DD"), result.getRulesUsed())
            );
        }

        @Test
        @DisplayName(":ID 引用块外的矛盾")
        void testIndirectDerivation() {
            VerificationResult result = verify(List.of("P", "~P"), "Q", "Show Q\n~Q :AS\n:ID 1,2");
            assertTrue(result.isValid(), result::toString);
        }
    }

    @Nested
    @DisplayName("作用域与可见性 (Scope and Visibility)")
    class ScopeTests {

        @Test
        @DisplayName("已关闭子证明内部的行不可引用")
        void testClosedSubproofLineIsInvisible() {
            String script = String.join("\n",
                    "{",
                    "P [AS]",
                    "Q [MP 1,3]",
                    "}",
                    "Q [R 4]");
            VerificationResult result = verify(List.of("P -> Q", "Q -> R"), "Q", script);
            assertAll(
                    () -> assertFalse(result.isValid()),
                    () -> assertEquals(ErrorKind.SCOPE_ERROR, errorKind(result)),
                    () -> assertEquals(5, result.getError().getLine())
            );
        }

        @Test
        @DisplayName("不能引用当前行或之后的行")
        void testForwardCitation() {
            VerificationResult result = verify(List.of("P -> Q", "P"), "Q", "Q [MP 1,3]");
            assertEquals(ErrorKind.SCOPE_ERROR, errorKind(result));
        }

        @Test
        @DisplayName("子证明必须以 AS 开头，AS 不能出现在顶层")
        void testAssumptionPlacement() {
            VerificationResult noAssumption = verify(List.of("P"), "P", "{\nP [R 1]\n}\nP [R 1]");
            VerificationResult topLevel = verify(List.of("P"), "Q", "Q [AS]");
            assertAll(
                    () -> assertEquals(ErrorKind.SCOPE_ERROR, errorKind(noAssumption)),
                    () -> assertEquals(ErrorKind.SCOPE_ERROR, errorKind(topLevel))
            );
        }

        @Test
        @DisplayName("证明不能停在未关闭的子证明内")
        void testEndsInsideSubproof() {
            VerificationResult result = verify(List.of("P"), "P", "{\nQ [AS]");
            assertEquals(ErrorKind.SCOPE_ERROR, errorKind(result));
        }

        @Test
        @DisplayName(":DD 不能关闭带假设的 Show 块")
        void testDirectDerivationWithAssumption() {
            VerificationResult result = verify(List.of("P"), "Q", "Show Q\nQ :AS\n:DD 3");
            assertAll(
                    () -> assertFalse(result.isValid()),
                    () -> assertEquals(ErrorKind.SCOPE_ERROR, errorKind(result)),
                    () -> assertEquals(4, result.getError().getLine())
            );
        }

        @Test
        @DisplayName("带假设的 Show 块不能按 DD 隐式关闭")
        void testImplicitCloseWithAssumption() {
            VerificationResult result = verify(List.of(), "Q", "Show Q\n  Q :AS");
            assertAll(
                    () -> assertFalse(result.isValid()),
                    () -> assertEquals(ErrorKind.SCOPE_ERROR, errorKind(result))
            );
        }

        @Test
        @DisplayName(":ID 不能引用内层仍依赖假设的行")
        void testIndirectCitesInnerAssumption() {
            VerificationResult result = verify(List.of(), "Q", "Show Q\n~Q :AS\n  ⊥ :AS\n:ID 3");
            assertAll(
                    () -> assertFalse(result.isValid()),
                    () -> assertEquals(ErrorKind.SCOPE_ERROR, errorKind(result)),
                    () -> assertEquals(4, result.getError().getLine())
            );
        }

        @Test
        @DisplayName(":CD 不能引用内层仍依赖假设的行")
        void testConditionalCitesInnerAssumption() {
            VerificationResult result = verify(List.of(), "P -> Q", "Show P -> Q\nP :AS\n  Q :AS\n:CD 3");
            assertAll(
                    () -> assertFalse(result.isValid()),
                    () -> assertEquals(ErrorKind.SCOPE_ERROR, errorKind(result)),
                    () -> assertEquals(4, result.getError().getLine())
            );
        }
    }

    @Nested
    @DisplayName("可靠性 (Soundness)")
    class SoundnessTests {

        private final CountermodelEngine engine = new CountermodelEngine(5000, 20000, SatBackendKind.DPLL, 10000);

        private void assertSound(List<String> premises, String conclusion, String script) {
            VerificationResult result = verify(premises, conclusion, script);
            CountermodelResult semantics = engine.check(sequent(premises, conclusion), CancellationToken.none());
            assertAll(script,
                    () -> assertTrue(result.isValid(), result::toString),
                    () -> assertEquals(SemanticStatus.VALID, semantics.getStatus(), semantics::toString)
            );
        }

        private void assertRejectedAndInvalid(List<String> premises, String conclusion, String script) {
            VerificationResult result = verify(premises, conclusion, script);
            CountermodelResult semantics = engine.check(sequent(premises, conclusion), CancellationToken.none());
            assertAll(script,
                    () -> assertFalse(result.isValid(), result::toString),
                    () -> assertEquals(SemanticStatus.INVALID, semantics.getStatus(), semantics::toString)
            );
        }

        @Test
        @DisplayName("被接受的命题证明，其相继式都没有反模型")
        void testAcceptedProofsAreValidSequents() {
            assertSound(List.of("P -> Q", "P"), "Q", "Q [MP 1,2]");
            assertSound(List.of(), "P -> P", "Show P->P / P :AS / :CD 2");
            assertSound(List.of("P -> Q", "Q -> R"), "P -> R",
                    "{\nP [AS]\nQ [MP 1,3]\nR [MP 2,4]\n}\nP -> R [->I 3-5]");
            assertSound(List.of("P | Q"), "Q | P",
                    "{\nP [AS]\nQ | P [VI 2]\n}\n{\nQ [AS]\nQ | P [VI 4]\n}\nQ | P [VE 1, 2-3, 4-5]");
            assertSound(List.of("P -> Q", "P"), "Q", "Show Q\nQ :MP 1,2");
            assertSound(List.of("P", "~P"), "Q", "Show Q\n~Q :AS\n:ID 1,2");
        }

        @Test
        @DisplayName("无效相继式的伪证明全部被拒绝")
        void testInvalidSequentsAreRejected() {
            assertRejectedAndInvalid(List.of("P"), "Q", "Show Q\nQ :AS\n:DD 3");
            assertRejectedAndInvalid(List.of(), "Q", "Show Q\n  Q :AS");
            assertRejectedAndInvalid(List.of(), "Q", "Show Q\n~Q :AS\n  ⊥ :AS\n:ID 3");
            assertRejectedAndInvalid(List.of(), "P -> Q", "Show P -> Q\nP :AS\n  Q :AS\n:CD 3");
            assertRejectedAndInvalid(List.of("P -> Q", "Q"), "P", "P [MP 1,2]");
        }
    }

    @Nested
    @DisplayName("拒绝 (Rejections)")
    class RejectionTests {

        @Test
        @DisplayName("最终顶层行不是结论")
        void testConclusionMismatch() {
            VerificationResult result = verify(List.of("P", "Q"), "Q", "P [R 1]");
            assertAll(
                    () -> assertEquals(ErrorKind.CONCLUSION_MISMATCH, errorKind(result)),
                    () -> assertEquals(1, result.getLines())
            );
        }

        @Test
        @DisplayName("空证明")
        void testEmptyProof() {
            VerificationResult result = verify(List.of("P"), "P", "");
            assertAll(
                    () -> assertFalse(result.isValid()),
                    () -> assertEquals(ErrorKind.CONCLUSION_MISMATCH, errorKind(result)),
                    () -> assertEquals(0, result.getLines())
            );
        }

        @Test
        @DisplayName("规则形状不符时报告行号与规则")
        void testRuleViolation() {
            VerificationResult result = verify(List.of("P -> Q", "Q"), "P", "P [MP 1,2]");
            assertAll(
                    () -> assertEquals(ErrorKind.RULE_VIOLATION, errorKind(result)),
                    () -> assertEquals(3, result.getError().getLine()),
                    () -> assertEquals("MP", result.getError().getRule())
            );
        }

        @Test
        @DisplayName("∀I 对前提中出现的常元做概括")
        void testFreshness() {
            VerificationResult result = verify(List.of("P(a)"), "forall x.P(x)", "forall x.P(x) [UI 1]");
            assertEquals(ErrorKind.FRESHNESS_ERROR, errorKind(result));
        }
    }

    @Nested
    @DisplayName("部分证明重放 (Replay)")
    class ReplayTests {

        @Test
        @DisplayName("重放后列出可见行与下一行号")
        void testReplayState() {
            Sequent sequent = sequent(List.of("P -> Q", "P"), "Q");
            ProofState state = verifier.replay(ProofScriptParser.parse("Q [MP 1,2]", sequent.getPremises()), sequent);
            assertAll(
                    () -> assertTrue(state.isConsistent()),
                    () -> assertEquals(4, state.getNextLine()),
                    () -> assertEquals(3, state.getVisibleLines().size()),
                    () -> assertEquals(FormulaParser.parse("Q"), state.getVisibleLines().get(3))
            );
        }

        @Test
        @DisplayName("开放的子证明贡献假设与深度")
        void testReplayInsideSubproof() {
            Sequent sequent = sequent(List.of("P -> Q"), "P -> Q");
            ProofState state = verifier.replay(ProofScriptParser.parse("{\nR [AS]", sequent.getPremises()), sequent);
            assertAll(
                    () -> assertEquals(List.of(Formula.atom("R")), state.getOpenAssumptions()),
                    () -> assertEquals(1, state.getDepth())
            );
        }

        @Test
        @DisplayName("重放在第一个错误处停止")
        void testReplayStopsAtError() {
            Sequent sequent = sequent(List.of("P"), "Q");
            ProofState state = verifier.replay(ProofScriptParser.parse("Q [R 1]", sequent.getPremises()), sequent);
            assertAll(
                    () -> assertFalse(state.isConsistent()),
                    () -> assertEquals(2, state.getError().getLine())
            );
        }
    }
}
