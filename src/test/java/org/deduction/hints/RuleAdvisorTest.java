package org.deduction.hints;

import org.deduction.core.Formula;
import org.deduction.core.Sequent;
import org.deduction.errors.ErrorKind;
import org.deduction.rules.RuleKind;
import org.deduction.syntax.FormulaParser;
import org.deduction.verifier.VerificationError;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleAdvisorTest {

    private static RuleAdvisor advisor;

    @BeforeAll
    static void setUp() {
        advisor = new RuleAdvisor();
    }

    private static Sequent sequent(List<String> premises, String conclusion) {
        return Sequent.of(FormulaParser.parseAll(premises), FormulaParser.parse(conclusion));
    }

    @Nested
    @DisplayName("按证明状态给出规则 (State-based Suggestions)")
    class StateTests {

        @Test
        @DisplayName("空的部分证明：前提可直接用 MP")
        void testEmptyPartialProof() {
            ApplicableRules rules = advisor.applicableRules(sequent(List.of("P -> Q", "P"), "Q"), "");
            assertAll(
                    () -> assertEquals("proof-state", rules.getProvider()),
                    () -> assertEquals(List.of(RuleKind.MODUS_PONENS, RuleKind.INDIRECT_PROOF), rules.getRules()),
                    () -> assertEquals(RuleSuggestion.of(RuleKind.MODUS_PONENS, Formula.atom("Q"), 1, 2),
                            rules.getSuggestions().get(0)),
                    () -> assertEquals(3, rules.getNextLine()),
                    () -> assertTrue(rules.error().isEmpty())
            );
        }

        @Test
        @DisplayName("Show 块内以块的目标为准")
        void testOpenShowGoal() {
            ApplicableRules rules = advisor.applicableRules(sequent(List.of("P -> Q", "Q -> R"), "P -> R"),
                    "Show P->R\nP :AS");
            assertAll(
                    () -> assertEquals(List.of("MP", "→I", "PBC"), rules.tags()),
                    () -> assertEquals(1, rules.getDepth()),
                    () -> assertEquals(5, rules.getNextLine())
            );
        }

        @Test
        @DisplayName("目标已可见时建议 R")
        void testReiterationWhenGoalVisible() {
            ApplicableRules rules = advisor.applicableRules(sequent(List.of("P & Q"), "P"), "P [&E 1]");
            assertEquals(RuleKind.REITERATION, rules.getRules().get(0));
        }

        @Test
        @DisplayName("消去规则覆盖 ∨、↔、¬¬、∀")
        void testEliminations() {
            ApplicableRules rules = advisor.applicableRules(
                    sequent(List.of("P | Q", "A <-> B", "~~C", "forall x.F(x)"), "R"), "");
            assertTrue(rules.getRules().containsAll(List.of(RuleKind.DISJ_ELIM, RuleKind.BICOND_ELIM,
                    RuleKind.DOUBLE_NEG_ELIM, RuleKind.UNIV_ELIM)));
        }
    }

    @Nested
    @DisplayName("退回到目标形状 (Goal-shape Fallback)")
    class FallbackTests {

        @Test
        @DisplayName("部分证明无法解析时仍按目标给出引入规则")
        void testUnparsablePartialProof() {
            ApplicableRules rules = advisor.applicableRules(sequent(List.of("P", "Q"), "P & Q"), "Q [FOO 1]");
            assertAll(
                    () -> assertEquals("goal-shape", rules.getProvider()),
                    () -> assertEquals(List.of(RuleKind.CONJ_INTRO, RuleKind.INDIRECT_PROOF), rules.getRules()),
                    () -> assertEquals(ErrorKind.SYNTAX_ERROR, rules.error().map(VerificationError::getKind).orElseThrow())
            );
        }

        @Test
        @DisplayName("重放出错时带上错误")
        void testReplayError() {
            ApplicableRules rules = advisor.applicableRules(sequent(List.of("P"), "~Q"), "Q [R 1]");
            assertAll(
                    () -> assertEquals("goal-shape", rules.getProvider()),
                    () -> assertEquals(List.of("¬I", "PBC"), rules.tags()),
                    () -> assertEquals(ErrorKind.RULE_VIOLATION, rules.getError().getKind())
            );
        }

        @Test
        @DisplayName("⊥ 目标建议 ¬E，原子目标只剩 PBC")
        void testGoalShapes() {
            assertAll(
                    () -> assertEquals(List.of(RuleSuggestion.rule(RuleKind.NEG_ELIM)),
                            GoalShapeRuleProvider.forGoal(Formula.bottom())),
                    () -> assertEquals(List.of(RuleSuggestion.rule(RuleKind.INDIRECT_PROOF)),
                            GoalShapeRuleProvider.forGoal(Formula.atom("P"))),
                    () -> assertEquals(RuleKind.UNIV_INTRO,
                            GoalShapeRuleProvider.forGoal(FormulaParser.parse("forall x.P(x)")).get(0).getRule())
            );
        }

        @Test
        @DisplayName("至少需要一个提供者")
        void testProvidersRequired() {
            assertThrows(IllegalArgumentException.class, () -> new RuleAdvisor(List.of()));
        }
    }
}
