package org.deduction.syntax;

import org.deduction.core.Formula;
import org.deduction.errors.ErrorKind;
import org.deduction.errors.ProofScriptException;
import org.deduction.rules.RuleKind;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProofScriptParserTest {

    private static List<Formula> chain;
    private static List<Formula> mp;

    @BeforeAll
    static void setUp() {
        chain = FormulaParser.parseAll(List.of("P -> Q", "Q -> R"));
        mp = FormulaParser.parseAll(List.of("P -> Q", "P"));
    }

    @Nested
    @DisplayName("方言判定 (Dialect Detection)")
    class DetectionTests {

        @Test
        @DisplayName("由第一个非空行决定方言")
        void testDetectDialect() {
            assertAll(
                    () -> assertEquals(Dialect.COLON, ProofScriptParser.detectDialect("Show P -> P\nP :AS")),
                    () -> assertEquals(Dialect.COLON, ProofScriptParser.detectDialect("\n\nQ :MP 1,2")),
                    () -> assertEquals(Dialect.COLON, ProofScriptParser.detectDialect("3. Q :MP 1,2")),
                    () -> assertEquals(Dialect.BRACKET, ProofScriptParser.detectDialect("Q [MP 1,2]")),
                    () -> assertEquals(Dialect.BRACKET, ProofScriptParser.detectDialect("{\nP [AS]\n}")),
                    () -> assertEquals(Dialect.BRACKET, ProofScriptParser.detectDialect(""))
            );
        }
    }

    @Nested
    @DisplayName("行号与前提 (Numbering and Premises)")
    class NumberingTests {

        @Test
        @DisplayName("隐式前提占据第 1..n 行")
        void testImplicitPremises() {
            ParsedProof proof = ProofScriptParser.parse("Q [MP 1,2]", mp);
            assertAll(
                    () -> assertEquals(3, proof.getLines().size()),
                    () -> assertEquals(2, proof.getPremiseCount()),
                    () -> assertTrue(proof.line(1).orElseThrow().isPremise()),
                    () -> assertEquals(3, proof.derivedLines().get(0).getNumber()),
                    () -> assertEquals(List.of(1, 2), proof.line(3).orElseThrow().getJustification().getLines()),
                    () -> assertFalse(proof.isEmpty())
            );
        }

        @Test
        @DisplayName("显式 PR 行必须按顺序列出声明的前提")
        void testExplicitPremises() {
            ParsedProof proof = ProofScriptParser.parse("P -> Q :PR\nP :PR\nQ :MP 1,2", mp);
            assertAll(
                    () -> assertEquals(Dialect.COLON, proof.getDialect()),
                    () -> assertEquals(3, proof.lastNumber()),
                    () -> assertEquals(LineKind.PREMISE, proof.line(2).orElseThrow().getKind())
            );
        }

        @Test
        @DisplayName("显式行号前缀必须与计数一致")
        void testNumberPrefix() {
            assertDoesNotThrow(() -> ProofScriptParser.parse("3. Q [MP 1,2]", mp));
            ProofScriptException e = assertThrows(ProofScriptException.class,
                    () -> ProofScriptParser.parse("4. Q [MP 1,2]", mp));
            assertAll(
                    () -> assertEquals(ErrorKind.SYNTAX_ERROR, e.getKind()),
                    () -> assertEquals(3, e.getLine())
            );
        }

        @Test
        @DisplayName("{ 与 } 行不占行号")
        void testBracesAreNotNumbered() {
            String script = String.join("\n",
                    "{",
                    "P [AS]",
                    "Q [MP 1,3]",
                    "R [MP 2,4]",
                    "}",
                    "P -> R [->I 3-5]");
            ParsedProof proof = ProofScriptParser.parse(script, chain);
            ProofLine assumption = proof.line(3).orElseThrow();
            ProofLine conclusion = proof.line(6).orElseThrow();
            assertAll(
                    () -> assertEquals(6, proof.lastNumber()),
                    () -> assertEquals(1, assumption.getDepth()),
                    () -> assertEquals(ScopeKind.SUBPROOF, proof.scope(assumption.getScopeId()).getKind()),
                    () -> assertEquals(0, conclusion.getDepth()),
                    () -> assertEquals(List.of(LineRange.of(3, 5)), conclusion.getJustification().getRanges()),
                    () -> assertEquals(RuleKind.COND_INTRO, conclusion.getJustification().getRule())
            );
        }
    }

    @Nested
    @DisplayName("冒号方言 (Colon Dialect)")
    class ColonTests {

        @Test
        @DisplayName("单行脚本以 \" / \" 分隔，Show 头部与关闭行都占行号")
        void testShowBlock() {
            ParsedProof proof = ProofScriptParser.parse("Show P->P / P :AS / :CD 2", List.of());
            ProofLine show = proof.line(1).orElseThrow();
            ProofLine assumption = proof.line(2).orElseThrow();
            ProofLine closing = proof.line(3).orElseThrow();
            assertAll(
                    () -> assertEquals(Dialect.COLON, proof.getDialect()),
                    () -> assertEquals(LineKind.SHOW, show.getKind()),
                    () -> assertEquals(Formula.implies(Formula.atom("P"), Formula.atom("P")), show.getFormula()),
                    () -> assertEquals(1, assumption.getDepth()),
                    () -> assertEquals(ScopeKind.SHOW, proof.scope(assumption.getScopeId()).getKind()),
                    () -> assertEquals(LineKind.CLOSING, closing.getKind()),
                    () -> assertEquals(assumption.getScopeId(), closing.getClosesScope()),
                    () -> assertEquals(0, closing.getDepth()),
                    () -> assertNull(closing.getFormula())
            );
        }

        @Test
        @DisplayName("缩进开启 Fitch 子证明")
        void testIndentedSubproof() {
            String script = String.join("\n",
                    "P -> Q :PR",
                    "Q -> R :PR",
                    "  P :AS",
                    "  Q :MP 1,3",
                    "  R :MP 2,4",
                    "P -> R :CD 3-5");
            ParsedProof proof = ProofScriptParser.parse(script, chain);
            assertAll(
                    () -> assertEquals(1, proof.line(4).orElseThrow().getDepth()),
                    () -> assertEquals(0, proof.line(6).orElseThrow().getDepth()),
                    () -> assertEquals(2, proof.getScopes().size())
            );
        }
    }

    @Nested
    @DisplayName("方言等价 (Dialect Equivalence)")
    class EquivalenceTests {

        @Test
        @DisplayName("同一证明的两种写法得到相同的行与作用域")
        void testSameProofBothDialects() {
            String bracket = String.join("\n",
                    "{",
                    "P [AS]",
                    "Q [MP 1,3]",
                    "R [MP 2,4]",
                    "}",
                    "P -> R [->I 3-5]");
            String colon = String.join("\n",
                    "P -> Q :PR",
                    "Q -> R :PR",
                    "  P :AS",
                    "  Q :MP 1,3",
                    "  R :MP 2,4",
                    "P -> R :CD 3-5");
            ParsedProof a = ProofScriptParser.parse(bracket, chain);
            ParsedProof b = ProofScriptParser.parse(colon, chain);
            assertAll(
                    () -> assertEquals(Dialect.BRACKET, a.getDialect()),
                    () -> assertEquals(Dialect.COLON, b.getDialect()),
                    () -> assertEquals(a.getLines(), b.getLines()),
                    () -> assertEquals(a.getScopes(), b.getScopes())
            );
        }

        @Test
        @DisplayName("规则别名归一到同一标签")
        void testRuleAliases() {
            ParsedProof a = ProofScriptParser.parse("Q [MP 1,2]", mp);
            ParsedProof b = ProofScriptParser.parse("Q :->E 1, 2", mp);
            assertEquals(a.getLines(), b.getLines());
        }
    }

    @Nested
    @DisplayName("依据解析 (Justification Parsing)")
    class JustificationTests {

        @Test
        @DisplayName("数字为行引用，区间为子证明引用，其余为规则名")
        void testParseJustification() {
            Justification j = ProofScriptParser.parseJustification("∨E 1, 2-3, 4-5", 6);
            Justification reversed = ProofScriptParser.parseJustification("2-6 →I", 7);
            assertAll(
                    () -> assertEquals(RuleKind.DISJ_ELIM, j.getRule()),
                    () -> assertEquals(List.of(1), j.getLines()),
                    () -> assertEquals(List.of(LineRange.of(2, 3), LineRange.of(4, 5)), j.getRanges()),
                    () -> assertEquals(RuleKind.COND_INTRO, reversed.getRule()),
                    () -> assertEquals(List.of(LineRange.of(2, 6)), reversed.getRanges())
            );
        }
    }

    @Nested
    @DisplayName("结构错误 (Structural Errors)")
    class ErrorTests {

        @Test
        @DisplayName("未知规则是语法错误")
        void testUnknownRule() {
            ProofScriptException e = assertThrows(ProofScriptException.class,
                    () -> ProofScriptParser.parse("Q [FOO 1,2]", mp));
            assertAll(
                    () -> assertEquals(ErrorKind.SYNTAX_ERROR, e.getKind()),
                    () -> assertEquals(3, e.getLine()),
                    () -> assertTrue(e.getMessage().contains("FOO"))
            );
        }

        @Test
        @DisplayName("冒号方言缺少 ':' 是语法错误")
        void testMissingColon() {
            ProofScriptException e = assertThrows(ProofScriptException.class,
                    () -> ProofScriptParser.parse("Q", mp, Dialect.COLON));
            assertEquals(ErrorKind.SYNTAX_ERROR, e.getKind());
        }

        @Test
        @DisplayName("行内公式错误带上行号")
        void testFormulaErrorCarriesLine() {
            ProofScriptException e = assertThrows(ProofScriptException.class,
                    () -> ProofScriptParser.parse("Q -> [MP 1,2]", mp));
            assertAll(
                    () -> assertEquals(ErrorKind.SYNTAX_ERROR, e.getKind()),
                    () -> assertEquals(3, e.getLine()),
                    () -> assertTrue(e.hasPosition())
            );
        }

        @Test
        @DisplayName("多余的 } 与没有 Show 的关闭标记是作用域错误")
        void testScopeErrors() {
            ProofScriptException brace = assertThrows(ProofScriptException.class,
                    () -> ProofScriptParser.parse("Q [MP 1,2]\n}", mp));
            ProofScriptException closing = assertThrows(ProofScriptException.class,
                    () -> ProofScriptParser.parse("Q :MP 1,2\n:CD 3", mp));
            assertAll(
                    () -> assertEquals(ErrorKind.SCOPE_ERROR, brace.getKind()),
                    () -> assertEquals(ErrorKind.SCOPE_ERROR, closing.getKind())
            );
        }

        @Test
        @DisplayName("PR 行与声明的前提不符")
        void testPremiseMismatch() {
            ProofScriptException wrong = assertThrows(ProofScriptException.class,
                    () -> ProofScriptParser.parse("P :PR\nP -> Q :PR", mp));
            ProofScriptException missing = assertThrows(ProofScriptException.class,
                    () -> ProofScriptParser.parse("P -> Q :PR\nQ :MP 1,2", mp));
            assertAll(
                    () -> assertEquals(ErrorKind.RULE_VIOLATION, wrong.getKind()),
                    () -> assertEquals(1, wrong.getLine()),
                    () -> assertEquals(ErrorKind.RULE_VIOLATION, missing.getKind())
            );
        }
    }
}
