package org.deduction.syntax;

import org.deduction.core.Formula;
import org.deduction.core.FormulaKind;
import org.deduction.core.Term;
import org.deduction.errors.ErrorKind;
import org.deduction.errors.FormulaSyntaxException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    private static Formula p, q, r;

    @BeforeAll
    static void setUp() {
        p = Formula.atom("P");
        q = Formula.atom("Q");
        r = Formula.atom("R");
    }

    @Nested
    @DisplayName("联结词的各种写法 (Connective Spellings)")
    class SpellingTests {

        @Test
        @DisplayName("蕴涵的 unicode 与 ASCII 写法得到同一棵树")
        void testImplicationSpellings() {
            Formula expected = Formula.implies(p, q);
            assertAll(
                    () -> assertEquals(expected, FormulaParser.parse("P → Q")),
                    () -> assertEquals(expected, FormulaParser.parse("P->Q")),
                    () -> assertEquals(expected, FormulaParser.parse("P ⊃ Q")),
                    () -> assertEquals(expected, FormulaParser.parse("P => Q"))
            );
        }

        @Test
        @DisplayName("合取、析取、双条件、否定与 ⊥ 的写法")
        void testOtherSpellings() {
            assertAll(
                    () -> assertEquals(Formula.and(p, q), FormulaParser.parse("P & Q")),
                    () -> assertEquals(Formula.and(p, q), FormulaParser.parse("P /\\ Q")),
                    () -> assertEquals(Formula.and(p, q), FormulaParser.parse("P ^ Q")),
                    () -> assertEquals(Formula.or(p, q), FormulaParser.parse("P | Q")),
                    () -> assertEquals(Formula.or(p, q), FormulaParser.parse("P \\/ Q")),
                    () -> assertEquals(Formula.iff(p, q), FormulaParser.parse("P <-> Q")),
                    () -> assertEquals(Formula.iff(p, q), FormulaParser.parse("P <=> Q")),
                    () -> assertEquals(Formula.iff(p, q), FormulaParser.parse("P ≡ Q")),
                    () -> assertEquals(Formula.not(p), FormulaParser.parse("~P")),
                    () -> assertEquals(Formula.not(p), FormulaParser.parse("-P")),
                    () -> assertEquals(Formula.not(p), FormulaParser.parse("!P")),
                    () -> assertEquals(Formula.bottom(), FormulaParser.parse("_|_")),
                    () -> assertEquals(Formula.bottom(), FormulaParser.parse("#")),
                    () -> assertEquals(Formula.bottom(), FormulaParser.parse("!?"))
            );
        }

        @Test
        @DisplayName("量词的写法 (∀x.  ∀x  forall x.  \\forall x)")
        void testQuantifierSpellings() {
            Formula expected = Formula.forall("x", Formula.predicate("P", List.of(Term.of("x"))));
            assertAll(
                    () -> assertEquals(expected, FormulaParser.parse("∀x.P(x)")),
                    () -> assertEquals(expected, FormulaParser.parse("∀x P(x)")),
                    () -> assertEquals(expected, FormulaParser.parse("∀xP(x)")),
                    () -> assertEquals(expected, FormulaParser.parse("forall x. P(x)")),
                    () -> assertEquals(expected, FormulaParser.parse("\\forall x P(x)")),
                    () -> assertEquals(FormulaKind.EXISTENTIAL, FormulaParser.parse("exists y. Q(y)").getKind())
            );
        }

        @Test
        @DisplayName("函数项与多元谓词")
        void testTerms() {
            Formula f = FormulaParser.parse("L(f(a), y)");
            Term fa = Term.of("f", List.of(Term.of("a")));
            assertEquals(Formula.predicate("L", List.of(fa, Term.of("y"))), f);
        }
    }

    @Nested
    @DisplayName("优先级与结合性 (Precedence and Associativity)")
    class PrecedenceTests {

        @Test
        @DisplayName("→ 右结合")
        void testImplicationIsRightAssociative() {
            assertEquals(Formula.implies(p, Formula.implies(q, r)), FormulaParser.parse("P -> Q -> R"));
        }

        @Test
        @DisplayName("∧ 比 ∨ 紧，∨ 比 → 紧，→ 比 ↔ 紧")
        void testPrecedenceLadder() {
            assertAll(
                    () -> assertEquals(Formula.or(Formula.and(p, q), r), FormulaParser.parse("P & Q | R")),
                    () -> assertEquals(Formula.implies(Formula.or(p, q), r), FormulaParser.parse("P | Q -> R")),
                    () -> assertEquals(Formula.iff(Formula.implies(p, q), r), FormulaParser.parse("P -> Q <-> R"))
            );
        }

        @Test
        @DisplayName("¬ 只作用于紧随的原子，括号改变结合")
        void testNegationBindsTightly() {
            assertAll(
                    () -> assertEquals(Formula.and(Formula.not(p), q), FormulaParser.parse("~P & Q")),
                    () -> assertEquals(Formula.not(Formula.and(p, q)), FormulaParser.parse("~(P & Q)")),
                    () -> assertEquals(Formula.and(Formula.and(p, q), r), FormulaParser.parse("P & Q & R"))
            );
        }
    }

    @Nested
    @DisplayName("语法错误 (Syntax Errors)")
    class ErrorTests {

        @Test
        @DisplayName("缺少操作数时报告位置")
        void testMissingOperand() {
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("P ->"));
            assertAll(
                    () -> assertEquals(ErrorKind.SYNTAX_ERROR, e.getKind()),
                    () -> assertEquals(4, e.getPosition()),
                    () -> assertTrue(e.getMessage().contains("Missing operand"))
            );
        }

        @Test
        @DisplayName("未闭合的括号与未知符号")
        void testMalformedInput() {
            assertAll(
                    () -> assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("(P & Q")),
                    () -> assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("P $ Q")),
                    () -> assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("P Q")),
                    () -> assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("   ")),
                    () -> assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("a & P"))
            );
        }

        @Test
        @DisplayName("未知符号的位置指向该字符")
        void testUnknownSymbolPosition() {
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("P $ Q"));
            assertEquals(2, e.getPosition());
        }
    }

    @Nested
    @DisplayName("规范化 (Normalization)")
    class NormalizationTests {

        @Test
        @DisplayName("规范文本使用 unicode 并为二元子公式加括号")
        void testNormalize() {
            assertAll(
                    () -> assertEquals("(P ∧ Q) → R", FormulaNormalizer.normalize("P & Q -> R")),
                    () -> assertEquals("¬P ∨ ⊥", FormulaNormalizer.normalize("~P | _|_")),
                    () -> assertEquals("∀x.(P(x) → Q(x))", FormulaNormalizer.normalize("forall x. (P(x) -> Q(x))"))
            );
        }

        @Test
        @DisplayName("normalize 是幂等的")
        void testNormalizeIsIdempotent() {
            for (String text : List.of("P & Q -> R", "~~(A <-> B) | C", "∀x.∃y.L(x,y)", "(P -> Q) -> (~Q -> ~P)", "#")) {
                String once = FormulaNormalizer.normalize(text);
                assertEquals(once, FormulaNormalizer.normalize(once), "normalize should be idempotent on " + text);
            }
        }

        @Test
        @DisplayName("ASCII 输出可以被重新解析")
        void testAsciiRoundTrip() {
            String text = "(P & ~Q) -> (R <-> forall x.F(x))";
            assertTrue(FormulaNormalizer.sameFormula(text, FormulaNormalizer.toAscii(text)));
        }
    }
}
