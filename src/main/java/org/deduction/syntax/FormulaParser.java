package org.deduction.syntax;

import org.deduction.core.Formula;
import org.deduction.core.FormulaKind;
import org.deduction.core.Term;
import org.deduction.errors.FormulaSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 递归下降的公式解析器。
 * 优先级由紧到松：一元 ¬ 与量词前缀、∧、∨、→、↔。
 * → 右结合，∧ ∨ ↔ 左结合，括号可改变结合。
 */
public final class FormulaParser {

    private static final Logger logger = LoggerFactory.getLogger(FormulaParser.class);

    private final String input;
    private final List<Token> tokens;
    private int index;

    private FormulaParser(String input) {
        this.input = input;
        this.tokens = FormulaTokenizer.tokenize(input);
        this.index = 0;
    }

    /**
     * 解析一条公式。
     * @param text 任意受支持写法的公式文本。
     * @return 规范的公式 AST。
     * @throws FormulaSyntaxException 文本不合法时，附带出错位置。
     */
    public static Formula parse(String text) {
        Objects.requireNonNull(text, "Formula text cannot be null.");
        if (text.isBlank()) {
            throw new FormulaSyntaxException("Empty formula", text, 0);
        }
        try {
            FormulaParser parser = new FormulaParser(text);
            Formula result = parser.parseIff();
            parser.expect(TokenType.EOF, "Unexpected token");
            return result;
        } catch (FormulaSyntaxException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("FormulaParser.parse: 解析 \"{}\" 时发生内部错误", text, e);
            FormulaSyntaxException converted = new FormulaSyntaxException("Malformed formula", text, 0);
            converted.initCause(e);
            throw converted;
        }
    }

    public static List<Formula> parseAll(List<String> texts) {
        List<Formula> result = new ArrayList<>(texts.size());
        for (String text : texts) {
            result.add(parse(text));
        }
        return result;
    }

    /**
     * 解析单个项，例如 "a" 或 "f(a,x)"。
     */
    public static Term parseTerm(String text) {
        Objects.requireNonNull(text, "Term text cannot be null.");
        FormulaParser parser = new FormulaParser(text);
        Term term = parser.term();
        parser.expect(TokenType.EOF, "Unexpected token");
        return term;
    }

    private Formula parseIff() {
        Formula left = parseImplies();
        while (peek().is(TokenType.IFF)) {
            advance();
            left = Formula.iff(left, parseImplies());
        }
        return left;
    }

    private Formula parseImplies() {
        Formula left = parseOr();
        if (peek().is(TokenType.IMPLIES)) {
            advance();
            return Formula.implies(left, parseImplies());
        }
        return left;
    }

    private Formula parseOr() {
        Formula left = parseAnd();
        while (peek().is(TokenType.OR)) {
            advance();
            left = Formula.or(left, parseAnd());
        }
        return left;
    }

    private Formula parseAnd() {
        Formula left = parseUnary();
        while (peek().is(TokenType.AND)) {
            advance();
            left = Formula.and(left, parseUnary());
        }
        return left;
    }

    private Formula parseUnary() {
        Token token = peek();
        switch (token.getType()) {
            case NOT -> {
                advance();
                return Formula.not(parseUnary());
            }
            case FORALL, EXISTS -> {
                advance();
                Token variable = expect(TokenType.LOWER_NAME, "Expected a variable after quantifier");
                if (peek().is(TokenType.DOT)) {
                    advance();
                }
                FormulaKind kind = token.is(TokenType.FORALL) ? FormulaKind.UNIVERSAL : FormulaKind.EXISTENTIAL;
                return Formula.quantifier(kind, variable.getText(), parseUnary());
            }
            default -> {
                return parsePrimary();
            }
        }
    }

    private Formula parsePrimary() {
        Token token = peek();
        return switch (token.getType()) {
            case LPAREN -> {
                advance();
                Formula inner = parseIff();
                expect(TokenType.RPAREN, "Expected ')'");
                yield inner;
            }
            case BOTTOM -> {
                advance();
                yield Formula.bottom();
            }
            case UPPER_NAME -> {
                advance();
                if (peek().is(TokenType.LPAREN)) {
                    yield Formula.predicate(token.getText(), arguments());
                }
                yield Formula.atom(token.getText());
            }
            case LOWER_NAME -> throw error("Expected a formula but found term '" + token.getText() + "'", token);
            case EOF -> throw error("Missing operand", token);
            default -> throw error("Unexpected token '" + token.getText() + "'", token);
        };
    }

    private List<Term> arguments() {
        expect(TokenType.LPAREN, "Expected '('");
        List<Term> args = new ArrayList<>();
        args.add(term());
        while (peek().is(TokenType.COMMA)) {
            advance();
            args.add(term());
        }
        expect(TokenType.RPAREN, "Expected ')'");
        return args;
    }

    private Term term() {
        Token name = expect(TokenType.LOWER_NAME, "Expected a term");
        if (peek().is(TokenType.LPAREN)) {
            return Term.of(name.getText(), arguments());
        }
        return Term.of(name.getText());
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (!token.is(TokenType.EOF)) {
            index++;
        }
        return token;
    }

    private Token expect(TokenType type, String message) {
        Token token = peek();
        if (!token.is(type)) {
            String found = token.is(TokenType.EOF) ? "end of input" : "'" + token.getText() + "'";
            throw error(message + ", found " + found, token);
        }
        return advance();
    }

    private FormulaSyntaxException error(String message, Token token) {
        return new FormulaSyntaxException(message, input, token.getPosition());
    }
}
