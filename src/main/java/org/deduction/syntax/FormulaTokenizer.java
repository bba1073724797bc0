package org.deduction.syntax;

import org.apache.commons.lang3.tuple.Pair;
import org.deduction.errors.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * 将公式文本切分为记号，并在此阶段归并所有联结词的同义写法。
 * 较长的写法优先匹配，例如 "<->" 先于 "<"，"->" 先于 "-"，"!?" 先于 "!"。
 */
public final class FormulaTokenizer {

    private static final List<Pair<String, TokenType>> SPELLINGS = List.of(
            Pair.of("\\forall", TokenType.FORALL),
            Pair.of("\\exists", TokenType.EXISTS),
            Pair.of("<->", TokenType.IFF),
            Pair.of("<=>", TokenType.IFF),
            Pair.of("_|_", TokenType.BOTTOM),
            Pair.of("->", TokenType.IMPLIES),
            Pair.of("=>", TokenType.IMPLIES),
            Pair.of("/\\", TokenType.AND),
            Pair.of("\\/", TokenType.OR),
            Pair.of("!?", TokenType.BOTTOM),
            Pair.of("∧", TokenType.AND),
            Pair.of("&", TokenType.AND),
            Pair.of("^", TokenType.AND),
            Pair.of("∨", TokenType.OR),
            Pair.of("|", TokenType.OR),
            Pair.of("→", TokenType.IMPLIES),
            Pair.of("⊃", TokenType.IMPLIES),
            Pair.of("↔", TokenType.IFF),
            Pair.of("≡", TokenType.IFF),
            Pair.of("¬", TokenType.NOT),
            Pair.of("~", TokenType.NOT),
            Pair.of("-", TokenType.NOT),
            Pair.of("!", TokenType.NOT),
            Pair.of("⊥", TokenType.BOTTOM),
            Pair.of("#", TokenType.BOTTOM),
            Pair.of("∀", TokenType.FORALL),
            Pair.of("∃", TokenType.EXISTS),
            Pair.of("(", TokenType.LPAREN),
            Pair.of(")", TokenType.RPAREN),
            Pair.of(",", TokenType.COMMA),
            Pair.of(".", TokenType.DOT)
    );

    private FormulaTokenizer() {
    }

    /**
     * 分词。结果总以一个 EOF 记号结尾。
     * @throws FormulaSyntaxException 遇到无法识别的字符时。
     */
    public static List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = input.length();
        while (i < n) {
            char c = input.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (Character.isLetter(c) && c < 128) {
                int start = i;
                if (Character.isUpperCase(c)) {
                    i++;
                    while (i < n && isNameChar(input.charAt(i))) {
                        i++;
                    }
                    tokens.add(new Token(TokenType.UPPER_NAME, input.substring(start, i), start));
                } else {
                    // 小写名字遇到大写字母即结束，使 "∀xP(x)" 可以读作 ∀x P(x)
                    i++;
                    while (i < n && isLowerNameChar(input.charAt(i))) {
                        i++;
                    }
                    String word = input.substring(start, i);
                    switch (word) {
                        case "forall" -> tokens.add(new Token(TokenType.FORALL, word, start));
                        case "exists" -> tokens.add(new Token(TokenType.EXISTS, word, start));
                        default -> tokens.add(new Token(TokenType.LOWER_NAME, word, start));
                    }
                }
                continue;
            }
            Pair<String, TokenType> spelling = matchSpelling(input, i);
            if (spelling == null) {
                throw new FormulaSyntaxException("Unknown symbol '" + c + "'", input, i);
            }
            tokens.add(new Token(spelling.getRight(), spelling.getLeft(), i));
            i += spelling.getLeft().length();
        }
        tokens.add(new Token(TokenType.EOF, "", n));
        return tokens;
    }

    private static Pair<String, TokenType> matchSpelling(String input, int offset) {
        for (Pair<String, TokenType> spelling : SPELLINGS) {
            if (input.startsWith(spelling.getLeft(), offset)) {
                return spelling;
            }
        }
        return null;
    }

    private static boolean isNameChar(char c) {
        return c < 128 && (Character.isLetterOrDigit(c) || c == '_' || c == '\'');
    }

    private static boolean isLowerNameChar(char c) {
        return c < 128 && (Character.isLowerCase(c) || Character.isDigit(c) || c == '_' || c == '\'');
    }
}
