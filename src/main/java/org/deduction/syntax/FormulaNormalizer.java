package org.deduction.syntax;

import org.deduction.core.Formula;

/**
 * 把任意写法的公式文本转换为规范的 unicode 文本。
 * 规范文本再次解析得到同一棵 AST，因此 normalize 是幂等的。
 */
public final class FormulaNormalizer {

    private FormulaNormalizer() {
    }

    public static String normalize(String text) {
        return FormulaParser.parse(text).toString();
    }

    public static String toAscii(String text) {
        return FormulaParser.parse(text).toAsciiString();
    }

    /**
     * 两段文本在归一化之后是否表示同一公式。
     */
    public static boolean sameFormula(String a, String b) {
        return FormulaParser.parse(a).equals(FormulaParser.parse(b));
    }
}
