package org.deduction.syntax;

/**
 * 公式记号的种类。所有联结词同义写法在分词阶段被归并到同一个种类。
 */
public enum TokenType {
    /** 大写开头：命题原子或谓词名 */
    UPPER_NAME,
    /** 小写开头：项 (常元、变元、函数名) */
    LOWER_NAME,
    NOT,
    AND,
    OR,
    IMPLIES,
    IFF,
    BOTTOM,
    FORALL,
    EXISTS,
    LPAREN,
    RPAREN,
    COMMA,
    DOT,
    EOF
}
