package org.deduction.syntax;

import lombok.Getter;

import java.util.Objects;

/**
 * 分词结果中的一个记号，记录其在原始文本中的起始位置。
 */
@Getter
public final class Token {

    private final TokenType type;
    private final String text;
    private final int position;

    public Token(TokenType type, String text, int position) {
        this.type = Objects.requireNonNull(type, "Token type cannot be null.");
        this.text = Objects.requireNonNull(text, "Token text cannot be null.");
        this.position = position;
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + position;
    }
}
