package org.deduction.errors;

/**
 * 公式文本无法解析：括号不匹配、未知符号或缺少操作数。
 * position 为出错记号在输入文本中的起始下标 (从 0 开始)。
 */
public class FormulaSyntaxException extends ProofEngineException {

    private final String input;

    public FormulaSyntaxException(String message, String input, int position) {
        super(ErrorKind.SYNTAX_ERROR, message + " at position " + position + " in \"" + input + "\"", NO_LINE, position);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
