package org.deduction.errors;

/**
 * 证明脚本在结构上不合法：行号前缀错误、依据无法解析、前提与声明不符、子证明嵌套错误等。
 */
public class ProofScriptException extends ProofEngineException {

    public ProofScriptException(ErrorKind kind, String message, int line) {
        super(kind, message, line, NO_POSITION);
    }

    public ProofScriptException(ErrorKind kind, String message, int line, int position) {
        super(kind, message, line, position);
    }

    /**
     * 把某一行中的公式语法错误包装为带行号的脚本错误。
     */
    public static ProofScriptException atLine(FormulaSyntaxException cause, int line) {
        ProofScriptException e = new ProofScriptException(ErrorKind.SYNTAX_ERROR,
                "Line " + line + ": " + cause.getMessage(), line, cause.getPosition());
        e.initCause(cause);
        return e;
    }
}
