package org.deduction.errors;

import lombok.Getter;

import java.util.Objects;

/**
 * 解析与校验内部使用的非受检异常，携带错误种类、行号与字符位置。
 * 门面层会把它转换为带类型的结果，不会抛给调用方。
 */
@Getter
public class ProofEngineException extends RuntimeException {

    /** 行号未知 */
    public static final int NO_LINE = 0;
    /** 位置未知 */
    public static final int NO_POSITION = -1;

    private final ErrorKind kind;
    private final int line;
    private final int position;

    public ProofEngineException(ErrorKind kind, String message, int line, int position) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null.");
        this.line = line;
        this.position = position;
    }

    public ProofEngineException(ErrorKind kind, String message, int line, int position, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null.");
        this.line = line;
        this.position = position;
    }

    public boolean hasLine() {
        return line != NO_LINE;
    }

    public boolean hasPosition() {
        return position != NO_POSITION;
    }
}
