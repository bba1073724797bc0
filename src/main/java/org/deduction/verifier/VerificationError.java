package org.deduction.verifier;

import lombok.Getter;
import org.deduction.errors.ErrorKind;
import org.deduction.errors.ProofEngineException;

import java.util.Objects;

/**
 * 带类型、定位到行的校验错误。rule 为出错行的规则标签，可能为 null。
 */
@Getter
public final class VerificationError {

    private final ErrorKind kind;
    private final int line;
    private final String rule;
    private final String message;
    private final int position;

    public VerificationError(ErrorKind kind, int line, String rule, String message, int position) {
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null.");
        this.line = line;
        this.rule = rule;
        this.message = Objects.requireNonNull(message, "Message cannot be null.");
        this.position = position;
    }

    public static VerificationError of(ErrorKind kind, int line, String rule, String message) {
        return new VerificationError(kind, line, rule, message, ProofEngineException.NO_POSITION);
    }

    public static VerificationError from(ProofEngineException e) {
        return new VerificationError(e.getKind(), e.getLine(), null, e.getMessage(), e.getPosition());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VerificationError that = (VerificationError) o;
        return line == that.line && position == that.position && kind == that.kind
                && Objects.equals(rule, that.rule) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, line, rule, message, position);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.getDisplayName());
        if (line > 0) {
            sb.append(" at line ").append(line);
        }
        if (rule != null) {
            sb.append(" (").append(rule).append(')');
        }
        return sb.append(": ").append(message).toString();
    }
}
