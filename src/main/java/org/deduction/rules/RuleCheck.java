package org.deduction.rules;

import lombok.Getter;
import org.deduction.errors.ErrorKind;

import java.util.Objects;

/**
 * 单条规则校验的结果：通过，或带错误种类与可直接展示的原因的拒绝。
 */
@Getter
public final class RuleCheck {

    private static final RuleCheck OK = new RuleCheck(true, null, null);

    private final boolean passed;
    private final ErrorKind kind;
    private final String reason;

    private RuleCheck(boolean passed, ErrorKind kind, String reason) {
        this.passed = passed;
        this.kind = kind;
        this.reason = reason;
    }

    public static RuleCheck ok() {
        return OK;
    }

    public static RuleCheck fail(ErrorKind kind, String reason) {
        Objects.requireNonNull(kind, "Error kind cannot be null.");
        Objects.requireNonNull(reason, "Reason cannot be null.");
        return new RuleCheck(false, kind, reason);
    }

    public static RuleCheck violation(String reason) {
        return fail(ErrorKind.RULE_VIOLATION, reason);
    }

    /**
     * 条件不成立时返回拒绝。
     */
    public static RuleCheck require(boolean condition, String reason) {
        return condition ? OK : violation(reason);
    }

    @Override
    public String toString() {
        return passed ? "RuleCheck(ok)" : "RuleCheck(" + kind + ": " + reason + ")";
    }
}
