package org.deduction.symbolic;

import lombok.Getter;

import java.util.Objects;

/**
 * 一次可满足性查询的结果。可满足时附带完整赋值，下标为变量编号 (0 号位不用)。
 */
@Getter
public final class SatResult {

    private final SatStatus status;
    private final boolean[] assignment;
    private final String reason;

    private SatResult(SatStatus status, boolean[] assignment, String reason) {
        this.status = Objects.requireNonNull(status, "Status cannot be null.");
        this.assignment = assignment;
        this.reason = reason;
    }

    public static SatResult satisfiable(boolean[] assignment) {
        Objects.requireNonNull(assignment, "Assignment cannot be null.");
        return new SatResult(SatStatus.SATISFIABLE, assignment.clone(), null);
    }

    public static SatResult unsatisfiable() {
        return new SatResult(SatStatus.UNSATISFIABLE, null, null);
    }

    public static SatResult unknown(String reason) {
        return new SatResult(SatStatus.UNKNOWN, null, reason);
    }

    public boolean isSatisfiable() {
        return status == SatStatus.SATISFIABLE;
    }

    /**
     * 变量在模型中的取值。
     * @throws IllegalStateException 如果结果不是可满足。
     */
    public boolean valueOf(int variable) {
        if (assignment == null) {
            throw new IllegalStateException("No model available for status " + status);
        }
        return assignment[variable];
    }

    public boolean[] getAssignment() {
        return assignment == null ? null : assignment.clone();
    }

    @Override
    public String toString() {
        return "SatResult{" + status + (reason == null ? "" : ", " + reason) + '}';
    }
}
