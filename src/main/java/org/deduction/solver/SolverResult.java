package org.deduction.solver;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一次证明搜索的结果。找到证明时 proofText 为方括号方言文本，length 为不计前提与假设的行数。
 */
@Getter
public final class SolverResult {

    private final SolverStatus status;
    private final List<BuiltLine> lines;
    private final String proofText;
    private final int length;
    private final int depthReached;
    private final long nodesExplored;
    private final String message;

    private SolverResult(SolverStatus status, List<BuiltLine> lines, String proofText, int depthReached,
                         long nodesExplored, String message) {
        this.status = Objects.requireNonNull(status, "Status cannot be null.");
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
        this.proofText = proofText;
        this.length = (int) lines.stream().filter(BuiltLine::countsTowardLength).count();
        this.depthReached = depthReached;
        this.nodesExplored = nodesExplored;
        this.message = message;
    }

    public static SolverResult found(List<BuiltLine> lines, String proofText, int depthReached, long nodesExplored) {
        return new SolverResult(SolverStatus.FOUND, lines, proofText, depthReached, nodesExplored, null);
    }

    public static SolverResult notFound(SolverStatus status, int depthReached, long nodesExplored, String message) {
        if (status == SolverStatus.FOUND) {
            throw new IllegalArgumentException("A failed search cannot carry status FOUND");
        }
        return new SolverResult(status, List.of(), null, depthReached, nodesExplored, message);
    }

    public boolean isFound() {
        return status == SolverStatus.FOUND;
    }

    public Optional<String> proof() {
        return Optional.ofNullable(proofText);
    }

    @Override
    public String toString() {
        return "SolverResult{" + status + (isFound() ? ", length=" + length : ", " + message)
                + ", depth=" + depthReached + ", nodes=" + nodesExplored + '}';
    }
}
