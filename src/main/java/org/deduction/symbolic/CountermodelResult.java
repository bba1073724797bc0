package org.deduction.symbolic;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 相继式的语义分类结果。INVALID 时附带只含原子的反模型；其它情况下 reason 说明原因。
 */
@Getter
public final class CountermodelResult {

    private final SemanticStatus status;
    private final SortedMap<String, Boolean> model;
    private final int variableCount;
    private final int clauseCount;
    private final String backend;
    private final String reason;

    private CountermodelResult(SemanticStatus status, Map<String, Boolean> model, int variableCount,
                               int clauseCount, String backend, String reason) {
        this.status = Objects.requireNonNull(status, "Status cannot be null.");
        this.model = model == null ? null : Collections.unmodifiableSortedMap(new TreeMap<>(model));
        this.variableCount = variableCount;
        this.clauseCount = clauseCount;
        this.backend = backend;
        this.reason = reason;
    }

    public static CountermodelResult valid(int variableCount, int clauseCount, String backend) {
        return new CountermodelResult(SemanticStatus.VALID, null, variableCount, clauseCount, backend, null);
    }

    public static CountermodelResult invalid(Map<String, Boolean> model, int variableCount, int clauseCount,
                                             String backend) {
        Objects.requireNonNull(model, "Countermodel cannot be null.");
        return new CountermodelResult(SemanticStatus.INVALID, model, variableCount, clauseCount, backend, null);
    }

    public static CountermodelResult notApplicable(String reason) {
        return new CountermodelResult(SemanticStatus.NOT_APPLICABLE, null, 0, 0, null, reason);
    }

    public static CountermodelResult boundExceeded(int variableCount, int clauseCount, String backend, String reason) {
        return new CountermodelResult(SemanticStatus.BOUND_EXCEEDED, null, variableCount, clauseCount, backend, reason);
    }

    public boolean isValid() {
        return status == SemanticStatus.VALID;
    }

    public Optional<SortedMap<String, Boolean>> counterModel() {
        return Optional.ofNullable(model);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CountermodelResult{").append(status);
        if (model != null) {
            sb.append(", model=").append(model);
        }
        if (reason != null) {
            sb.append(", reason=").append(reason);
        }
        return sb.append(", vars=").append(variableCount).append(", clauses=").append(clauseCount).append('}').toString();
    }
}
