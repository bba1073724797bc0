package org.deduction.verifier;

import lombok.Getter;
import org.deduction.symbolic.SemanticStatus;
import org.deduction.syntax.Dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 一次校验请求的结果。
 * lines 为不含前提的行数，depth 为最大嵌套深度，rulesUsed 按首次使用顺序列出规则标签 (不含 PR)。
 * 证明缺失或被拒绝时附带语义分类，相继式无效时附带只含原子的反模型。
 */
@Getter
public final class VerificationResult {

    private final boolean valid;
    private final VerificationError error;
    private final int lines;
    private final int depth;
    private final List<String> rulesUsed;
    private final SortedMap<String, Boolean> counterModel;
    private final Dialect dialect;
    private final SemanticStatus semanticStatus;

    public VerificationResult(boolean valid, VerificationError error, int lines, int depth, List<String> rulesUsed,
                              Map<String, Boolean> counterModel, Dialect dialect, SemanticStatus semanticStatus) {
        if (valid && error != null) {
            throw new IllegalArgumentException("A valid result cannot carry an error.");
        }
        if (!valid && error == null) {
            throw new IllegalArgumentException("An invalid result must carry an error.");
        }
        this.valid = valid;
        this.error = error;
        this.lines = lines;
        this.depth = depth;
        this.rulesUsed = Collections.unmodifiableList(new ArrayList<>(rulesUsed));
        this.counterModel = counterModel == null ? null : Collections.unmodifiableSortedMap(new TreeMap<>(counterModel));
        this.dialect = dialect;
        this.semanticStatus = semanticStatus == null ? SemanticStatus.NOT_CHECKED : semanticStatus;
    }

    public static VerificationResult accepted(int lines, int depth, List<String> rulesUsed, Dialect dialect) {
        return new VerificationResult(true, null, lines, depth, rulesUsed, null, dialect, SemanticStatus.NOT_CHECKED);
    }

    public static VerificationResult rejected(VerificationError error, int lines, int depth, List<String> rulesUsed,
                                              Dialect dialect) {
        return new VerificationResult(false, error, lines, depth, rulesUsed, null, dialect, SemanticStatus.NOT_CHECKED);
    }

    /**
     * 附加语义分析的结果，其余字段不变。
     */
    public VerificationResult withSemantics(SemanticStatus status, Map<String, Boolean> model) {
        return new VerificationResult(valid, error, lines, depth, rulesUsed, model, dialect, status);
    }

    public Optional<VerificationError> error() {
        return Optional.ofNullable(error);
    }

    public Optional<SortedMap<String, Boolean>> counterModel() {
        return Optional.ofNullable(counterModel);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("VerificationResult{valid=").append(valid)
                .append(", lines=").append(lines)
                .append(", depth=").append(depth)
                .append(", rulesUsed=").append(rulesUsed)
                .append(", dialect=").append(dialect == null ? "?" : dialect.getLabel())
                .append(", semantic=").append(semanticStatus);
        if (error != null) {
            sb.append(", error=").append(error);
        }
        if (counterModel != null) {
            sb.append(", counterModel=").append(counterModel);
        }
        return sb.append('}').toString();
    }
}
