package org.deduction.syntax;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 解析完成的证明：方言、按行号排列的全部行 (前提行在前) 以及作用域声明。
 * 两份脚本在不同方言下表达同一证明时，行列表相等。
 */
@Getter
public final class ParsedProof {

    private final Dialect dialect;
    private final List<ProofLine> lines;
    private final List<ScopeDecl> scopes;
    private final int premiseCount;
    private final Map<Integer, ProofLine> byNumber;

    public ParsedProof(Dialect dialect, List<ProofLine> lines, List<ScopeDecl> scopes, int premiseCount) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null.");
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
        this.scopes = Collections.unmodifiableList(new ArrayList<>(scopes));
        this.premiseCount = premiseCount;
        Map<Integer, ProofLine> index = new HashMap<>();
        for (ProofLine line : lines) {
            index.put(line.getNumber(), line);
        }
        this.byNumber = Collections.unmodifiableMap(index);
    }

    public Optional<ProofLine> line(int number) {
        return Optional.ofNullable(byNumber.get(number));
    }

    public ScopeDecl scope(int id) {
        return scopes.get(id);
    }

    /**
     * 不含前提的证明行。
     */
    public List<ProofLine> derivedLines() {
        return lines.subList(premiseCount, lines.size());
    }

    public boolean isEmpty() {
        return lines.size() == premiseCount;
    }

    public int lastNumber() {
        return lines.isEmpty() ? 0 : lines.get(lines.size() - 1).getNumber();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(dialect.getLabel()).append(" proof:\n");
        for (ProofLine line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
