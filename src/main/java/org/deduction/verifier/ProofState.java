package org.deduction.verifier;

import lombok.Getter;
import org.deduction.core.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 重放部分证明后的状态：下一行可引用的公式、仍有效的假设、尚未关闭的 Show 目标。
 * 重放在第一个错误处停止，此时 error 非空。
 */
@Getter
public final class ProofState {

    private final SortedMap<Integer, Formula> visibleLines;
    private final List<Formula> openAssumptions;
    private final List<Formula> openGoals;
    private final VerificationError error;
    private final int nextLine;
    private final int depth;

    public ProofState(SortedMap<Integer, Formula> visibleLines, List<Formula> openAssumptions,
                      List<Formula> openGoals, VerificationError error, int nextLine, int depth) {
        this.visibleLines = Collections.unmodifiableSortedMap(new TreeMap<>(visibleLines));
        this.openAssumptions = Collections.unmodifiableList(new ArrayList<>(openAssumptions));
        this.openGoals = Collections.unmodifiableList(new ArrayList<>(openGoals));
        this.error = error;
        this.nextLine = nextLine;
        this.depth = depth;
    }

    public boolean isConsistent() {
        return error == null;
    }

    public List<Formula> visibleFormulas() {
        return new ArrayList<>(visibleLines.values());
    }

    @Override
    public String toString() {
        return "ProofState{visible=" + visibleLines + ", assumptions=" + openAssumptions
                + ", goals=" + openGoals + (error == null ? "" : ", error=" + error) + '}';
    }
}
