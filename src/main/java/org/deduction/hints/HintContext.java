package org.deduction.hints;

import lombok.Getter;
import org.deduction.core.Formula;
import org.deduction.core.Sequent;
import org.deduction.verifier.ProofState;
import org.deduction.verifier.VerificationError;

import java.util.List;
import java.util.Objects;

/**
 * 规则提供者的输入：相继式、重放部分证明得到的状态 (部分证明无法解析时为 null) 以及解析错误。
 */
@Getter
public final class HintContext {

    private final Sequent sequent;
    private final ProofState state;
    private final VerificationError parseError;

    public HintContext(Sequent sequent, ProofState state, VerificationError parseError) {
        this.sequent = Objects.requireNonNull(sequent, "Sequent cannot be null.");
        this.state = state;
        this.parseError = parseError;
    }

    /**
     * 当前的目标：最内层尚未关闭的 Show 目标，没有时为结论。
     */
    public Formula currentGoal() {
        if (state != null) {
            List<Formula> goals = state.getOpenGoals();
            if (!goals.isEmpty()) {
                return goals.get(goals.size() - 1);
            }
        }
        return sequent.getConclusion();
    }
}
