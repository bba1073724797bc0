package org.deduction.solver;

import lombok.Getter;

/**
 * 对题目声称的最优证明长度的核对结果。
 * isOptimal 表示找到的证明不长于声称的长度；shorterProofExists 表示找到了更短的证明，即声称的最优值有误。
 */
@Getter
public final class OptimalLengthReport {

    private final boolean valid;
    private final int foundLength;
    private final int claimedLength;
    private final boolean isOptimal;
    private final boolean shorterProofExists;
    private final String proofText;
    private final String error;

    private OptimalLengthReport(boolean valid, int foundLength, int claimedLength, String proofText, String error) {
        this.valid = valid;
        this.foundLength = foundLength;
        this.claimedLength = claimedLength;
        this.isOptimal = valid && foundLength <= claimedLength;
        this.shorterProofExists = valid && foundLength < claimedLength;
        this.proofText = proofText;
        this.error = error;
    }

    public static OptimalLengthReport found(int foundLength, int claimedLength, String proofText) {
        return new OptimalLengthReport(true, foundLength, claimedLength, proofText, null);
    }

    public static OptimalLengthReport failed(int claimedLength, String error) {
        return new OptimalLengthReport(false, -1, claimedLength, null, error);
    }

    @Override
    public String toString() {
        return valid
                ? "OptimalLengthReport{found=" + foundLength + ", claimed=" + claimedLength + ", optimal=" + isOptimal
                + ", shorter=" + shorterProofExists + '}'
                : "OptimalLengthReport{claimed=" + claimedLength + ", error=" + error + '}';
    }
}
