package com.demo.altcredit.service;

/** Repayment probability → alternative credit score. */
public final class ScoreMapper {

    public static final int MIN_SCORE = 300;
    public static final int MAX_SCORE = 900;
    private static final double SPAN = MAX_SCORE - MIN_SCORE;

    private ScoreMapper() {}

    /**
     * score = 300 + p * 600, rounded half-even and clamped to [300, 900].
     *
     * @param repaymentProbability P(repay), expected in [0, 1]
     */
    public static int probabilityToScore(double repaymentProbability) {
        if (Double.isNaN(repaymentProbability)) {
            throw new IllegalArgumentException("repayment probability is NaN");
        }
        double score = Math.rint(MIN_SCORE + repaymentProbability * SPAN);
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
