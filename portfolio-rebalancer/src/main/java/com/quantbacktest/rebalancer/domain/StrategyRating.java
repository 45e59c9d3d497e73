package com.quantbacktest.rebalancer.domain;

/**
 * Grade attached to a 0-100 strategy rating score.
 */
public enum StrategyRating {

    EXCELLENT(85),
    GOOD(70),
    AVERAGE(55),
    FAIR(40),
    POOR(25),
    NEEDS_OPTIMIZATION(0);

    private final int minScore;

    StrategyRating(int minScore) {
        this.minScore = minScore;
    }

    public int getMinScore() {
        return minScore;
    }

    public static StrategyRating fromScore(int score) {
        for (StrategyRating rating : values()) {
            if (score >= rating.minScore) {
                return rating;
            }
        }
        return NEEDS_OPTIMIZATION;
    }
}
