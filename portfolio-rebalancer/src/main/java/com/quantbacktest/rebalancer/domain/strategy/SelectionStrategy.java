package com.quantbacktest.rebalancer.domain.strategy;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorSnapshot;

import java.util.OptionalDouble;
import java.util.Set;

/**
 * Stock selection rule evaluated against one instrument's indicator snapshot.
 * Implementations are immutable parameter holders with pure qualify/score
 * functions, so they may be evaluated from several threads at once.
 */
public interface SelectionStrategy {

    /**
     * Get the strategy name.
     */
    String getName();

    /**
     * Indicators the strategy reads. A snapshot missing any of them is
     * disqualified before {@link #qualify} is called.
     */
    Set<String> requiredIndicators();

    /**
     * Whether the instrument is a selection candidate.
     *
     * @param snapshot snapshot containing every required indicator
     */
    boolean qualify(IndicatorSnapshot snapshot);

    /**
     * Ranking score of a qualifying instrument; higher ranks first.
     *
     * @param snapshot snapshot containing every required indicator
     */
    double score(IndicatorSnapshot snapshot);

    /**
     * Optional score floor; candidates scoring below it are dropped.
     */
    default OptionalDouble minScore() {
        return OptionalDouble.empty();
    }

    /**
     * Human readable summary of conditions and weights.
     */
    String describe();
}
