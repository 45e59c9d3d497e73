package com.quantbacktest.rebalancer.domain.strategy;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorSnapshot;

import java.util.function.DoubleUnaryOperator;

/**
 * One scoring factor of a multi-factor strategy, normalized to 0..100.
 */
public interface Factor {

    /**
     * Indicator the factor reads.
     */
    String getIndicator();

    /**
     * Sub-score in the range 0..100.
     */
    double score(IndicatorSnapshot snapshot);

    /**
     * Linear ramp: 0 at or below {@code floor}, 100 at or above {@code ceiling}.
     */
    static Factor linearRamp(String indicator, double floor, double ceiling) {
        if (!(ceiling > floor)) {
            throw new IllegalArgumentException("Ramp ceiling must exceed floor for " + indicator);
        }
        return of(indicator, value -> Math.min(100, Math.max(0, (value - floor) / (ceiling - floor) * 100)));
    }

    /**
     * Factor applying an arbitrary monotone transform to a single indicator.
     */
    static Factor of(String indicator, DoubleUnaryOperator transform) {
        return new Factor() {
            @Override
            public String getIndicator() {
                return indicator;
            }

            @Override
            public double score(IndicatorSnapshot snapshot) {
                return transform.applyAsDouble(snapshot.value(indicator));
            }

            @Override
            public String toString() {
                return "Factor(" + indicator + ")";
            }
        };
    }
}
