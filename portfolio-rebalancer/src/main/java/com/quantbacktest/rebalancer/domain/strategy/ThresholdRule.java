package com.quantbacktest.rebalancer.domain.strategy;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorSnapshot;
import lombok.Value;

/**
 * Single qualification condition: {@code indicator <op> threshold}.
 */
@Value
public class ThresholdRule {

    String indicator;
    Comparison comparison;
    double threshold;

    public static ThresholdRule of(String indicator, Comparison comparison, double threshold) {
        return new ThresholdRule(indicator, comparison, threshold);
    }

    public boolean test(IndicatorSnapshot snapshot) {
        return comparison.test(snapshot.value(indicator), threshold);
    }

    @Override
    public String toString() {
        return indicator + " " + comparison.getSymbol() + " " + threshold;
    }
}
