package com.quantbacktest.rebalancer.domain.strategy;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorSnapshot;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Weighted average of factor sub-scores.
 * Falls back to 0 when the total weight is 0.
 */
public final class MultiFactorScorer {

    private final List<WeightedFactor> factors;

    private MultiFactorScorer(List<WeightedFactor> factors) {
        this.factors = Collections.unmodifiableList(new ArrayList<>(factors));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<WeightedFactor> getFactors() {
        return factors;
    }

    public Set<String> requiredIndicators() {
        Set<String> names = new LinkedHashSet<>();
        factors.forEach(f -> names.add(f.getFactor().getIndicator()));
        return names;
    }

    public double score(IndicatorSnapshot snapshot) {
        double totalScore = 0;
        double totalWeight = 0;
        for (WeightedFactor weighted : factors) {
            totalScore += weighted.getFactor().score(snapshot) * weighted.getWeight();
            totalWeight += weighted.getWeight();
        }
        return totalWeight > 0 ? totalScore / totalWeight : 0;
    }

    @Value
    public static class WeightedFactor {
        Factor factor;
        double weight;
    }

    public static final class Builder {

        private final List<WeightedFactor> factors = new ArrayList<>();

        public Builder factor(Factor factor, double weight) {
            if (weight < 0) {
                throw new IllegalArgumentException("Factor weight must not be negative: " + factor.getIndicator());
            }
            factors.add(new WeightedFactor(factor, weight));
            return this;
        }

        public MultiFactorScorer build() {
            return new MultiFactorScorer(factors);
        }
    }
}
