package com.quantbacktest.rebalancer.domain.strategy;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorSnapshot;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * User-defined multi-factor strategy: threshold rules for qualification and a
 * {@link MultiFactorScorer} for ranking.
 */
public class MultiFactorStrategy implements SelectionStrategy {

    private final String name;
    private final List<ThresholdRule> rules;
    private final MultiFactorScorer scorer;
    private final Double minScore;
    private final Set<String> required;

    public MultiFactorStrategy(String name, List<ThresholdRule> rules, MultiFactorScorer scorer, Double minScore) {
        this.name = name;
        this.rules = List.copyOf(rules);
        this.scorer = scorer;
        this.minScore = minScore;

        Set<String> names = new LinkedHashSet<>();
        rules.forEach(rule -> names.add(rule.getIndicator()));
        names.addAll(scorer.requiredIndicators());
        this.required = Collections.unmodifiableSet(names);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Set<String> requiredIndicators() {
        return required;
    }

    @Override
    public boolean qualify(IndicatorSnapshot snapshot) {
        return rules.stream().allMatch(rule -> rule.test(snapshot));
    }

    @Override
    public double score(IndicatorSnapshot snapshot) {
        return scorer.score(snapshot);
    }

    @Override
    public OptionalDouble minScore() {
        return minScore == null ? OptionalDouble.empty() : OptionalDouble.of(minScore);
    }

    @Override
    public String describe() {
        String conditions = rules.stream().map(ThresholdRule::toString).collect(Collectors.joining(", "));
        String factors = scorer.getFactors().stream()
                .map(f -> f.getFactor().getIndicator() + " (" + f.getWeight() + ")")
                .collect(Collectors.joining(", "));
        return name + " (multi-factor)" + System.lineSeparator()
                + "Conditions: " + (conditions.isEmpty() ? "none" : conditions) + System.lineSeparator()
                + "Factors: " + (factors.isEmpty() ? "none" : factors);
    }
}
