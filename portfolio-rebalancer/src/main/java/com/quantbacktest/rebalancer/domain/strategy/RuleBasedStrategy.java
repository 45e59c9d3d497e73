package com.quantbacktest.rebalancer.domain.strategy;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorSnapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * User-defined strategy: a conjunction of threshold rules, scored as a linear
 * combination of indicator values.
 */
public class RuleBasedStrategy implements SelectionStrategy {

    private final String name;
    private final List<ThresholdRule> rules;
    private final Map<String, Double> weights;
    private final Double minScore;
    private final Set<String> required;

    public RuleBasedStrategy(String name, List<ThresholdRule> rules, Map<String, Double> weights, Double minScore) {
        if (rules.isEmpty() && weights.isEmpty()) {
            throw new IllegalArgumentException("Rule-based strategy needs at least one rule or weight");
        }
        this.name = name;
        this.rules = List.copyOf(rules);
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        this.minScore = minScore;

        Set<String> names = new LinkedHashSet<>();
        rules.forEach(rule -> names.add(rule.getIndicator()));
        names.addAll(weights.keySet());
        this.required = Collections.unmodifiableSet(names);
    }

    @Override
    public String getName() {
        return name;
    }

    public List<ThresholdRule> getRules() {
        return rules;
    }

    public Map<String, Double> getWeights() {
        return weights;
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
        double score = 0;
        for (Map.Entry<String, Double> weight : weights.entrySet()) {
            score += snapshot.value(weight.getKey()) * weight.getValue();
        }
        return score;
    }

    @Override
    public OptionalDouble minScore() {
        return minScore == null ? OptionalDouble.empty() : OptionalDouble.of(minScore);
    }

    @Override
    public String describe() {
        String conditions = rules.stream().map(ThresholdRule::toString).collect(Collectors.joining(", "));
        String scoring = weights.entrySet().stream()
                .map(e -> e.getKey() + " x " + e.getValue())
                .collect(Collectors.joining(" + "));
        return name + " (rule based)" + System.lineSeparator()
                + "Conditions: " + (conditions.isEmpty() ? "none" : conditions) + System.lineSeparator()
                + "Score: " + (scoring.isEmpty() ? "0" : scoring);
    }
}
