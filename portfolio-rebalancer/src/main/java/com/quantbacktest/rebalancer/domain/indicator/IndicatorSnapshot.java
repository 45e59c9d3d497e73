package com.quantbacktest.rebalancer.domain.indicator;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Named indicator values for one instrument as of one date.
 * An indicator that could not be computed is absent rather than zero or NaN.
 */
public final class IndicatorSnapshot {

    private final LocalDate asOf;
    private final Map<String, Double> values;

    public IndicatorSnapshot(LocalDate asOf, Map<String, Double> values) {
        this.asOf = asOf;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public LocalDate getAsOf() {
        return asOf;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public boolean hasAll(Collection<String> names) {
        return values.keySet().containsAll(names);
    }

    public OptionalDouble get(String name) {
        Double value = values.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Value of a computable indicator.
     *
     * @throws IllegalStateException if the indicator is not computable
     */
    public double value(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw new IllegalStateException("Indicator not computable: " + name + " as of " + asOf);
        }
        return value;
    }

    public Map<String, Double> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "IndicatorSnapshot{asOf=" + asOf + ", values=" + values + "}";
    }
}
