package com.quantbacktest.rebalancer.domain.strategy;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorSnapshot;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.OptionalDouble;
import java.util.Set;

import static com.quantbacktest.rebalancer.domain.indicator.Indicators.*;

/**
 * Value strategy.
 * Looks for instruments trading low in their recent range and Bollinger band
 * while still above the long moving average.
 */
public class ValueStrategy implements SelectionStrategy {

    private static final Set<String> REQUIRED = Set.of(
            PRICE, MA60, RSI, BB_POSITION, VOLATILITY, VOLUME_RATIO, PRICE_POSITION);

    private final Parameters parameters;

    public ValueStrategy(Parameters parameters) {
        this.parameters = parameters;
    }

    public Parameters getParameters() {
        return parameters;
    }

    @Override
    public String getName() {
        return "Value";
    }

    @Override
    public Set<String> requiredIndicators() {
        return REQUIRED;
    }

    @Override
    public boolean qualify(IndicatorSnapshot s) {
        Parameters p = parameters;
        double pricePosition = s.value(PRICE_POSITION);
        double bbPosition = s.value(BB_POSITION);

        return pricePosition >= p.minPricePosition && pricePosition <= p.maxPricePosition
                && s.value(RSI) <= p.maxRsi
                && bbPosition >= p.minBbPosition && bbPosition <= p.maxBbPosition
                && s.value(PRICE) > s.value(MA60)
                && s.value(VOLATILITY) <= p.maxVolatility
                && s.value(VOLUME_RATIO) > p.minVolumeRatio;
    }

    @Override
    public double score(IndicatorSnapshot s) {
        Parameters p = parameters;
        return (1 - s.value(PRICE_POSITION)) * p.pricePositionWeight
                + (1 - s.value(BB_POSITION)) * p.bbPositionWeight
                + Math.max(0, p.rsiCeiling - s.value(RSI)) * p.rsiWeight
                + (1 - s.value(VOLATILITY)) * p.volatilityWeight
                + (s.value(PRICE) / s.value(MA60) - 1) * p.trendWeight
                + s.value(VOLUME_RATIO) * p.volumeWeight;
    }

    @Override
    public OptionalDouble minScore() {
        return parameters.minScore == null ? OptionalDouble.empty() : OptionalDouble.of(parameters.minScore);
    }

    @Override
    public String describe() {
        Parameters p = parameters;
        return String.format("Value - look for cheap instruments in a long-term uptrend%n"
                        + "Conditions: price position %.2f-%.2f, RSI <= %.0f, Bollinger position %.2f-%.2f, "
                        + "price > MA60, volatility <= %.1f%%, volume ratio > %.2f%n"
                        + "Score: (1 - price position) x %.1f, (1 - Bollinger position) x %.1f, "
                        + "max(0, %.0f - RSI) x %.2f, (1 - volatility) x %.1f, (price/MA60 - 1) x %.1f, "
                        + "volume ratio x %.1f",
                p.minPricePosition, p.maxPricePosition, p.maxRsi, p.minBbPosition, p.maxBbPosition,
                p.maxVolatility * 100, p.minVolumeRatio,
                p.pricePositionWeight, p.bbPositionWeight, p.rsiCeiling, p.rsiWeight,
                p.volatilityWeight, p.trendWeight, p.volumeWeight);
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class Parameters {
        @Builder.Default double maxRsi = 70;
        @Builder.Default double minPricePosition = 0.1;
        @Builder.Default double maxPricePosition = 0.6;
        @Builder.Default double minBbPosition = 0.1;
        @Builder.Default double maxBbPosition = 0.5;
        @Builder.Default double maxVolatility = 0.4;
        @Builder.Default double minVolumeRatio = 0.3;

        @Builder.Default double pricePositionWeight = 30;
        @Builder.Default double bbPositionWeight = 20;
        @Builder.Default double rsiCeiling = 70;
        @Builder.Default double rsiWeight = 0.5;
        @Builder.Default double volatilityWeight = 10;
        @Builder.Default double trendWeight = 15;
        @Builder.Default double volumeWeight = 10;

        Double minScore;
    }
}
