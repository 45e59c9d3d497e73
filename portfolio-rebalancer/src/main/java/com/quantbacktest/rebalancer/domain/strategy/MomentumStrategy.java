package com.quantbacktest.rebalancer.domain.strategy;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorSnapshot;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.OptionalDouble;
import java.util.Set;

import static com.quantbacktest.rebalancer.domain.indicator.Indicators.*;

/**
 * Momentum strategy.
 * Selects instruments in a bullish moving-average alignment with a rising MACD
 * and moderate RSI, ranked mostly by short-term price momentum.
 */
public class MomentumStrategy implements SelectionStrategy {

    private static final Set<String> REQUIRED = Set.of(
            PRICE, MA5, MA10, MA20, MA60, RSI, MOMENTUM_5D, MOMENTUM_10D, MOMENTUM_20D,
            MACD, MACD_SIGNAL, MACD_HIST, BB_POSITION, VOLATILITY, VOLUME_RATIO, PRICE_POSITION);

    private final Parameters parameters;

    public MomentumStrategy(Parameters parameters) {
        this.parameters = parameters;
    }

    public Parameters getParameters() {
        return parameters;
    }

    @Override
    public String getName() {
        return "Momentum";
    }

    @Override
    public Set<String> requiredIndicators() {
        return REQUIRED;
    }

    @Override
    public boolean qualify(IndicatorSnapshot s) {
        Parameters p = parameters;
        double rsi = s.value(RSI);
        double bbPosition = s.value(BB_POSITION);

        // trend alignment
        return s.value(PRICE) > s.value(MA20)
                && s.value(MA5) > s.value(MA10)
                && s.value(MA10) > s.value(MA20)
                && s.value(MA20) > s.value(MA60)
                && rsi >= p.minRsi && rsi <= p.maxRsi
                && s.value(MOMENTUM_5D) > p.minMomentum5d
                && s.value(MOMENTUM_20D) > p.minMomentum20d
                // MACD above signal with positive histogram
                && s.value(MACD) > s.value(MACD_SIGNAL)
                && s.value(MACD_HIST) > 0
                && bbPosition >= p.minBbPosition && bbPosition <= p.maxBbPosition
                && s.value(VOLATILITY) < p.maxVolatility
                && s.value(VOLUME_RATIO) > p.minVolumeRatio
                && s.value(PRICE_POSITION) > p.minPricePosition;
    }

    @Override
    public double score(IndicatorSnapshot s) {
        Parameters p = parameters;
        return s.value(MOMENTUM_5D) * p.momentum5dWeight
                + s.value(MOMENTUM_10D) * p.momentum10dWeight
                + s.value(MOMENTUM_20D) * p.momentum20dWeight
                + (s.value(PRICE) / s.value(MA20) - 1) * p.relativeStrengthWeight
                + (p.rsiCeiling - Math.abs(s.value(RSI) - 50)) * p.rsiWeight
                + s.value(MACD_HIST) * p.macdHistWeight
                + s.value(PRICE_POSITION) * p.pricePositionWeight;
    }

    @Override
    public OptionalDouble minScore() {
        return parameters.minScore == null ? OptionalDouble.empty() : OptionalDouble.of(parameters.minScore);
    }

    @Override
    public String describe() {
        Parameters p = parameters;
        return String.format("Momentum - follow established uptrends%n"
                        + "Conditions: price > MA20, MA5 > MA10 > MA20 > MA60, RSI %.0f-%.0f, "
                        + "5d momentum > %.1f%%, 20d momentum > %.1f%%, MACD > signal and histogram > 0, "
                        + "Bollinger position %.2f-%.2f, volatility < %.1f%%, volume ratio > %.2f, "
                        + "price position > %.2f%n"
                        + "Score: 5d/10d/20d momentum x %.1f/%.1f/%.1f, (price/MA20 - 1) x %.1f, "
                        + "(%.0f - |RSI - 50|) x %.2f, MACD histogram x %.1f, price position x %.1f",
                p.minRsi, p.maxRsi, p.minMomentum5d * 100, p.minMomentum20d * 100,
                p.minBbPosition, p.maxBbPosition, p.maxVolatility * 100, p.minVolumeRatio, p.minPricePosition,
                p.momentum5dWeight, p.momentum10dWeight, p.momentum20dWeight, p.relativeStrengthWeight,
                p.rsiCeiling, p.rsiWeight, p.macdHistWeight, p.pricePositionWeight);
    }

    /**
     * Thresholds and weights. Defaults reproduce the long-standing tuning and
     * are not normalized; treat them as tunables.
     */
    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class Parameters {
        @Builder.Default double minRsi = 20;
        @Builder.Default double maxRsi = 75;
        @Builder.Default double minMomentum5d = -0.05;
        @Builder.Default double minMomentum20d = -0.15;
        @Builder.Default double maxVolatility = 0.5;
        @Builder.Default double minVolumeRatio = 0.5;
        @Builder.Default double minPricePosition = 0.3;
        @Builder.Default double minBbPosition = 0.2;
        @Builder.Default double maxBbPosition = 0.8;

        @Builder.Default double momentum5dWeight = 20;
        @Builder.Default double momentum10dWeight = 15;
        @Builder.Default double momentum20dWeight = 5;
        @Builder.Default double relativeStrengthWeight = 25;
        @Builder.Default double rsiCeiling = 80;
        @Builder.Default double rsiWeight = 0.3;
        @Builder.Default double macdHistWeight = 100;
        @Builder.Default double pricePositionWeight = 10;

        Double minScore;
    }
}
