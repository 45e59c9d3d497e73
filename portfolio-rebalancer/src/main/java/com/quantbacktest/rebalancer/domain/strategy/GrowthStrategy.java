package com.quantbacktest.rebalancer.domain.strategy;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorSnapshot;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashSet;
import java.util.OptionalDouble;
import java.util.Set;

import static com.quantbacktest.rebalancer.domain.indicator.Indicators.*;

/**
 * Growth strategy.
 * Breakout-style filter on medium and long momentum, scored as a weighted
 * average of five 0..100 factors.
 */
public class GrowthStrategy implements SelectionStrategy {

    private final Parameters parameters;
    private final MultiFactorScorer scorer;
    private final Set<String> required;

    public GrowthStrategy(Parameters parameters) {
        this.parameters = parameters;
        this.scorer = MultiFactorScorer.builder()
                .factor(Factor.linearRamp(MOMENTUM_20D, 0, 0.5), parameters.momentum20dWeight)
                .factor(Factor.linearRamp(MOMENTUM_60D, 0, 1.0), parameters.momentum60dWeight)
                .factor(Factor.of(RSI, GrowthStrategy::rsiScore), parameters.rsiWeight)
                .factor(Factor.linearRamp(VOLUME_RATIO, 1.0, 3.0), parameters.volumeRatioWeight)
                .factor(Factor.linearRamp(PRICE_POSITION, 0, 1.0), parameters.pricePositionWeight)
                .build();

        Set<String> names = new LinkedHashSet<>(scorer.requiredIndicators());
        names.addAll(Set.of(PRICE, MA20, MA60, MACD_HIST, VOLATILITY));
        this.required = Set.copyOf(names);
    }

    /**
     * RSI sub-score: 0 below 50, linear to 100 at 80, then 5 points off per RSI point.
     */
    static double rsiScore(double rsi) {
        if (rsi < 50) {
            return 0;
        }
        if (rsi > 80) {
            return Math.max(0, 100 - (rsi - 80) * 5);
        }
        return (rsi - 50) / 30 * 100;
    }

    public Parameters getParameters() {
        return parameters;
    }

    @Override
    public String getName() {
        return "Growth";
    }

    @Override
    public Set<String> requiredIndicators() {
        return required;
    }

    @Override
    public boolean qualify(IndicatorSnapshot s) {
        Parameters p = parameters;
        double rsi = s.value(RSI);

        return s.value(MOMENTUM_20D) >= p.minMomentum20d
                && s.value(MOMENTUM_60D) >= p.minMomentum60d
                && rsi >= p.minRsi && rsi <= p.maxRsi
                && s.value(VOLUME_RATIO) >= p.minVolumeRatio
                && s.value(PRICE_POSITION) >= p.minPricePosition
                && s.value(PRICE) > s.value(MA20)
                && s.value(MA20) > s.value(MA60)
                && s.value(MACD_HIST) > 0
                && s.value(VOLATILITY) <= p.maxVolatility;
    }

    @Override
    public double score(IndicatorSnapshot snapshot) {
        return scorer.score(snapshot);
    }

    @Override
    public OptionalDouble minScore() {
        return parameters.minScore == null ? OptionalDouble.empty() : OptionalDouble.of(parameters.minScore);
    }

    @Override
    public String describe() {
        Parameters p = parameters;
        return String.format("Growth - capture strong medium and long term momentum%n"
                        + "Conditions: 20d momentum >= %.1f%%, 60d momentum >= %.1f%%, RSI %.0f-%.0f, "
                        + "volume ratio >= %.2f, price position >= %.2f, price > MA20 > MA60, "
                        + "MACD histogram > 0, volatility <= %.1f%%%n"
                        + "Factor weights: 20d momentum %.2f, 60d momentum %.2f, RSI %.2f, volume %.2f, "
                        + "price position %.2f",
                p.minMomentum20d * 100, p.minMomentum60d * 100, p.minRsi, p.maxRsi, p.minVolumeRatio,
                p.minPricePosition, p.maxVolatility * 100,
                p.momentum20dWeight, p.momentum60dWeight, p.rsiWeight, p.volumeRatioWeight, p.pricePositionWeight);
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class Parameters {
        @Builder.Default double minMomentum20d = 0.05;
        @Builder.Default double minMomentum60d = 0.10;
        @Builder.Default double minRsi = 45;
        @Builder.Default double maxRsi = 80;
        @Builder.Default double minVolumeRatio = 1.2;
        @Builder.Default double minPricePosition = 0.4;
        @Builder.Default double maxVolatility = 0.6;

        @Builder.Default double momentum20dWeight = 0.3;
        @Builder.Default double momentum60dWeight = 0.25;
        @Builder.Default double rsiWeight = 0.2;
        @Builder.Default double volumeRatioWeight = 0.15;
        @Builder.Default double pricePositionWeight = 0.1;

        Double minScore;
    }
}
