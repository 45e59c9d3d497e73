package com.quantbacktest.rebalancer.domain.strategy;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorSnapshot;
import org.junit.jupiter.api.Test;

import static com.quantbacktest.rebalancer.domain.indicator.Indicators.*;
import static org.junit.jupiter.api.Assertions.*;

class MomentumStrategyTest {

    private final MomentumStrategy strategy = new MomentumStrategy(MomentumStrategy.Parameters.builder().build());

    private static IndicatorSnapshot uptrend(double ma5, double rsi) {
        return Snapshots.of(
                PRICE, 11.0, MA5, ma5, MA10, 10.5, MA20, 10.2, MA60, 9.5,
                RSI, rsi,
                MOMENTUM_5D, 0.02, MOMENTUM_10D, 0.04, MOMENTUM_20D, 0.08,
                MACD, 0.2, MACD_SIGNAL, 0.1, MACD_HIST, 0.1,
                BB_POSITION, 0.6, VOLATILITY, 0.3, VOLUME_RATIO, 1.2, PRICE_POSITION, 0.7);
    }

    @Test
    void testQualify_AlignedUptrend() {
        assertTrue(strategy.qualify(uptrend(10.8, 60)));
    }

    @Test
    void testQualify_BrokenAverageOrderRejected() {
        assertFalse(strategy.qualify(uptrend(10.4, 60)));
    }

    @Test
    void testQualify_OverboughtRejected() {
        assertFalse(strategy.qualify(uptrend(10.8, 76)));
    }

    @Test
    void testScore_DefaultWeights() {
        double expected = 0.02 * 20 + 0.04 * 15 + 0.08 * 5
                + (11.0 / 10.2 - 1) * 25
                + (80 - 10) * 0.3
                + 0.1 * 100
                + 0.7 * 10;

        assertEquals(expected, strategy.score(uptrend(10.8, 60)), 1e-9);
    }

    @Test
    void testRequiredIndicatorsCoverEveryInput() {
        assertTrue(uptrend(10.8, 60).hasAll(strategy.requiredIndicators()));
        assertTrue(strategy.minScore().isEmpty());
    }

    @Test
    void testParameterOverride() {
        MomentumStrategy strict = new MomentumStrategy(MomentumStrategy.Parameters.builder()
                .maxRsi(55)
                .minScore(50.0)
                .build());

        assertFalse(strict.qualify(uptrend(10.8, 60)));
        assertEquals(50.0, strict.minScore().getAsDouble(), 1e-9);
    }
}
