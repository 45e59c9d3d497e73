package com.quantbacktest.rebalancer.domain.strategy;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorSnapshot;
import org.junit.jupiter.api.Test;

import static com.quantbacktest.rebalancer.domain.indicator.Indicators.*;
import static org.junit.jupiter.api.Assertions.*;

class ValueStrategyTest {

    private final ValueStrategy strategy = new ValueStrategy(ValueStrategy.Parameters.builder().build());

    private static IndicatorSnapshot cheap(double price) {
        return Snapshots.of(
                PRICE, price, MA60, 9.0, RSI, 40.0, BB_POSITION, 0.3,
                VOLATILITY, 0.2, VOLUME_RATIO, 1.0, PRICE_POSITION, 0.3);
    }

    @Test
    void testQualify_CheapAboveLongAverage() {
        assertTrue(strategy.qualify(cheap(10.0)));
    }

    @Test
    void testQualify_BelowLongAverageRejected() {
        assertFalse(strategy.qualify(cheap(8.5)));
    }

    @Test
    void testScore_DefaultWeights() {
        double expected = 0.7 * 30 + 0.7 * 20 + 30 * 0.5 + 0.8 * 10 + (10.0 / 9.0 - 1) * 15 + 1.0 * 10;

        assertEquals(expected, strategy.score(cheap(10.0)), 1e-9);
    }
}
