package com.quantbacktest.rebalancer.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.rebalancer.domain.SimulationConfigurationException;
import com.quantbacktest.rebalancer.domain.indicator.Indicators;
import com.quantbacktest.rebalancer.domain.strategy.Comparison;
import com.quantbacktest.rebalancer.domain.strategy.GrowthStrategy;
import com.quantbacktest.rebalancer.domain.strategy.MomentumStrategy;
import com.quantbacktest.rebalancer.domain.strategy.MultiFactorStrategy;
import com.quantbacktest.rebalancer.domain.strategy.RuleBasedStrategy;
import com.quantbacktest.rebalancer.domain.strategy.SelectionStrategy;
import com.quantbacktest.rebalancer.domain.strategy.ThresholdRule;
import com.quantbacktest.rebalancer.domain.strategy.ValueStrategy;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StrategyFactoryTest {

    private final StrategyFactory factory = new StrategyFactory(new ObjectMapper());

    @Test
    void testCreateStrategy_BuiltInsWithDefaults() {
        assertInstanceOf(MomentumStrategy.class, factory.createStrategy("momentum", null));
        assertInstanceOf(ValueStrategy.class, factory.createStrategy("Value", "{}"));
        assertInstanceOf(GrowthStrategy.class, factory.createStrategy("GROWTH", " "));
    }

    @Test
    void testCreateStrategy_MomentumParameterOverride() {
        MomentumStrategy strategy = (MomentumStrategy) factory.createStrategy("momentum",
                "{\"maxRsi\": 65, \"minScore\": 12.5}");

        assertEquals(65, strategy.getParameters().getMaxRsi(), 1e-9);
        // untouched fields keep their defaults
        assertEquals(20, strategy.getParameters().getMinRsi(), 1e-9);
        assertEquals(12.5, strategy.minScore().getAsDouble(), 1e-9);
    }

    @Test
    void testCreateStrategy_UnknownParameter_Throws() {
        assertThrows(SimulationConfigurationException.class,
                () -> factory.createStrategy("momentum", "{\"maxRsii\": 65}"));
    }

    @Test
    void testCreateStrategy_UnknownName_Throws() {
        SimulationConfigurationException ex = assertThrows(SimulationConfigurationException.class,
                () -> factory.createStrategy("mean_reversion", null));
        assertTrue(ex.getMessage().contains("mean_reversion"));
        assertThrows(SimulationConfigurationException.class, () -> factory.createStrategy(" ", null));
    }

    @Test
    void testCreateStrategy_MalformedJson_Throws() {
        assertThrows(SimulationConfigurationException.class, () -> factory.createStrategy("value", "{not json"));
        assertThrows(SimulationConfigurationException.class, () -> factory.createStrategy("value", "[1, 2]"));
    }

    @Test
    void testCreateStrategy_RuleBased() {
        String json = "{\"name\": \"Oversold\","
                + " \"rules\": [{\"indicator\": \"rsi\", \"comparison\": \"<\", \"threshold\": 30},"
                + "             {\"indicator\": \"price\", \"comparison\": \"GTE\", \"threshold\": 5}],"
                + " \"weights\": {\"momentum_20d\": -10},"
                + " \"minScore\": 0}";

        SelectionStrategy strategy = factory.createStrategy("rule-based", json);

        RuleBasedStrategy rules = assertInstanceOf(RuleBasedStrategy.class, strategy);
        assertEquals("Oversold", rules.getName());
        assertEquals(ThresholdRule.of(Indicators.RSI, Comparison.LT, 30), rules.getRules().get(0));
        assertEquals(ThresholdRule.of(Indicators.PRICE, Comparison.GTE, 5), rules.getRules().get(1));
        assertEquals(Map.of(Indicators.MOMENTUM_20D, -10.0), rules.getWeights());
        assertEquals(Set.of(Indicators.RSI, Indicators.PRICE, Indicators.MOMENTUM_20D), strategy.requiredIndicators());
    }

    @Test
    void testCreateStrategy_RuleBasedBadOperator_Throws() {
        String json = "{\"rules\": [{\"indicator\": \"rsi\", \"comparison\": \"~\", \"threshold\": 30}]}";

        assertThrows(SimulationConfigurationException.class, () -> factory.createStrategy("custom", json));
    }

    @Test
    void testCreateStrategy_MultiFactor() {
        String json = "{\"factors\": [{\"indicator\": \"rsi\", \"floor\": 30, \"ceiling\": 70, \"weight\": 2},"
                + " {\"indicator\": \"price_position\", \"floor\": 0, \"ceiling\": 1, \"weight\": 1}]}";

        SelectionStrategy strategy = factory.createStrategy("multi_factor", json);

        assertInstanceOf(MultiFactorStrategy.class, strategy);
        assertTrue(strategy.requiredIndicators().containsAll(Set.of(Indicators.RSI, Indicators.PRICE_POSITION)));
    }

    @Test
    void testCreateStrategy_MultiFactorWithoutFactors_Throws() {
        assertThrows(SimulationConfigurationException.class,
                () -> factory.createStrategy("multi_factor", "{\"factors\": []}"));
        assertThrows(SimulationConfigurationException.class, () -> factory.createStrategy("multi_factor",
                "{\"factors\": [{\"indicator\": \"rsi\", \"floor\": 70, \"ceiling\": 30, \"weight\": 1}]}"));
    }
}
