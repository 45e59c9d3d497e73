package com.quantbacktest.rebalancer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.rebalancer.domain.SimulationConfigurationException;
import com.quantbacktest.rebalancer.domain.strategy.Comparison;
import com.quantbacktest.rebalancer.domain.strategy.Factor;
import com.quantbacktest.rebalancer.domain.strategy.GrowthStrategy;
import com.quantbacktest.rebalancer.domain.strategy.MomentumStrategy;
import com.quantbacktest.rebalancer.domain.strategy.MultiFactorScorer;
import com.quantbacktest.rebalancer.domain.strategy.MultiFactorStrategy;
import com.quantbacktest.rebalancer.domain.strategy.RuleBasedStrategy;
import com.quantbacktest.rebalancer.domain.strategy.SelectionStrategy;
import com.quantbacktest.rebalancer.domain.strategy.ThresholdRule;
import com.quantbacktest.rebalancer.domain.strategy.ValueStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Factory for creating selection strategies from a name and JSON parameters.
 * Built-in strategies take their tunables from the JSON; missing fields keep the defaults.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyFactory {

    private final ObjectMapper objectMapper;

    /**
     * Create a strategy instance from name and JSON parameters.
     *
     * @throws SimulationConfigurationException for unknown names or malformed parameters
     */
    public SelectionStrategy createStrategy(String strategyName, String parametersJson) {
        if (strategyName == null || strategyName.isBlank()) {
            throw new SimulationConfigurationException("Strategy name is required");
        }
        log.info("Creating strategy: {} with parameters: {}", strategyName, parametersJson);

        JsonNode params = readParameters(parametersJson);
        String key = strategyName.trim().toLowerCase(Locale.ROOT).replace("-", "_");

        try {
            return switch (key) {
                case "momentum" -> new MomentumStrategy(bind(params, MomentumStrategy.Parameters.class));
                case "value" -> new ValueStrategy(bind(params, ValueStrategy.Parameters.class));
                case "growth" -> new GrowthStrategy(bind(params, GrowthStrategy.Parameters.class));
                case "rule_based", "custom" -> new RuleBasedStrategy(
                        params.path("name").asText("Rule based"),
                        parseRules(params.path("rules")),
                        parseWeights(params.path("weights")),
                        optionalDouble(params, "minScore"));
                case "multi_factor" -> new MultiFactorStrategy(
                        params.path("name").asText("Multi factor"),
                        parseRules(params.path("rules")),
                        parseScorer(params.path("factors")),
                        optionalDouble(params, "minScore"));
                default -> throw new SimulationConfigurationException("Unknown strategy: " + strategyName);
            };
        } catch (SimulationConfigurationException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new SimulationConfigurationException(
                    "Invalid parameters for strategy " + strategyName + ": " + e.getMessage(), e);
        }
    }

    private JsonNode readParameters(String parametersJson) {
        if (parametersJson == null || parametersJson.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(parametersJson);
            if (node == null || node.isNull()) {
                return objectMapper.createObjectNode();
            }
            if (!node.isObject()) {
                throw new SimulationConfigurationException("Strategy parameters must be a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new SimulationConfigurationException("Malformed strategy parameters: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T bind(JsonNode params, Class<T> type) {
        try {
            return objectMapper.readerFor(type)
                    .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(params);
        } catch (IOException e) {
            throw new SimulationConfigurationException(
                    "Invalid " + type.getEnclosingClass().getSimpleName() + " parameters: " + e.getMessage(), e);
        }
    }

    private List<ThresholdRule> parseRules(JsonNode rules) {
        List<ThresholdRule> parsed = new ArrayList<>();
        if (rules.isMissingNode() || rules.isNull()) {
            return parsed;
        }
        if (!rules.isArray()) {
            throw new SimulationConfigurationException("'rules' must be an array");
        }
        for (JsonNode rule : rules) {
            parsed.add(ThresholdRule.of(
                    requiredText(rule, "indicator"),
                    Comparison.fromText(requiredText(rule, "comparison")),
                    requiredDouble(rule, "threshold")));
        }
        return parsed;
    }

    private Map<String, Double> parseWeights(JsonNode weights) {
        Map<String, Double> parsed = new LinkedHashMap<>();
        if (weights.isMissingNode() || weights.isNull()) {
            return parsed;
        }
        if (!weights.isObject()) {
            throw new SimulationConfigurationException("'weights' must be an object of indicator to weight");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = weights.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                throw new SimulationConfigurationException("Weight of " + field.getKey() + " must be numeric");
            }
            parsed.put(field.getKey(), field.getValue().asDouble());
        }
        return parsed;
    }

    private MultiFactorScorer parseScorer(JsonNode factors) {
        if (!factors.isArray() || factors.isEmpty()) {
            throw new SimulationConfigurationException("'factors' must be a non-empty array");
        }
        MultiFactorScorer.Builder builder = MultiFactorScorer.builder();
        for (JsonNode factor : factors) {
            builder.factor(
                    Factor.linearRamp(requiredText(factor, "indicator"),
                            requiredDouble(factor, "floor"), requiredDouble(factor, "ceiling")),
                    requiredDouble(factor, "weight"));
        }
        return builder.build();
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new SimulationConfigurationException("Missing text field '" + field + "' in " + node);
        }
        return value.asText();
    }

    private static double requiredDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new SimulationConfigurationException("Missing numeric field '" + field + "' in " + node);
        }
        return value.asDouble();
    }

    private static Double optionalDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new SimulationConfigurationException("'" + field + "' must be numeric");
        }
        return value.asDouble();
    }
}
