package com.quantbacktest.rebalancer.domain;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorSettings;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable settings for one simulation run. Every value is explicit.
 */
@Value
@Builder(toBuilder = true)
public class SimulationConfig {

    BigDecimal initialCapital;
    int maxPositions;
    int minDataDays;
    int lotSize;

    /** Fraction of valuation kept in cash at each rebalance. */
    BigDecimal cashReserveRatio;

    TradeCostModel costModel;
    IndicatorSettings indicatorSettings;

    public void validate() {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new SimulationConfigurationException("Initial capital must be positive");
        }
        if (maxPositions <= 0) {
            throw new SimulationConfigurationException("Max positions must be positive");
        }
        if (lotSize <= 0) {
            throw new SimulationConfigurationException("Lot size must be positive");
        }
        if (minDataDays < 0) {
            throw new SimulationConfigurationException("Min data days must not be negative");
        }
        if (cashReserveRatio == null || cashReserveRatio.signum() < 0 || cashReserveRatio.compareTo(BigDecimal.ONE) >= 0) {
            throw new SimulationConfigurationException("Cash reserve ratio must be in [0, 1)");
        }
        if (costModel == null || indicatorSettings == null) {
            throw new SimulationConfigurationException("Cost model and indicator settings are required");
        }
        costModel.validate();
        try {
            indicatorSettings.validate();
        } catch (IllegalArgumentException e) {
            throw new SimulationConfigurationException("Invalid indicator settings: " + e.getMessage(), e);
        }
    }
}
