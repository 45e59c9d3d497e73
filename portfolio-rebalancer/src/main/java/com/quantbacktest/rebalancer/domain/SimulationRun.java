package com.quantbacktest.rebalancer.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a completed simulation: snapshot history, trade log and final state.
 */
@Value
@Builder(toBuilder = true)
public class SimulationRun {

    String strategyName;
    RebalanceFrequency frequency;
    LocalDate startDate;
    LocalDate endDate;
    BigDecimal initialCapital;

    @Singular
    List<PortfolioSnapshot> snapshots;

    @Singular
    List<Trade> trades;

    BigDecimal finalValue;
    BigDecimal finalCash;
    Map<String, Long> finalPositions;
}
