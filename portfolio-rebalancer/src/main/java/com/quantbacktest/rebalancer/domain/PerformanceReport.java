package com.quantbacktest.rebalancer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Named metric set for a completed simulation. Ratios are fractions, not percentages.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PerformanceReport {

    private String strategyName;
    private BigDecimal initialValue;
    private BigDecimal finalValue;
    private long elapsedDays;

    private BigDecimal totalReturn;
    private BigDecimal annualizedReturn;
    private BigDecimal maxDrawdown;
    private BigDecimal winRate;
    private BigDecimal volatility;
    private BigDecimal sharpeRatio;
    private BigDecimal informationRatio;
    private int maxLosingStreak;

    private int tradeCount;
    private int buyCount;
    private int sellCount;
    private BigDecimal totalTransactionCosts;

    private BigDecimal benchmarkReturn;
    private BigDecimal excessReturn;
    private int ratingScore;
    private StrategyRating rating;
}
