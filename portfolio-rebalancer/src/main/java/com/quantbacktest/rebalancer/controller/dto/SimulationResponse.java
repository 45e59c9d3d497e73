package com.quantbacktest.rebalancer.controller.dto;

import com.quantbacktest.rebalancer.domain.JobStatus;
import com.quantbacktest.rebalancer.domain.StrategyRating;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Job status, plus the headline metrics once the job has completed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulationResponse {

    private Long jobId;
    private JobStatus status;
    private String message;
    private Boolean isExisting;
    private Integer retryCount;
    private String failureReason;

    // Populated only when COMPLETED
    private BigDecimal finalValue;
    private BigDecimal totalReturn;
    private BigDecimal annualizedReturn;
    private BigDecimal maxDrawdown;
    private BigDecimal winRate;
    private BigDecimal volatility;
    private BigDecimal sharpeRatio;
    private BigDecimal informationRatio;
    private Integer maxLosingStreak;
    private Integer tradeCount;
    private Integer ratingScore;
    private StrategyRating rating;
}
