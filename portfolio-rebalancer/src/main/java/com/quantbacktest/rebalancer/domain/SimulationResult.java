package com.quantbacktest.rebalancer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Entity holding the metrics of a completed simulation.
 * Snapshot history and trade log are stored as JSON.
 */
@Entity
@Table(name = "simulation_results", indexes = {
        @Index(name = "idx_job_id", columnList = "job_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulationResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "job_id", nullable = false, foreignKey = @ForeignKey(name = "fk_result_job"))
    private SimulationJob job;

    @Column(name = "final_value", precision = 19, scale = 4)
    private BigDecimal finalValue;

    @Column(name = "total_return", precision = 19, scale = 6)
    private BigDecimal totalReturn;

    @Column(name = "annualized_return", precision = 19, scale = 6)
    private BigDecimal annualizedReturn;

    @Column(name = "max_drawdown", precision = 19, scale = 6)
    private BigDecimal maxDrawdown;

    @Column(name = "win_rate", precision = 19, scale = 6)
    private BigDecimal winRate;

    @Column(name = "volatility", precision = 19, scale = 6)
    private BigDecimal volatility;

    @Column(name = "sharpe_ratio", precision = 19, scale = 6)
    private BigDecimal sharpeRatio;

    @Column(name = "information_ratio", precision = 19, scale = 6)
    private BigDecimal informationRatio;

    @Column(name = "max_losing_streak")
    private Integer maxLosingStreak;

    @Column(name = "trade_count")
    private Integer tradeCount;

    @Column(name = "transaction_costs", precision = 19, scale = 4)
    private BigDecimal transactionCosts;

    @Column(name = "rating_score")
    private Integer ratingScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "rating", length = 30)
    private StrategyRating rating;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    /** Full {@link PerformanceReport} as JSON. */
    @Column(name = "report_json", columnDefinition = "TEXT")
    private String reportJson;

    @Column(name = "snapshots_json", columnDefinition = "TEXT")
    private String snapshotsJson;

    @Column(name = "trades_json", columnDefinition = "TEXT")
    private String tradesJson;
}
