package com.quantbacktest.rebalancer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Entity representing a submitted simulation.
 * Tracks the lifecycle and the requested configuration of one run.
 */
@Entity
@Table(name = "simulation_jobs", uniqueConstraints = {
                @UniqueConstraint(name = "uk_idempotency_key", columnNames = "idempotency_key")
}, indexes = {
                @Index(name = "idx_status", columnList = "status"),
                @Index(name = "idx_created_at", columnList = "created_at"),
                @Index(name = "idx_strategy_name", columnList = "strategy_name")
})
@EntityListeners(AuditingEntityListener.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulationJob {

        @Id
        @GeneratedValue(strategy = GenerationType.IDENTITY)
        private Long id;

        @Version
        @Column(name = "version")
        private Long version;

        @Column(name = "strategy_name", nullable = false, length = 100)
        private String strategyName;

        @Column(name = "start_date", nullable = false)
        private LocalDate startDate;

        @Column(name = "end_date", nullable = false)
        private LocalDate endDate;

        @Enumerated(EnumType.STRING)
        @Column(name = "frequency", nullable = false, length = 20)
        private RebalanceFrequency frequency;

        @Column(name = "initial_capital", nullable = false, precision = 19, scale = 4)
        private BigDecimal initialCapital;

        /** Null means the configured default. */
        @Column(name = "max_positions")
        private Integer maxPositions;

        @Column(name = "parameters_json", columnDefinition = "TEXT")
        private String parametersJson;

        @Enumerated(EnumType.STRING)
        @Column(name = "status", nullable = false, length = 20)
        private JobStatus status;

        @Column(name = "idempotency_key", nullable = false, unique = true, length = 255)
        private String idempotencyKey;

        @Column(name = "retry_count", nullable = false)
        @Builder.Default
        private Integer retryCount = 0;

        @Column(name = "failure_reason", columnDefinition = "TEXT")
        private String failureReason;

        @CreatedDate
        @Column(name = "created_at", nullable = false, updatable = false)
        private LocalDateTime createdAt;

        @LastModifiedDate
        @Column(name = "updated_at", nullable = false)
        private LocalDateTime updatedAt;
}
