package com.quantbacktest.rebalancer.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.quantbacktest.rebalancer.domain.RebalanceFrequency;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Request DTO for submitting a simulation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulationRequest {

    @NotBlank(message = "Strategy name is required")
    private String strategyName;

    @NotNull(message = "Start date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    /** Optional, the configured default applies when absent. */
    private RebalanceFrequency frequency;

    @NotNull(message = "Initial capital is required")
    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    /** Optional, the configured default applies when absent. */
    @Positive(message = "Max positions must be positive")
    private Integer maxPositions;

    /** Strategy tunables, passed to the strategy factory as JSON. */
    private Map<String, Object> parameters;
}
