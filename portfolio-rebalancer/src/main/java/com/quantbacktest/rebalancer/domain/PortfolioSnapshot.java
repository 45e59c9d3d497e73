package com.quantbacktest.rebalancer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Portfolio state recorded once per rebalance date.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PortfolioSnapshot {

    private LocalDate date;
    private BigDecimal totalValue;
    private BigDecimal cash;
    private int positionCount;
}
