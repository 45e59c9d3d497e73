package com.quantbacktest.rebalancer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One trading day of OHLCV data for a single instrument.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceBar {

    private LocalDate date;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private Long volume;
}
