package com.quantbacktest.rebalancer.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Most recent close of an instrument at or before a date.
 */
@FunctionalInterface
public interface PriceLookup {

    Optional<BigDecimal> latestClose(String code, LocalDate date);
}
