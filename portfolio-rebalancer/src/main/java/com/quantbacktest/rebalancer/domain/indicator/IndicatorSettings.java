package com.quantbacktest.rebalancer.domain.indicator;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Window lengths and parameters for the indicator engine.
 * Every field is required; defaults live in application configuration.
 */
@Value
@Builder(toBuilder = true)
public class IndicatorSettings {

    /** Minimum number of bars before any snapshot is produced. */
    int lookbackDays;

    @Singular
    List<Integer> maPeriods;

    @Singular
    List<Integer> momentumPeriods;

    int rsiPeriod;
    int macdFast;
    int macdSlow;
    int macdSignal;
    int bollingerPeriod;
    double bollingerStdDev;
    int atrPeriod;
    int volatilityWindow;
    int volumeWindow;
    int pricePositionWindow;
    int extremesWindow;

    /** Annualization constant for realized volatility. */
    int tradingDaysPerYear;

    public void validate() {
        if (lookbackDays <= 0) {
            throw new IllegalArgumentException("lookbackDays must be positive");
        }
        if (maPeriods.isEmpty() || maPeriods.stream().anyMatch(p -> p == null || p <= 0)) {
            throw new IllegalArgumentException("maPeriods must be non-empty and positive");
        }
        if (momentumPeriods.stream().anyMatch(p -> p == null || p <= 0)) {
            throw new IllegalArgumentException("momentumPeriods must be positive");
        }
        if (macdFast <= 0 || macdSlow <= 0 || macdSignal <= 0) {
            throw new IllegalArgumentException("MACD spans must be positive");
        }
        if (rsiPeriod <= 0 || bollingerPeriod < 2 || atrPeriod <= 0 || volatilityWindow < 2
                || volumeWindow <= 0 || pricePositionWindow <= 0 || extremesWindow <= 0) {
            throw new IllegalArgumentException("Indicator windows must be positive");
        }
        if (bollingerStdDev <= 0 || tradingDaysPerYear <= 0) {
            throw new IllegalArgumentException("Bollinger width and trading days per year must be positive");
        }
    }
}
