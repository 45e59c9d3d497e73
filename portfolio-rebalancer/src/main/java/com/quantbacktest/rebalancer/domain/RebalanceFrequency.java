package com.quantbacktest.rebalancer.domain;

import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rebalance schedule anchored to the first calendar day of each period.
 */
public enum RebalanceFrequency {

    MONTHLY(1, 12),
    QUARTERLY(3, 4),
    YEARLY(12, 1);

    private final int monthsPerPeriod;
    private final int periodsPerYear;

    RebalanceFrequency(int monthsPerPeriod, int periodsPerYear) {
        this.monthsPerPeriod = monthsPerPeriod;
        this.periodsPerYear = periodsPerYear;
    }

    public int getPeriodsPerYear() {
        return periodsPerYear;
    }

    /**
     * Every period start between {@code start} and {@code end}, both inclusive.
     */
    public List<LocalDate> rebalanceDates(LocalDate start, LocalDate end) {
        List<LocalDate> dates = new ArrayList<>();
        LocalDate date = firstPeriodStartOnOrAfter(start);
        while (!date.isAfter(end)) {
            dates.add(date);
            date = date.plusMonths(monthsPerPeriod);
        }
        return dates;
    }

    private LocalDate firstPeriodStartOnOrAfter(LocalDate date) {
        LocalDate monthStart = date.with(TemporalAdjusters.firstDayOfMonth());
        int monthIndex = monthStart.getMonthValue() - 1;
        int offset = monthIndex % monthsPerPeriod;
        LocalDate periodStart = offset == 0 ? monthStart : monthStart.plusMonths(monthsPerPeriod - offset);
        if (periodStart.isBefore(date)) {
            periodStart = periodStart.plusMonths(monthsPerPeriod);
        }
        return periodStart;
    }

    /**
     * Accepts enum names and the short codes M, Q and Y.
     */
    public static RebalanceFrequency fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new SimulationConfigurationException("Rebalance frequency is required");
        }
        return switch (code.trim().toUpperCase(Locale.ROOT)) {
            case "M", "MONTHLY" -> MONTHLY;
            case "Q", "QUARTERLY" -> QUARTERLY;
            case "Y", "A", "YEARLY", "ANNUAL" -> YEARLY;
            default -> throw new SimulationConfigurationException("Unknown rebalance frequency: " + code);
        };
    }
}
