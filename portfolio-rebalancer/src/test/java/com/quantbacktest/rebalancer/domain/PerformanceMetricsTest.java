package com.quantbacktest.rebalancer.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceMetricsTest {

    private static final BigDecimal CAPITAL = new BigDecimal("1000000");

    private static SimulationRun run(RebalanceFrequency frequency, LocalDate first, int stepMonths, String... values) {
        SimulationRun.SimulationRunBuilder builder = SimulationRun.builder()
                .strategyName("Test")
                .frequency(frequency)
                .startDate(first)
                .initialCapital(CAPITAL);
        LocalDate date = first;
        for (String value : values) {
            builder.snapshot(PortfolioSnapshot.builder()
                    .date(date)
                    .totalValue(new BigDecimal(value))
                    .cash(BigDecimal.ZERO)
                    .positionCount(1)
                    .build());
            date = date.plusMonths(stepMonths);
        }
        String last = values.length == 0 ? CAPITAL.toPlainString() : values[values.length - 1];
        return builder
                .endDate(date)
                .finalValue(new BigDecimal(last))
                .finalCash(BigDecimal.ZERO)
                .build();
    }

    @Test
    void testCalculateAnnualizedReturn_FivePercentOverNinetyOneDays() {
        BigDecimal annualized = PerformanceMetrics.calculateAnnualizedReturn(new BigDecimal("0.05"), 91);

        assertEquals(0.2162, annualized.doubleValue(), 1e-4);
    }

    @Test
    void testCalculateAnnualizedReturn_NoElapsedTime_ReturnsZero() {
        assertEquals(0, BigDecimal.ZERO.compareTo(PerformanceMetrics.calculateAnnualizedReturn(new BigDecimal("0.05"), 0)));
    }

    @Test
    void testCalculateMaxDrawdown() {
        List<BigDecimal> values = List.of(new BigDecimal("100"), new BigDecimal("120"),
                new BigDecimal("90"), new BigDecimal("130"));

        assertEquals(-0.25, PerformanceMetrics.calculateMaxDrawdown(values).doubleValue(), 1e-9);
    }

    @Test
    void testCalculateMaxDrawdown_MonotoneRise_IsZero() {
        List<BigDecimal> values = List.of(new BigDecimal("100"), new BigDecimal("110"), new BigDecimal("120"));

        assertEquals(0, BigDecimal.ZERO.compareTo(PerformanceMetrics.calculateMaxDrawdown(values)));
    }

    @Test
    void testWinRateAndLosingStreak() {
        double[] returns = {-0.01, -0.02, 0.03, -0.01, -0.01, -0.01, 0.02};

        assertEquals(2.0 / 7, PerformanceMetrics.calculateWinRate(returns).doubleValue(), 1e-6);
        assertEquals(3, PerformanceMetrics.calculateMaxLosingStreak(returns));
    }

    @Test
    void testRatios_ZeroVariance_ReturnZero() {
        double[] returns = PerformanceMetrics.periodReturns(List.of(
                new BigDecimal("100"), new BigDecimal("110"), new BigDecimal("121")));

        assertEquals(2, returns.length);
        assertEquals(0, BigDecimal.ZERO.compareTo(PerformanceMetrics.calculateSharpeRatio(returns, 0.0)));
        assertEquals(0, BigDecimal.ZERO.compareTo(PerformanceMetrics.calculateInformationRatio(returns)));
    }

    @Test
    void testRatios_SingleReturn_ReturnZero() {
        double[] returns = {0.05};

        assertEquals(0, BigDecimal.ZERO.compareTo(PerformanceMetrics.calculateSharpeRatio(returns, 0.0)));
        assertEquals(0, BigDecimal.ZERO.compareTo(PerformanceMetrics.calculateVolatility(returns, 4)));
    }

    @Test
    void testCalculate_QuarterlyRun() {
        SimulationRun run = run(RebalanceFrequency.QUARTERLY, LocalDate.of(2023, 1, 1), 3,
                "1000000", "1050000", "1020000", "1100000", "1150000");

        PerformanceReport report = PerformanceMetrics.calculate(run, 0.03, 0.08);

        assertEquals(0.15, report.getTotalReturn().doubleValue(), 1e-9);
        assertEquals(365, report.getElapsedDays());
        assertEquals(0.15, report.getAnnualizedReturn().doubleValue(), 1e-6);
        assertEquals(0.75, report.getWinRate().doubleValue(), 1e-9);
        assertEquals(1, report.getMaxLosingStreak());
        assertEquals((1020000.0 - 1050000.0) / 1050000.0, report.getMaxDrawdown().doubleValue(), 1e-6);
        assertTrue(report.getVolatility().signum() > 0);
        assertTrue(report.getSharpeRatio().signum() > 0);
        assertEquals(0, report.getBenchmarkReturn().compareTo(new BigDecimal("0.08")));
        assertEquals(0, report.getAnnualizedReturn().subtract(new BigDecimal("0.08")).compareTo(report.getExcessReturn()));
        assertEquals(StrategyRating.fromScore(report.getRatingScore()), report.getRating());
    }

    @Test
    void testCalculate_TotalReturnUsesLastSnapshot_NotEndDateValuation() {
        SimulationRun base = run(RebalanceFrequency.QUARTERLY, LocalDate.of(2023, 1, 1), 3,
                "1000000", "1000000", "1100000");
        SimulationRun run = base.toBuilder()
                .endDate(LocalDate.of(2023, 12, 31))
                .finalValue(new BigDecimal("2000000"))
                .build();

        PerformanceReport report = PerformanceMetrics.calculate(run, 0.03, 0.08);

        assertEquals(0.10, report.getTotalReturn().doubleValue(), 1e-9);
        assertEquals(181, report.getElapsedDays());
        assertEquals(Math.pow(1.1, 365.0 / 181) - 1, report.getAnnualizedReturn().doubleValue(), 1e-6);
        assertEquals(0, new BigDecimal("2000000").compareTo(report.getFinalValue()));
    }

    @Test
    void testCalculate_CountsTradesAndCosts() {
        SimulationRun base = run(RebalanceFrequency.MONTHLY, LocalDate.of(2023, 1, 1), 1, "1000000", "1010000");
        List<Trade> trades = new ArrayList<>();
        trades.add(Trade.builder().type(TradeType.BUY).code("600000").shares(100)
                .price(new BigDecimal("10")).cost(new BigDecimal("5")).build());
        trades.add(Trade.builder().type(TradeType.SELL).code("600000").shares(100)
                .price(new BigDecimal("11")).cost(new BigDecimal("6.1")).build());
        SimulationRun run = SimulationRun.builder()
                .strategyName(base.getStrategyName())
                .frequency(base.getFrequency())
                .startDate(base.getStartDate())
                .endDate(base.getEndDate())
                .initialCapital(base.getInitialCapital())
                .snapshots(base.getSnapshots())
                .trades(trades)
                .finalValue(base.getFinalValue())
                .finalCash(base.getFinalCash())
                .build();

        PerformanceReport report = PerformanceMetrics.calculate(run, 0.03, 0.08);

        assertEquals(2, report.getTradeCount());
        assertEquals(1, report.getBuyCount());
        assertEquals(1, report.getSellCount());
        assertEquals(0, new BigDecimal("11.1").compareTo(report.getTotalTransactionCosts()));
    }

    @Test
    void testCalculate_EmptyHistory_AllZero() {
        SimulationRun run = run(RebalanceFrequency.QUARTERLY, LocalDate.of(2023, 1, 1), 3);

        PerformanceReport report = PerformanceMetrics.calculate(run, 0.03, 0.08);

        assertEquals(0, BigDecimal.ZERO.compareTo(report.getTotalReturn()));
        assertEquals(0, BigDecimal.ZERO.compareTo(report.getAnnualizedReturn()));
        assertEquals(0, BigDecimal.ZERO.compareTo(report.getMaxDrawdown()));
        assertEquals(0, BigDecimal.ZERO.compareTo(report.getSharpeRatio()));
        assertEquals(0, report.getMaxLosingStreak());
        assertEquals(0, report.getElapsedDays());
    }

    @Test
    void testCalculate_IsRepeatable() {
        SimulationRun run = run(RebalanceFrequency.MONTHLY, LocalDate.of(2023, 1, 1), 1,
                "1000000", "990000", "1030000", "1010000");

        assertEquals(PerformanceMetrics.calculate(run, 0.03, 0.08), PerformanceMetrics.calculate(run, 0.03, 0.08));
    }

    @Test
    void testRatingScore() {
        assertEquals(100, PerformanceMetrics.ratingScore(0.25, -0.04, 2.5, 0.7, 1));
        assertEquals(StrategyRating.EXCELLENT, StrategyRating.fromScore(100));
        assertEquals(0, PerformanceMetrics.ratingScore(-0.1, -0.5, -1, 0.1, 10));
        assertEquals(StrategyRating.NEEDS_OPTIMIZATION, StrategyRating.fromScore(0));
        assertEquals(StrategyRating.AVERAGE, StrategyRating.fromScore(60));
    }
}
