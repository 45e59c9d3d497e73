package com.quantbacktest.rebalancer.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Calculator for simulation performance metrics.
 * Every method is pure; degenerate inputs (empty history, zero variance) yield zero.
 */
public final class PerformanceMetrics {

    private static final int SCALE = 6;

    private PerformanceMetrics() {
    }

    /**
     * Compute the full metric set for a run.
     *
     * @param annualRiskFreeRate   annual risk-free rate, spread evenly over the rebalance periods
     * @param benchmarkAnnualReturn annual return the strategy is compared against
     */
    public static PerformanceReport calculate(SimulationRun run, double annualRiskFreeRate, double benchmarkAnnualReturn) {
        List<PortfolioSnapshot> snapshots = run.getSnapshots();
        List<BigDecimal> values = new ArrayList<>(snapshots.size());
        snapshots.forEach(snapshot -> values.add(snapshot.getTotalValue()));
        double[] returns = periodReturns(values);

        long elapsedDays = snapshots.size() < 2 ? 0
                : ChronoUnit.DAYS.between(snapshots.get(0).getDate(), snapshots.get(snapshots.size() - 1).getDate());
        int periodsPerYear = run.getFrequency().getPeriodsPerYear();

        // Return and elapsed time both end at the last rebalance; the end-date valuation is reported on its own
        BigDecimal lastValue = values.isEmpty() ? null : values.get(values.size() - 1);
        BigDecimal totalReturn = calculateTotalReturn(run.getInitialCapital(), lastValue);
        BigDecimal annualized = calculateAnnualizedReturn(totalReturn, elapsedDays);
        BigDecimal maxDrawdown = calculateMaxDrawdown(values);
        BigDecimal winRate = calculateWinRate(returns);
        BigDecimal sharpe = calculateSharpeRatio(returns, annualRiskFreeRate / periodsPerYear);
        int streak = calculateMaxLosingStreak(returns);

        int buys = 0;
        int sells = 0;
        BigDecimal costs = BigDecimal.ZERO;
        for (Trade trade : run.getTrades()) {
            if (trade.getType() == TradeType.BUY) {
                buys++;
            } else {
                sells++;
            }
            costs = costs.add(trade.getCost());
        }

        BigDecimal benchmark = scaled(benchmarkAnnualReturn);
        int ratingScore = ratingScore(annualized.doubleValue(), maxDrawdown.doubleValue(),
                sharpe.doubleValue(), winRate.doubleValue(), streak);

        return PerformanceReport.builder()
                .strategyName(run.getStrategyName())
                .initialValue(run.getInitialCapital())
                .finalValue(run.getFinalValue())
                .elapsedDays(elapsedDays)
                .totalReturn(totalReturn)
                .annualizedReturn(annualized)
                .maxDrawdown(maxDrawdown)
                .winRate(winRate)
                .volatility(calculateVolatility(returns, periodsPerYear))
                .sharpeRatio(sharpe)
                .informationRatio(calculateInformationRatio(returns))
                .maxLosingStreak(streak)
                .tradeCount(run.getTrades().size())
                .buyCount(buys)
                .sellCount(sells)
                .totalTransactionCosts(costs)
                .benchmarkReturn(benchmark)
                .excessReturn(annualized.subtract(benchmark))
                .ratingScore(ratingScore)
                .rating(StrategyRating.fromScore(ratingScore))
                .build();
    }

    /**
     * Simple returns between consecutive values. A non-positive base value is skipped.
     */
    public static double[] periodReturns(List<BigDecimal> values) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < values.size(); i++) {
            double previous = values.get(i - 1).doubleValue();
            if (previous > 0) {
                returns.add(values.get(i).doubleValue() / previous - 1);
            }
        }
        return returns.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public static BigDecimal calculateTotalReturn(BigDecimal initialCapital, BigDecimal finalValue) {
        if (initialCapital == null || finalValue == null || initialCapital.signum() == 0) {
            return zero();
        }
        return finalValue.subtract(initialCapital).divide(initialCapital, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * (1 + total)^(365 / days) - 1, or zero when no time has elapsed.
     */
    public static BigDecimal calculateAnnualizedReturn(BigDecimal totalReturn, long elapsedDays) {
        if (elapsedDays <= 0 || totalReturn.doubleValue() <= -1) {
            return zero();
        }
        return scaled(Math.pow(1 + totalReturn.doubleValue(), 365.0 / elapsedDays) - 1);
    }

    /**
     * Worst decline from the running peak, as a non-positive fraction.
     */
    public static BigDecimal calculateMaxDrawdown(List<BigDecimal> values) {
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0;
        for (BigDecimal value : values) {
            double v = value.doubleValue();
            peak = Math.max(peak, v);
            if (peak > 0) {
                worst = Math.min(worst, (v - peak) / peak);
            }
        }
        return scaled(worst);
    }

    public static BigDecimal calculateWinRate(double[] returns) {
        if (returns.length == 0) {
            return zero();
        }
        long wins = 0;
        for (double r : returns) {
            if (r > 0) {
                wins++;
            }
        }
        return scaled((double) wins / returns.length);
    }

    /**
     * Sample deviation of period returns, annualized with the periods-per-year constant.
     */
    public static BigDecimal calculateVolatility(double[] returns, int periodsPerYear) {
        return scaled(sampleStdDev(returns) * Math.sqrt(periodsPerYear));
    }

    /**
     * Mean excess return over its deviation, scaled by the square root of the number of periods.
     */
    public static BigDecimal calculateSharpeRatio(double[] returns, double riskFreePerPeriod) {
        double[] excess = new double[returns.length];
        for (int i = 0; i < returns.length; i++) {
            excess[i] = returns[i] - riskFreePerPeriod;
        }
        return ratio(excess);
    }

    public static BigDecimal calculateInformationRatio(double[] returns) {
        return ratio(returns);
    }

    public static int calculateMaxLosingStreak(double[] returns) {
        int longest = 0;
        int current = 0;
        for (double r : returns) {
            current = r < 0 ? current + 1 : 0;
            longest = Math.max(longest, current);
        }
        return longest;
    }

    /**
     * 0-100 composite: annual return 30, drawdown 25, Sharpe 20, win rate 15, losing streak 10.
     */
    public static int ratingScore(double annualReturn, double maxDrawdown, double sharpe, double winRate, int losingStreak) {
        int score = 0;

        if (annualReturn > 0.20) {
            score += 30;
        } else if (annualReturn > 0.15) {
            score += 25;
        } else if (annualReturn > 0.10) {
            score += 20;
        } else if (annualReturn > 0.05) {
            score += 15;
        } else if (annualReturn > 0) {
            score += 10;
        }

        double drawdown = Math.abs(maxDrawdown);
        if (drawdown < 0.05) {
            score += 25;
        } else if (drawdown < 0.10) {
            score += 20;
        } else if (drawdown < 0.15) {
            score += 15;
        } else if (drawdown < 0.20) {
            score += 10;
        } else if (drawdown < 0.30) {
            score += 5;
        }

        if (sharpe > 2) {
            score += 20;
        } else if (sharpe > 1.5) {
            score += 15;
        } else if (sharpe > 1) {
            score += 10;
        } else if (sharpe > 0.5) {
            score += 5;
        }

        if (winRate > 0.6) {
            score += 15;
        } else if (winRate > 0.55) {
            score += 12;
        } else if (winRate > 0.5) {
            score += 10;
        } else if (winRate > 0.45) {
            score += 7;
        } else if (winRate > 0.4) {
            score += 5;
        }

        if (losingStreak <= 2) {
            score += 10;
        } else if (losingStreak <= 3) {
            score += 8;
        } else if (losingStreak <= 5) {
            score += 5;
        } else if (losingStreak <= 7) {
            score += 3;
        }

        return score;
    }

    private static BigDecimal ratio(double[] series) {
        if (series.length < 2) {
            return zero();
        }
        double std = sampleStdDev(series);
        if (std <= 1e-12) {
            return zero();
        }
        return scaled(mean(series) / std * Math.sqrt(series.length));
    }

    private static double mean(double[] series) {
        double sum = 0;
        for (double v : series) {
            sum += v;
        }
        return sum / series.length;
    }

    private static double sampleStdDev(double[] series) {
        if (series.length < 2) {
            return 0;
        }
        double mean = mean(series);
        double sumSquares = 0;
        for (double v : series) {
            sumSquares += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSquares / (series.length - 1));
    }

    private static BigDecimal scaled(double value) {
        if (!Double.isFinite(value)) {
            return zero();
        }
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }
}
