package com.quantbacktest.rebalancer.domain.indicator;

import com.quantbacktest.rebalancer.domain.PriceBar;
import com.quantbacktest.rebalancer.domain.PriceHistory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes an {@link IndicatorSnapshot} from a bar prefix.
 * Stateless and thread-safe: the same prefix always yields the same snapshot,
 * and only bars dated on or before the target date are ever read.
 */
public class IndicatorEngine {

    private static final double ZERO_WIDTH = 1e-12;

    private final IndicatorSettings settings;

    public IndicatorEngine(IndicatorSettings settings) {
        settings.validate();
        this.settings = settings;
    }

    public IndicatorSettings getSettings() {
        return settings;
    }

    /**
     * Compute the snapshot of an instrument as of the given date.
     *
     * @return the snapshot, or empty if fewer than the lookback bars exist on or before {@code asOf}
     */
    public Optional<IndicatorSnapshot> compute(PriceHistory history, LocalDate asOf) {
        return compute(history.upTo(asOf), asOf);
    }

    /**
     * Compute a snapshot from bars already truncated to the target date.
     * Bars after {@code asOf} are ignored if present.
     */
    public Optional<IndicatorSnapshot> compute(List<PriceBar> bars, LocalDate asOf) {
        List<PriceBar> prefix = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) {
            if (!bar.getDate().isAfter(asOf)) {
                prefix.add(bar);
            }
        }
        if (prefix.size() < settings.getLookbackDays()) {
            return Optional.empty();
        }

        int n = prefix.size();
        double[] close = new double[n];
        double[] high = new double[n];
        double[] low = new double[n];
        double[] volume = new double[n];
        for (int i = 0; i < n; i++) {
            PriceBar bar = prefix.get(i);
            close[i] = bar.getClose().doubleValue();
            high[i] = bar.getHigh() != null ? bar.getHigh().doubleValue() : close[i];
            low[i] = bar.getLow() != null ? bar.getLow().doubleValue() : close[i];
            volume[i] = bar.getVolume() != null ? bar.getVolume() : 0d;
        }

        Map<String, Double> values = new LinkedHashMap<>();
        put(values, Indicators.PRICE, close[n - 1]);
        addExtremes(values, high, low);
        addMovingAverages(values, close);
        addMomentum(values, close);
        addMacd(values, close);
        addBollinger(values, close);
        addVolatility(values, close, high, low);
        addVolume(values, close, volume);

        return Optional.of(new IndicatorSnapshot(asOf, values));
    }

    private void addExtremes(Map<String, Double> values, double[] high, double[] low) {
        int window = settings.getExtremesWindow();
        if (high.length >= window) {
            put(values, Indicators.HIGH_52W, max(high, window));
            put(values, Indicators.LOW_52W, min(low, window));
        }
    }

    private void addMovingAverages(Map<String, Double> values, double[] close) {
        List<Integer> periods = new ArrayList<>(settings.getMaPeriods());
        periods.sort(Integer::compare);

        boolean allPresent = true;
        double[] averages = new double[periods.size()];
        for (int i = 0; i < periods.size(); i++) {
            int period = periods.get(i);
            if (close.length >= period) {
                averages[i] = mean(close, period);
                put(values, Indicators.movingAverage(period), averages[i]);
            } else {
                allPresent = false;
            }
        }

        if (allPresent) {
            boolean descending = true;
            boolean ascending = true;
            for (int i = 1; i < averages.length; i++) {
                descending &= averages[i - 1] > averages[i];
                ascending &= averages[i - 1] < averages[i];
            }
            double trend = averages.length < 2 ? 0 : descending ? 1 : ascending ? -1 : 0;
            put(values, Indicators.MA_TREND, trend);
        }
    }

    private void addMomentum(Map<String, Double> values, double[] close) {
        int last = close.length - 1;
        for (int days : settings.getMomentumPeriods()) {
            if (last - days >= 0 && close[last - days] != 0) {
                put(values, Indicators.momentum(days), close[last] / close[last - days] - 1);
            }
        }
        if (last - 10 >= 0 && close[last - 10] != 0) {
            put(values, Indicators.ROC_10, (close[last] - close[last - 10]) / close[last - 10] * 100);
        }

        int period = settings.getRsiPeriod();
        if (close.length > period) {
            double gain = 0;
            double loss = 0;
            for (int i = close.length - period; i < close.length; i++) {
                double delta = close[i] - close[i - 1];
                if (delta > 0) {
                    gain += delta;
                } else {
                    loss -= delta;
                }
            }
            double avgGain = gain / period;
            double avgLoss = loss / period;
            double rsi = avgLoss == 0 ? 100 : 100 - 100 / (1 + avgGain / avgLoss);
            put(values, Indicators.RSI, rsi);
        }
    }

    private void addMacd(Map<String, Double> values, double[] close) {
        AdjustedEma fast = new AdjustedEma(settings.getMacdFast());
        AdjustedEma slow = new AdjustedEma(settings.getMacdSlow());
        AdjustedEma signal = new AdjustedEma(settings.getMacdSignal());

        double macd = 0;
        double macdSignal = 0;
        for (double price : close) {
            macd = fast.update(price) - slow.update(price);
            macdSignal = signal.update(macd);
        }
        put(values, Indicators.MACD, macd);
        put(values, Indicators.MACD_SIGNAL, macdSignal);
        put(values, Indicators.MACD_HIST, macd - macdSignal);
    }

    private void addBollinger(Map<String, Double> values, double[] close) {
        int period = settings.getBollingerPeriod();
        if (close.length < period) {
            return;
        }
        double middle = mean(close, period);
        double std = sampleStd(close, close.length - period, close.length);
        double upper = middle + settings.getBollingerStdDev() * std;
        double lower = middle - settings.getBollingerStdDev() * std;
        put(values, Indicators.BB_UPPER, upper);
        put(values, Indicators.BB_MIDDLE, middle);
        put(values, Indicators.BB_LOWER, lower);
        if (upper - lower > ZERO_WIDTH) {
            put(values, Indicators.BB_POSITION, (close[close.length - 1] - lower) / (upper - lower));
        }
    }

    private void addVolatility(Map<String, Double> values, double[] close, double[] high, double[] low) {
        int n = close.length;

        int window = settings.getVolatilityWindow();
        if (n - 1 >= window) {
            double[] returns = new double[window];
            boolean defined = true;
            for (int k = 0; k < window; k++) {
                int i = n - window + k;
                if (close[i - 1] == 0) {
                    defined = false;
                    break;
                }
                returns[k] = close[i] / close[i - 1] - 1;
            }
            if (defined) {
                double annualized = sampleStd(returns, 0, window) * Math.sqrt(settings.getTradingDaysPerYear());
                put(values, Indicators.VOLATILITY, annualized);
            }
        }

        int atrPeriod = settings.getAtrPeriod();
        if (n >= atrPeriod) {
            double sum = 0;
            for (int i = n - atrPeriod; i < n; i++) {
                double range = high[i] - low[i];
                if (i > 0) {
                    range = Math.max(range, Math.abs(high[i] - close[i - 1]));
                    range = Math.max(range, Math.abs(low[i] - close[i - 1]));
                }
                sum += range;
            }
            put(values, Indicators.ATR, sum / atrPeriod);
        }

        int positionWindow = settings.getPricePositionWindow();
        if (n >= positionWindow) {
            double lowest = min(low, positionWindow);
            double highest = max(high, positionWindow);
            if (highest - lowest > ZERO_WIDTH) {
                put(values, Indicators.PRICE_POSITION, (close[n - 1] - lowest) / (highest - lowest));
            }
        }
    }

    private void addVolume(Map<String, Double> values, double[] close, double[] volume) {
        int n = close.length;
        int window = settings.getVolumeWindow();
        if (n >= window) {
            double average = mean(volume, window);
            put(values, Indicators.VOLUME_MA20, average);
            if (average > 0) {
                put(values, Indicators.VOLUME_RATIO, volume[n - 1] / average);
            }
        }

        double obv = 0;
        double vpt = 0;
        for (int i = 1; i < n; i++) {
            obv += volume[i] * Math.signum(close[i] - close[i - 1]);
            if (close[i - 1] != 0) {
                vpt += volume[i] * (close[i] / close[i - 1] - 1);
            }
        }
        put(values, Indicators.OBV, obv);
        put(values, Indicators.VPT, vpt);
    }

    private static void put(Map<String, Double> values, String name, double value) {
        if (Double.isFinite(value)) {
            values.put(name, value);
        }
    }

    private static double mean(double[] series, int window) {
        double sum = 0;
        for (int i = series.length - window; i < series.length; i++) {
            sum += series[i];
        }
        return sum / window;
    }

    private static double sampleStd(double[] series, int from, int to) {
        int count = to - from;
        if (count < 2) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += series[i];
        }
        double mean = sum / count;
        double squared = 0;
        for (int i = from; i < to; i++) {
            squared += (series[i] - mean) * (series[i] - mean);
        }
        return Math.sqrt(squared / (count - 1));
    }

    private static double max(double[] series, int window) {
        double result = Double.NEGATIVE_INFINITY;
        for (int i = series.length - window; i < series.length; i++) {
            result = Math.max(result, series[i]);
        }
        return result;
    }

    private static double min(double[] series, int window) {
        double result = Double.POSITIVE_INFINITY;
        for (int i = series.length - window; i < series.length; i++) {
            result = Math.min(result, series[i]);
        }
        return result;
    }

    /**
     * Span-based exponential average with bias-corrected weights, so early
     * values are not pulled toward zero.
     */
    private static final class AdjustedEma {

        private final double decay;
        private double weightedSum;
        private double weightTotal;

        AdjustedEma(int span) {
            this.decay = 1 - 2.0 / (span + 1);
        }

        double update(double value) {
            weightedSum = value + decay * weightedSum;
            weightTotal = 1 + decay * weightTotal;
            return weightedSum / weightTotal;
        }
    }
}
