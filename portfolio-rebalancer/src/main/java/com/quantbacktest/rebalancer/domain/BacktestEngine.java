package com.quantbacktest.rebalancer.domain;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorEngine;
import com.quantbacktest.rebalancer.domain.strategy.Candidate;
import com.quantbacktest.rebalancer.domain.strategy.SelectionStrategy;
import com.quantbacktest.rebalancer.domain.strategy.StockSelector;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Date-stepped rebalancing simulation.
 * Rebalance dates are processed strictly in order; only candidate evaluation
 * within a single date runs in parallel.
 */
@Slf4j
public class BacktestEngine {

    private final SimulationConfig config;
    private final MarketDataProvider marketData;
    private final Executor executor;

    public BacktestEngine(SimulationConfig config, MarketDataProvider marketData, Executor executor) {
        this.config = config;
        this.marketData = marketData;
        this.executor = executor;
    }

    /**
     * Run the simulation over every rebalance date between {@code start} and {@code end}.
     *
     * @throws SimulationConfigurationException if the configuration or date range is unusable
     */
    public SimulationRun run(LocalDate start, LocalDate end, RebalanceFrequency frequency, SelectionStrategy strategy) {
        config.validate();
        if (start == null || end == null || frequency == null || strategy == null) {
            throw new SimulationConfigurationException("Start date, end date, frequency and strategy are required");
        }
        if (end.isBefore(start)) {
            throw new SimulationConfigurationException("End date " + end + " is before start date " + start);
        }

        List<Instrument> universe = List.copyOf(marketData.getUniverse());
        Map<String, PriceHistory> histories = new LinkedHashMap<>();
        for (Instrument instrument : universe) {
            histories.put(instrument.getCode(),
                    new PriceHistory(instrument.getCode(), marketData.getPriceHistory(instrument.getCode())));
        }
        PriceLookup prices = (code, date) -> Optional.ofNullable(histories.get(code))
                .flatMap(history -> history.latestClose(date));

        List<LocalDate> dates = frequency.rebalanceDates(start, end);
        log.info("Starting simulation - Strategy: {}, Period: {} to {}, Frequency: {}, Rebalances: {}, Universe: {}",
                strategy.getName(), start, end, frequency, dates.size(), universe.size());

        Portfolio portfolio = new Portfolio(config.getInitialCapital(), config.getLotSize(), config.getCostModel());
        StockSelector selector = new StockSelector(new IndicatorEngine(config.getIndicatorSettings()),
                executor, config.getMinDataDays(), config.getMaxPositions());
        List<PortfolioSnapshot> snapshots = new ArrayList<>();

        for (LocalDate date : dates) {
            snapshots.add(rebalance(date, portfolio, selector, universe, histories, strategy, prices));
        }

        BigDecimal finalValue = portfolio.valuation(end, prices);
        log.info("Simulation completed - Strategy: {}, Trades: {}, Final value: {}",
                strategy.getName(), portfolio.getTrades().size(), finalValue);

        return SimulationRun.builder()
                .strategyName(strategy.getName())
                .frequency(frequency)
                .startDate(start)
                .endDate(end)
                .initialCapital(config.getInitialCapital())
                .snapshots(snapshots)
                .trades(portfolio.getTrades())
                .finalValue(finalValue)
                .finalCash(portfolio.getCash())
                .finalPositions(Map.copyOf(portfolio.getPositions()))
                .build();
    }

    private PortfolioSnapshot rebalance(LocalDate date, Portfolio portfolio, StockSelector selector,
                                        List<Instrument> universe, Map<String, PriceHistory> histories,
                                        SelectionStrategy strategy, PriceLookup prices) {
        BigDecimal valuation = portfolio.valuation(date, prices);
        List<Candidate> selected = selector.select(universe, histories, strategy, date);

        if (selected.isEmpty()) {
            log.info("{}: no instrument qualified, holding {} positions", date, portfolio.getPositions().size());
            return portfolio.snapshot(date, prices);
        }

        Set<String> selectedCodes = new HashSet<>();
        selected.forEach(candidate -> selectedCodes.add(candidate.getCode()));

        // Sells first so the proceeds fund the top-ups
        for (String code : new ArrayList<>(portfolio.getPositions().keySet())) {
            if (selectedCodes.contains(code)) {
                continue;
            }
            Optional<BigDecimal> price = prices.latestClose(code, date);
            if (price.isEmpty()) {
                log.warn("{}: cannot liquidate {}, no price on or before this date", date, code);
                continue;
            }
            report(date, portfolio.execute(TradeType.SELL, code, price.get(), portfolio.getShares(code), date));
        }

        BigDecimal investable = valuation.multiply(BigDecimal.ONE.subtract(config.getCashReserveRatio()));
        BigDecimal targetValue = investable.divide(BigDecimal.valueOf(selected.size()), 8, RoundingMode.HALF_UP);
        BigDecimal lot = BigDecimal.valueOf(config.getLotSize());

        for (Candidate candidate : selected) {
            BigDecimal lotValue = candidate.getPrice().multiply(lot);
            long targetShares = targetValue.divide(lotValue, 0, RoundingMode.DOWN)
                    .multiply(lot)
                    .longValueExact();
            long held = portfolio.getShares(candidate.getCode());
            // Over-weight positions that stay selected are never trimmed
            if (targetShares > held) {
                report(date, portfolio.execute(TradeType.BUY, candidate.getCode(), candidate.getPrice(),
                        targetShares - held, date));
            }
        }

        PortfolioSnapshot snapshot = portfolio.snapshot(date, prices);
        log.info("{}: selected {}, value {}, cash {}, positions {}",
                date, selectedCodes.size(), snapshot.getTotalValue(), snapshot.getCash(), snapshot.getPositionCount());
        return snapshot;
    }

    private void report(LocalDate date, TradeOutcome outcome) {
        if (!outcome.isExecuted()) {
            log.warn("{}: trade skipped - {}", date, outcome.getReason());
        }
    }
}
