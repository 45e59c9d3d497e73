package com.quantbacktest.rebalancer.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cash and position ledger for one simulation run.
 * Positions are whole lots; cash never goes negative. Not thread-safe.
 */
@Slf4j
public class Portfolio {

    private final BigDecimal initialCapital;
    private final int lotSize;
    private final TradeCostModel costModel;

    private BigDecimal cash;
    private final Map<String, Long> positions = new LinkedHashMap<>();
    private final List<Trade> trades = new ArrayList<>();

    public Portfolio(BigDecimal initialCapital, int lotSize, TradeCostModel costModel) {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new SimulationConfigurationException("Initial capital must be positive");
        }
        if (lotSize <= 0) {
            throw new SimulationConfigurationException("Lot size must be positive");
        }
        costModel.validate();
        this.initialCapital = initialCapital;
        this.lotSize = lotSize;
        this.costModel = costModel;
        this.cash = initialCapital;
    }

    /**
     * Attempt a buy or sell. Rejections perform no mutation.
     */
    public TradeOutcome execute(TradeType type, String code, BigDecimal price, long shares, LocalDate date) {
        if (shares <= 0 || shares % lotSize != 0) {
            return TradeOutcome.rejected("Share count " + shares + " is not a positive multiple of " + lotSize);
        }
        if (price == null || price.signum() <= 0) {
            return TradeOutcome.rejected("No valid price for " + code);
        }

        BigDecimal amount = price.multiply(BigDecimal.valueOf(shares));
        BigDecimal cost = costModel.cost(type, amount);

        if (type == TradeType.BUY) {
            BigDecimal total = amount.add(cost);
            if (cash.compareTo(total) < 0) {
                return TradeOutcome.rejected("Insufficient cash for " + code + ": need " + total + ", have " + cash);
            }
            cash = cash.subtract(total);
            positions.merge(code, shares, Long::sum);
        } else {
            long held = getShares(code);
            if (held < shares) {
                return TradeOutcome.rejected("Insufficient shares of " + code + ": need " + shares + ", hold " + held);
            }
            cash = cash.add(amount.subtract(cost));
            if (held == shares) {
                positions.remove(code);
            } else {
                positions.put(code, held - shares);
            }
        }

        Trade trade = Trade.builder()
                .date(date)
                .type(type)
                .code(code)
                .shares(shares)
                .price(price)
                .cost(cost)
                .build();
        trades.add(trade);
        log.debug("{} {} {} @ {} on {} (cost {})", type, shares, code, price, date, cost);
        return TradeOutcome.executed(trade);
    }

    /**
     * Cash plus held shares at their latest close on or before the date.
     * A held instrument without any price contributes nothing.
     */
    public BigDecimal valuation(LocalDate date, PriceLookup prices) {
        BigDecimal total = cash;
        for (Map.Entry<String, Long> position : positions.entrySet()) {
            Optional<BigDecimal> close = prices.latestClose(position.getKey(), date);
            if (close.isEmpty()) {
                log.warn("No price for held instrument {} on or before {}; valued at zero", position.getKey(), date);
                continue;
            }
            total = total.add(close.get().multiply(BigDecimal.valueOf(position.getValue())));
        }
        return total;
    }

    public PortfolioSnapshot snapshot(LocalDate date, PriceLookup prices) {
        return PortfolioSnapshot.builder()
                .date(date)
                .totalValue(valuation(date, prices))
                .cash(cash)
                .positionCount(positions.size())
                .build();
    }

    public long getShares(String code) {
        return positions.getOrDefault(code, 0L);
    }

    public BigDecimal getCash() {
        return cash;
    }

    public BigDecimal getInitialCapital() {
        return initialCapital;
    }

    public int getLotSize() {
        return lotSize;
    }

    public Map<String, Long> getPositions() {
        return Collections.unmodifiableMap(positions);
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }
}
