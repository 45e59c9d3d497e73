package com.quantbacktest.rebalancer.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Result of a ledger execution attempt. A rejected trade leaves the ledger untouched.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TradeOutcome {

    boolean executed;
    Trade trade;
    String reason;

    public static TradeOutcome executed(Trade trade) {
        return new TradeOutcome(true, trade, null);
    }

    public static TradeOutcome rejected(String reason) {
        return new TradeOutcome(false, null, reason);
    }

    public Optional<Trade> getExecutedTrade() {
        return Optional.ofNullable(trade);
    }
}
