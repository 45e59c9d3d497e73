package com.quantbacktest.rebalancer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Represents an executed trade in the ledger's log.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Trade {

    private LocalDate date;
    private TradeType type;
    private String code;
    private long shares;
    private BigDecimal price;

    /** Commission plus stamp tax. */
    private BigDecimal cost;

    /**
     * Gross traded amount, shares times price.
     */
    public BigDecimal getAmount() {
        return price.multiply(BigDecimal.valueOf(shares));
    }

    /**
     * Cash moved by the trade: negative for buys, positive for sells.
     */
    public BigDecimal getCashFlow() {
        return type == TradeType.BUY
                ? getAmount().add(cost).negate()
                : getAmount().subtract(cost);
    }
}
