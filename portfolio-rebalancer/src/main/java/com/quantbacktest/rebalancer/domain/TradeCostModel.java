package com.quantbacktest.rebalancer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Transaction costs: a rate-based commission with a flat minimum on both sides,
 * plus a stamp tax charged on sells only.
 */
@Value
@Builder(toBuilder = true)
public class TradeCostModel {

    BigDecimal commissionRate;
    BigDecimal minCommission;
    BigDecimal stampTaxRate;

    public BigDecimal commission(BigDecimal amount) {
        BigDecimal rated = amount.multiply(commissionRate).setScale(4, RoundingMode.HALF_UP);
        return rated.max(minCommission);
    }

    public BigDecimal stampTax(BigDecimal amount) {
        return amount.multiply(stampTaxRate).setScale(4, RoundingMode.HALF_UP);
    }

    public BigDecimal cost(TradeType type, BigDecimal amount) {
        BigDecimal commission = commission(amount);
        return type == TradeType.SELL ? commission.add(stampTax(amount)) : commission;
    }

    public void validate() {
        if (commissionRate == null || minCommission == null || stampTaxRate == null) {
            throw new SimulationConfigurationException("Commission rate, minimum commission and stamp tax are required");
        }
        if (commissionRate.signum() < 0 || minCommission.signum() < 0 || stampTaxRate.signum() < 0) {
            throw new SimulationConfigurationException("Transaction cost parameters must not be negative");
        }
    }
}
