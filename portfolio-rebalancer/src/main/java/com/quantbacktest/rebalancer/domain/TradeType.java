package com.quantbacktest.rebalancer.domain;

public enum TradeType {
    BUY, SELL
}
