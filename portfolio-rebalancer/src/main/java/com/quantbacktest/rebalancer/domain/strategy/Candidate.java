package com.quantbacktest.rebalancer.domain.strategy;

import com.quantbacktest.rebalancer.domain.indicator.IndicatorSnapshot;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * An instrument selected on one rebalance date, with the close used for scoring.
 */
@Value
@Builder
public class Candidate {

    String code;
    String name;
    double score;
    BigDecimal price;
    IndicatorSnapshot indicators;
}
