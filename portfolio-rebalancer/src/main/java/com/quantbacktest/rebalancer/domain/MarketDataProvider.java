package com.quantbacktest.rebalancer.domain;

import java.util.List;

/**
 * Read-only access to the instrument universe and daily price histories.
 */
public interface MarketDataProvider {

    /**
     * Get the selection universe in its natural iteration order.
     * Ties in selection scores are broken by this order.
     */
    List<Instrument> getUniverse();

    /**
     * Get the full date-ordered bar sequence for an instrument.
     *
     * @param code the instrument code
     * @return bars oldest first, or an empty list if the code is unknown
     */
    List<PriceBar> getPriceHistory(String code);
}
