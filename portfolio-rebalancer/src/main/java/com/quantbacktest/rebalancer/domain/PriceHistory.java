package com.quantbacktest.rebalancer.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only, date-ordered bar sequence for one instrument.
 * All "as of" reads go through {@link #upTo(LocalDate)} and
 * {@link #latestClose(LocalDate)}, which never expose bars dated after the
 * requested date.
 */
public final class PriceHistory {

    private final String code;
    private final List<PriceBar> bars;

    public PriceHistory(String code, List<PriceBar> source) {
        this.code = code;
        List<PriceBar> sorted = new ArrayList<>(source == null ? List.of() : source);
        sorted.removeIf(bar -> bar == null || bar.getDate() == null);
        sorted.sort(Comparator.comparing(PriceBar::getDate));

        List<PriceBar> unique = new ArrayList<>(sorted.size());
        for (PriceBar bar : sorted) {
            // duplicate dates keep the first occurrence
            if (unique.isEmpty() || unique.get(unique.size() - 1).getDate().isBefore(bar.getDate())) {
                unique.add(bar);
            }
        }
        this.bars = Collections.unmodifiableList(unique);
    }

    public String getCode() {
        return code;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    /**
     * Bars dated on or before the given date, oldest first.
     */
    public List<PriceBar> upTo(LocalDate date) {
        return bars.subList(0, countUpTo(date));
    }

    /**
     * Close of the most recent bar dated on or before the given date.
     */
    public Optional<BigDecimal> latestClose(LocalDate date) {
        int count = countUpTo(date);
        if (count == 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(bars.get(count - 1).getClose());
    }

    /**
     * Number of bars dated on or before the given date (binary search).
     */
    public int countUpTo(LocalDate date) {
        int low = 0;
        int high = bars.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (bars.get(mid).getDate().isAfter(date)) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }
}
