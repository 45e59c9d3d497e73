package com.quantbacktest.rebalancer.domain.strategy;

import com.quantbacktest.rebalancer.domain.Instrument;
import com.quantbacktest.rebalancer.domain.PriceHistory;
import com.quantbacktest.rebalancer.domain.indicator.IndicatorEngine;
import com.quantbacktest.rebalancer.domain.indicator.IndicatorSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs a strategy over the whole universe for one rebalance date.
 * Indicator computation and qualification fan out on the supplied executor;
 * ranking happens after every instrument has been evaluated.
 */
@Slf4j
public class StockSelector {

    private final IndicatorEngine indicatorEngine;
    private final Executor executor;
    private final int minDataDays;
    private final int maxSelections;

    public StockSelector(IndicatorEngine indicatorEngine, Executor executor, int minDataDays, int maxSelections) {
        if (maxSelections <= 0) {
            throw new IllegalArgumentException("maxSelections must be positive");
        }
        this.indicatorEngine = indicatorEngine;
        this.executor = executor;
        this.minDataDays = minDataDays;
        this.maxSelections = maxSelections;
    }

    /**
     * Select at most {@code maxSelections} instruments as of the given date.
     * Equal scores keep the universe order.
     *
     * @return selected candidates, best first; empty if nothing qualifies
     */
    public List<Candidate> select(List<Instrument> universe, Map<String, PriceHistory> histories,
                                  SelectionStrategy strategy, LocalDate date) {
        List<CompletableFuture<Optional<Candidate>>> evaluations = new ArrayList<>(universe.size());
        for (Instrument instrument : universe) {
            PriceHistory history = histories.get(instrument.getCode());
            evaluations.add(CompletableFuture.supplyAsync(
                    () -> evaluate(instrument, history, strategy, date), executor));
        }

        List<Candidate> candidates = new ArrayList<>();
        for (CompletableFuture<Optional<Candidate>> evaluation : evaluations) {
            try {
                evaluation.join().ifPresent(candidates::add);
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Candidate evaluation failed", cause);
            }
        }

        // List.sort is stable, so ties stay in universe order
        candidates.sort(Comparator.comparingDouble(Candidate::getScore).reversed());
        List<Candidate> selected = candidates.size() > maxSelections
                ? new ArrayList<>(candidates.subList(0, maxSelections))
                : candidates;

        log.debug("{} on {}: {} of {} instruments qualified, {} selected",
                strategy.getName(), date, candidates.size(), universe.size(), selected.size());
        return selected;
    }

    private Optional<Candidate> evaluate(Instrument instrument, PriceHistory history,
                                         SelectionStrategy strategy, LocalDate date) {
        if (history == null || history.countUpTo(date) < minDataDays) {
            return Optional.empty();
        }

        Optional<IndicatorSnapshot> computed = indicatorEngine.compute(history, date);
        if (computed.isEmpty()) {
            return Optional.empty();
        }
        IndicatorSnapshot snapshot = computed.get();
        if (!snapshot.hasAll(strategy.requiredIndicators()) || !strategy.qualify(snapshot)) {
            return Optional.empty();
        }

        double score = strategy.score(snapshot);
        if (!Double.isFinite(score)) {
            log.warn("Discarding {} on {}: non-finite score", instrument.getCode(), date);
            return Optional.empty();
        }
        OptionalDouble floor = strategy.minScore();
        if (floor.isPresent() && score < floor.getAsDouble()) {
            return Optional.empty();
        }

        return Optional.of(Candidate.builder()
                .code(instrument.getCode())
                .name(instrument.getName())
                .score(score)
                .price(history.latestClose(date).orElseThrow())
                .indicators(snapshot)
                .build());
    }

    public int getMaxSelections() {
        return maxSelections;
    }
}
