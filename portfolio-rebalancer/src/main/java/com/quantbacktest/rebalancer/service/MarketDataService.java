package com.quantbacktest.rebalancer.service;

import com.quantbacktest.rebalancer.config.SimulationProperties;
import com.quantbacktest.rebalancer.controller.dto.DataQualityReport;
import com.quantbacktest.rebalancer.domain.HistoricalMarketData;
import com.quantbacktest.rebalancer.domain.Instrument;
import com.quantbacktest.rebalancer.domain.MarketDataProvider;
import com.quantbacktest.rebalancer.domain.PriceBar;
import com.quantbacktest.rebalancer.repository.HistoricalMarketDataRepository;
import com.quantbacktest.rebalancer.repository.InstrumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Database-backed market data: the active instrument universe and daily bars.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataService implements MarketDataProvider {

    private final InstrumentRepository instrumentRepository;
    private final HistoricalMarketDataRepository historicalMarketDataRepository;
    private final SimulationProperties properties;

    @Override
    @Transactional(readOnly = true)
    public List<Instrument> getUniverse() {
        List<Instrument> universe = instrumentRepository.findByActiveTrueOrderByCodeAsc();
        log.info("Loaded universe of {} instruments", universe.size());
        return universe;
    }

    @Override
    @Transactional(readOnly = true)
    public List<PriceBar> getPriceHistory(String code) {
        List<PriceBar> bars = historicalMarketDataRepository.findByCodeOrderByDateAsc(code).stream()
                .map(HistoricalMarketData::toPriceBar)
                .collect(Collectors.toList());
        log.debug("Loaded {} bars for {}", bars.size(), code);
        return bars;
    }

    /**
     * Check every active instrument for missing, short or corrupt history.
     */
    @Transactional(readOnly = true)
    public DataQualityReport checkDataQuality() {
        int minDataDays = properties.getMinDataDays();
        List<DataQualityReport.InstrumentQuality> entries = new ArrayList<>();
        int usable = 0;

        for (Instrument instrument : instrumentRepository.findByActiveTrueOrderByCodeAsc()) {
            List<HistoricalMarketData> bars = historicalMarketDataRepository.findByCodeOrderByDateAsc(instrument.getCode());
            List<String> issues = new ArrayList<>();

            if (bars.isEmpty()) {
                issues.add("no price history");
            } else if (bars.size() < minDataDays) {
                issues.add("only " + bars.size() + " bars, need " + minDataDays);
            }
            long nonPositive = bars.stream().filter(bar -> bar.getClose().signum() <= 0).count();
            if (nonPositive > 0) {
                issues.add(nonPositive + " non-positive closes");
            }
            if (issues.isEmpty()) {
                usable++;
            }

            entries.add(DataQualityReport.InstrumentQuality.builder()
                    .code(instrument.getCode())
                    .name(instrument.getName())
                    .barCount(bars.size())
                    .firstDate(bars.isEmpty() ? null : bars.get(0).getDate())
                    .lastDate(bars.isEmpty() ? null : bars.get(bars.size() - 1).getDate())
                    .issues(issues)
                    .build());
        }

        log.info("Data quality check: {} of {} instruments usable", usable, entries.size());
        return DataQualityReport.builder()
                .minDataDays(minDataDays)
                .instrumentCount(entries.size())
                .usableCount(usable)
                .instruments(entries)
                .build();
    }
}
