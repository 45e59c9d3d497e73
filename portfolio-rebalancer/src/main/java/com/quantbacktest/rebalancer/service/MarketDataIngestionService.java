package com.quantbacktest.rebalancer.service;

import com.quantbacktest.rebalancer.controller.dto.IngestionResponse;
import com.quantbacktest.rebalancer.domain.HistoricalMarketData;
import com.quantbacktest.rebalancer.domain.Instrument;
import com.quantbacktest.rebalancer.repository.HistoricalMarketDataRepository;
import com.quantbacktest.rebalancer.repository.InstrumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Loads instruments and daily bars from CSV text into the database.
 * Unparseable lines are logged and skipped; bars already stored are left untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataIngestionService {

    private static final int BATCH_SIZE = 1000;

    private static final DateTimeFormatter[] DATE_FORMATTERS = {
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yyyy"),
            DateTimeFormatter.BASIC_ISO_DATE
    };

    private final HistoricalMarketDataRepository historicalMarketDataRepository;
    private final InstrumentRepository instrumentRepository;

    /**
     * Ingest {@code date,open,high,low,close,volume} rows for one instrument.
     * An instrument not yet registered is created with its code as name.
     */
    @Transactional
    public IngestionResponse ingestBars(String code, String csvContent) {
        String instrumentCode = code.trim();
        log.info("Starting bar ingestion for {}", instrumentCode);

        if (!instrumentRepository.existsById(instrumentCode)) {
            instrumentRepository.save(Instrument.builder().code(instrumentCode).name(instrumentCode).build());
            log.info("Registered new instrument {}", instrumentCode);
        }

        List<HistoricalMarketData> batch = new ArrayList<>();
        Set<LocalDate> seen = new HashSet<>();
        int inserted = 0;
        int skipped = 0;

        for (String line : dataLines(csvContent)) {
            HistoricalMarketData bar = parseBar(instrumentCode, line);
            if (bar == null) {
                skipped++;
                continue;
            }
            if (!seen.add(bar.getDate()) || historicalMarketDataRepository.existsByCodeAndDate(instrumentCode, bar.getDate())) {
                log.debug("Skipping duplicate bar {} {}", instrumentCode, bar.getDate());
                skipped++;
                continue;
            }

            batch.add(bar);
            if (batch.size() >= BATCH_SIZE) {
                historicalMarketDataRepository.saveAll(batch);
                inserted += batch.size();
                log.info("Batch inserted {} bars for {}", batch.size(), instrumentCode);
                batch.clear();
            }
        }
        if (!batch.isEmpty()) {
            historicalMarketDataRepository.saveAll(batch);
            inserted += batch.size();
        }

        long total = historicalMarketDataRepository.countByCode(instrumentCode);
        log.info("Bar ingestion completed for {}: {} inserted, {} skipped, {} stored", instrumentCode, inserted, skipped, total);
        return IngestionResponse.builder()
                .target(instrumentCode)
                .inserted(inserted)
                .skipped(skipped)
                .total(total)
                .build();
    }

    /**
     * Upsert {@code code,name[,market[,industry]]} rows.
     */
    @Transactional
    public IngestionResponse ingestInstruments(String csvContent) {
        int saved = 0;
        int skipped = 0;

        for (String line : dataLines(csvContent)) {
            String[] parts = line.split(",", -1);
            if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) {
                log.warn("Invalid instrument line (expected code,name[,market[,industry]]): {}", line);
                skipped++;
                continue;
            }
            instrumentRepository.save(Instrument.builder()
                    .code(parts[0].trim())
                    .name(parts[1].trim())
                    .market(parts.length > 2 && !parts[2].isBlank() ? parts[2].trim() : null)
                    .industry(parts.length > 3 && !parts[3].isBlank() ? parts[3].trim() : null)
                    .build());
            saved++;
        }

        long total = instrumentRepository.count();
        log.info("Instrument ingestion completed: {} saved, {} skipped, {} registered", saved, skipped, total);
        return IngestionResponse.builder()
                .target("instruments")
                .inserted(saved)
                .skipped(skipped)
                .total(total)
                .build();
    }

    /**
     * Non-blank lines, without a leading header row.
     */
    private static List<String> dataLines(String csvContent) {
        List<String> lines = new ArrayList<>();
        if (csvContent == null) {
            return lines;
        }
        boolean first = true;
        for (String raw : csvContent.split("\\r?\\n")) {
            String line = raw.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (first) {
                first = false;
                String lower = line.toLowerCase(Locale.ROOT);
                if (lower.startsWith("date") || lower.startsWith("code")) {
                    continue;
                }
            }
            lines.add(line);
        }
        return lines;
    }

    private HistoricalMarketData parseBar(String code, String line) {
        String[] parts = line.split(",");
        if (parts.length < 6) {
            log.warn("Invalid CSV line format (expected 6 columns): {}", line);
            return null;
        }

        try {
            return HistoricalMarketData.builder()
                    .code(code)
                    .date(parseDate(parts[0].trim()))
                    .open(new BigDecimal(parts[1].trim()))
                    .high(new BigDecimal(parts[2].trim()))
                    .low(new BigDecimal(parts[3].trim()))
                    .close(new BigDecimal(parts[4].trim()))
                    .volume(new BigDecimal(parts[5].trim()).longValue())
                    .build();
        } catch (IllegalArgumentException | DateTimeParseException e) {
            log.warn("Failed to parse values from line: {} - {}", line, e.getMessage());
            return null;
        }
    }

    static LocalDate parseDate(String text) {
        DateTimeParseException failure = null;
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(text, formatter);
            } catch (DateTimeParseException e) {
                failure = e;
            }
        }
        throw new DateTimeParseException("Unable to parse date: " + text, text, 0, failure);
    }
}
