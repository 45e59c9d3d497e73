package com.quantbacktest.rebalancer.service;

import com.quantbacktest.rebalancer.config.SimulationProperties;
import com.quantbacktest.rebalancer.controller.dto.DataQualityReport;
import com.quantbacktest.rebalancer.domain.HistoricalMarketData;
import com.quantbacktest.rebalancer.domain.Instrument;
import com.quantbacktest.rebalancer.domain.PriceBar;
import com.quantbacktest.rebalancer.repository.HistoricalMarketDataRepository;
import com.quantbacktest.rebalancer.repository.InstrumentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MarketDataServiceTest {

    @Mock
    private InstrumentRepository instrumentRepository;

    @Mock
    private HistoricalMarketDataRepository historicalMarketDataRepository;

    private MarketDataService marketDataService;

    @BeforeEach
    void setUp() {
        SimulationProperties properties = new SimulationProperties();
        properties.setMinDataDays(3);
        marketDataService = new MarketDataService(instrumentRepository, historicalMarketDataRepository, properties);
    }

    private static List<HistoricalMarketData> bars(String code, String... closes) {
        List<HistoricalMarketData> bars = new ArrayList<>();
        LocalDate date = LocalDate.of(2023, 1, 2);
        for (String close : closes) {
            BigDecimal price = new BigDecimal(close);
            bars.add(HistoricalMarketData.builder()
                    .code(code).date(date).open(price).high(price).low(price).close(price).volume(1000L)
                    .build());
            date = date.plusDays(1);
        }
        return bars;
    }

    @Test
    void testGetPriceHistory_MapsEntitiesToBars() {
        when(historicalMarketDataRepository.findByCodeOrderByDateAsc("600000")).thenReturn(bars("600000", "10.5", "10.7"));

        List<PriceBar> history = marketDataService.getPriceHistory("600000");

        assertEquals(2, history.size());
        assertEquals(LocalDate.of(2023, 1, 3), history.get(1).getDate());
        assertEquals(0, new BigDecimal("10.7").compareTo(history.get(1).getClose()));
    }

    @Test
    void testCheckDataQuality() {
        // Arrange
        when(instrumentRepository.findByActiveTrueOrderByCodeAsc()).thenReturn(List.of(
                Instrument.builder().code("000001").name("Good").build(),
                Instrument.builder().code("000002").name("Short").build(),
                Instrument.builder().code("000003").name("Empty").build(),
                Instrument.builder().code("000004").name("Corrupt").build()));
        when(historicalMarketDataRepository.findByCodeOrderByDateAsc("000001")).thenReturn(bars("000001", "1", "2", "3"));
        when(historicalMarketDataRepository.findByCodeOrderByDateAsc("000002")).thenReturn(bars("000002", "1"));
        when(historicalMarketDataRepository.findByCodeOrderByDateAsc("000003")).thenReturn(List.of());
        when(historicalMarketDataRepository.findByCodeOrderByDateAsc("000004")).thenReturn(bars("000004", "1", "0", "2"));

        // Act
        DataQualityReport report = marketDataService.checkDataQuality();

        // Assert
        assertEquals(4, report.getInstrumentCount());
        assertEquals(1, report.getUsableCount());
        assertTrue(report.getInstruments().get(0).getIssues().isEmpty());
        assertEquals(List.of("only 1 bars, need 3"), report.getInstruments().get(1).getIssues());
        assertEquals(List.of("no price history"), report.getInstruments().get(2).getIssues());
        assertNull(report.getInstruments().get(2).getFirstDate());
        assertEquals(List.of("1 non-positive closes"), report.getInstruments().get(3).getIssues());
    }
}
