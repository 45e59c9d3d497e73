package com.quantbacktest.rebalancer.service;

import com.quantbacktest.rebalancer.controller.dto.IngestionResponse;
import com.quantbacktest.rebalancer.domain.HistoricalMarketData;
import com.quantbacktest.rebalancer.domain.Instrument;
import com.quantbacktest.rebalancer.repository.HistoricalMarketDataRepository;
import com.quantbacktest.rebalancer.repository.InstrumentRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MarketDataIngestionServiceTest {

    @Mock
    private HistoricalMarketDataRepository historicalMarketDataRepository;

    @Mock
    private InstrumentRepository instrumentRepository;

    @InjectMocks
    private MarketDataIngestionService ingestionService;

    @Test
    void testParseDate_SupportedFormats() {
        LocalDate expected = LocalDate.of(2023, 1, 5);

        assertEquals(expected, MarketDataIngestionService.parseDate("2023-01-05"));
        assertEquals(expected, MarketDataIngestionService.parseDate("01/05/2023"));
        assertEquals(expected, MarketDataIngestionService.parseDate("1/5/2023"));
        assertEquals(expected, MarketDataIngestionService.parseDate("20230105"));
        assertThrows(DateTimeParseException.class, () -> MarketDataIngestionService.parseDate("5 Jan 2023"));
    }

    @SuppressWarnings("unchecked")
    @Test
    void testIngestBars_SkipsHeaderInvalidAndDuplicateLines() {
        // Arrange
        String csv = "date,open,high,low,close,volume\n"
                + "2023-01-03,10.00,10.50,9.90,10.20,120000\n"
                + "2023-01-04,10.20,10.60,10.10,10.40,98000\n"
                + "2023-01-04,10.20,10.60,10.10,10.40,98000\n"
                + "2023-01-05,not-a-number,10.60,10.10,10.40,98000\n"
                + "2023-01-06,10.40,10.70\n"
                + "\n"
                + "2023-01-09,10.40,10.80,10.30,10.70,105000\n";
        when(instrumentRepository.existsById("600000")).thenReturn(true);
        when(historicalMarketDataRepository.existsByCodeAndDate(eq("600000"), any(LocalDate.class)))
                .thenAnswer(invocation -> LocalDate.of(2023, 1, 9).equals(invocation.getArgument(1)));
        when(historicalMarketDataRepository.countByCode("600000")).thenReturn(3L);

        // Act
        IngestionResponse response = ingestionService.ingestBars("600000", csv);

        // Assert
        assertEquals("600000", response.getTarget());
        assertEquals(2, response.getInserted());
        assertEquals(4, response.getSkipped());
        assertEquals(3L, response.getTotal());

        ArgumentCaptor<List<HistoricalMarketData>> captor = ArgumentCaptor.forClass(List.class);
        verify(historicalMarketDataRepository).saveAll(captor.capture());
        List<HistoricalMarketData> saved = captor.getValue();
        assertEquals(LocalDate.of(2023, 1, 3), saved.get(0).getDate());
        assertEquals(0, new BigDecimal("10.20").compareTo(saved.get(0).getClose()));
        assertEquals(120000L, saved.get(0).getVolume());
        verify(instrumentRepository, never()).save(any());
    }

    @Test
    void testIngestBars_RegistersUnknownInstrument() {
        when(instrumentRepository.existsById("000001")).thenReturn(false);
        when(historicalMarketDataRepository.countByCode("000001")).thenReturn(1L);

        ingestionService.ingestBars(" 000001 ", "2023-01-03,10,11,9,10.5,1000\n");

        ArgumentCaptor<Instrument> captor = ArgumentCaptor.forClass(Instrument.class);
        verify(instrumentRepository).save(captor.capture());
        assertEquals("000001", captor.getValue().getCode());
        assertTrue(captor.getValue().isActive());
    }

    @Test
    void testIngestInstruments() {
        String csv = "code,name,market,industry\n"
                + "600000,Pudong Bank,SH,Banking\n"
                + "000001,Ping An Bank,,\n"
                + ",Missing code\n";
        when(instrumentRepository.count()).thenReturn(2L);

        IngestionResponse response = ingestionService.ingestInstruments(csv);

        assertEquals("instruments", response.getTarget());
        assertEquals(2, response.getInserted());
        assertEquals(1, response.getSkipped());

        ArgumentCaptor<Instrument> captor = ArgumentCaptor.forClass(Instrument.class);
        verify(instrumentRepository, times(2)).save(captor.capture());
        assertEquals("Banking", captor.getAllValues().get(0).getIndustry());
        assertNull(captor.getAllValues().get(1).getMarket());
    }
}
