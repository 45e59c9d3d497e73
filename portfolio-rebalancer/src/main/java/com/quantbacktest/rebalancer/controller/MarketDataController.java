package com.quantbacktest.rebalancer.controller;

import com.quantbacktest.rebalancer.controller.dto.DataQualityReport;
import com.quantbacktest.rebalancer.controller.dto.IngestionResponse;
import com.quantbacktest.rebalancer.service.MarketDataIngestionService;
import com.quantbacktest.rebalancer.service.MarketDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for loading instruments and bars, and for checking data quality.
 */
@RestController
@RequestMapping("/market-data")
@RequiredArgsConstructor
@Slf4j
public class MarketDataController {

    private final MarketDataIngestionService ingestionService;
    private final MarketDataService marketDataService;

    /**
     * Upload daily bars as {@code date,open,high,low,close,volume} CSV.
     */
    @PostMapping(value = "/{code}/bars", consumes = { "text/csv", MediaType.TEXT_PLAIN_VALUE })
    public ResponseEntity<IngestionResponse> uploadBars(@PathVariable String code, @RequestBody String csv) {
        log.info("POST /market-data/{}/bars - {} chars", code, csv.length());
        return ResponseEntity.ok(ingestionService.ingestBars(code, csv));
    }

    /**
     * Upload instruments as {@code code,name[,market[,industry]]} CSV.
     */
    @PostMapping(value = "/instruments", consumes = { "text/csv", MediaType.TEXT_PLAIN_VALUE })
    public ResponseEntity<IngestionResponse> uploadInstruments(@RequestBody String csv) {
        log.info("POST /market-data/instruments - {} chars", csv.length());
        return ResponseEntity.ok(ingestionService.ingestInstruments(csv));
    }

    @GetMapping("/quality")
    public ResponseEntity<DataQualityReport> getDataQuality() {
        return ResponseEntity.ok(marketDataService.checkDataQuality());
    }
}
