package com.quantbacktest.rebalancer.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Per-instrument data quality findings for the active universe.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DataQualityReport {

    private int minDataDays;
    private int instrumentCount;
    private int usableCount;
    private List<InstrumentQuality> instruments;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class InstrumentQuality {
        private String code;
        private String name;
        private int barCount;
        private LocalDate firstDate;
        private LocalDate lastDate;
        private List<String> issues;
    }
}
