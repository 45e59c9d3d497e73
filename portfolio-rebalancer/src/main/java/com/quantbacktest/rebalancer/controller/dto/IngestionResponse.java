package com.quantbacktest.rebalancer.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a CSV upload.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionResponse {

    private String target;
    private int inserted;
    private int skipped;
    private long total;
}
