package com.quantbacktest.rebalancer.controller;

import com.quantbacktest.rebalancer.controller.dto.SimulationRequest;
import com.quantbacktest.rebalancer.controller.dto.SimulationResponse;
import com.quantbacktest.rebalancer.service.SimulationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for simulation jobs.
 */
@RestController
@RequestMapping("/simulations")
@RequiredArgsConstructor
@Slf4j
public class SimulationController {

    private final SimulationService simulationService;

    /**
     * Submit a simulation. Resubmitting an identical request returns the existing job.
     *
     * @param request the simulation request
     * @return the job id and status
     */
    @PostMapping
    public ResponseEntity<SimulationResponse> submitSimulation(@Valid @RequestBody SimulationRequest request) {
        log.info("POST /simulations - Strategy: {}, Period: {} to {}",
                request.getStrategyName(), request.getStartDate(), request.getEndDate());

        SimulationResponse response = simulationService.submitSimulation(request);
        HttpStatus status = Boolean.TRUE.equals(response.getIsExisting()) ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<SimulationResponse> getSimulation(@PathVariable Long jobId) {
        return ResponseEntity.ok(simulationService.getSimulation(jobId));
    }

    @GetMapping("/queue")
    public ResponseEntity<Map<String, Long>> getQueueDepth() {
        return ResponseEntity.ok(Map.of("depth", simulationService.getQueueDepth()));
    }
}
