package com.quantbacktest.rebalancer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.rebalancer.config.SimulationProperties;
import com.quantbacktest.rebalancer.controller.dto.SimulationRequest;
import com.quantbacktest.rebalancer.controller.dto.SimulationResponse;
import com.quantbacktest.rebalancer.domain.JobStatus;
import com.quantbacktest.rebalancer.domain.SimulationConfigurationException;
import com.quantbacktest.rebalancer.domain.SimulationJob;
import com.quantbacktest.rebalancer.domain.SimulationResult;
import com.quantbacktest.rebalancer.infrastructure.QueueService;
import com.quantbacktest.rebalancer.repository.SimulationJobRepository;
import com.quantbacktest.rebalancer.repository.SimulationResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;

/**
 * Accepts simulation requests, de-duplicates them and hands new jobs to the queue.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimulationServiceImpl implements SimulationService {

    private final SimulationJobRepository simulationJobRepository;
    private final SimulationResultRepository simulationResultRepository;
    private final QueueService queueService;
    private final StrategyFactory strategyFactory;
    private final SimulationMetricsService metricsService;
    private final SimulationProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public SimulationResponse submitSimulation(SimulationRequest request) {
        log.info("Received simulation submission for strategy: {}, period: {} to {}",
                request.getStrategyName(), request.getStartDate(), request.getEndDate());

        if (request.getEndDate().isBefore(request.getStartDate())) {
            throw new SimulationConfigurationException("End date " + request.getEndDate()
                    + " is before start date " + request.getStartDate());
        }
        String parametersJson = toJson(request.getParameters() != null ? request.getParameters() : Map.of());
        // Reject unknown strategies and bad tunables before anything is persisted
        strategyFactory.createStrategy(request.getStrategyName(), parametersJson);

        String idempotencyKey = generateIdempotencyKey(request);
        Optional<SimulationJob> existingJob = simulationJobRepository.findByIdempotencyKey(idempotencyKey);

        if (existingJob.isPresent()) {
            SimulationJob job = existingJob.get();
            log.info("Idempotent request detected for job ID: {} with status: {}", job.getId(), job.getStatus());
            return describe(job, true);
        }

        SimulationJob savedJob = simulationJobRepository.save(SimulationJob.builder()
                .strategyName(request.getStrategyName())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .frequency(request.getFrequency() != null ? request.getFrequency() : properties.getFrequency())
                .initialCapital(request.getInitialCapital())
                .maxPositions(request.getMaxPositions())
                .parametersJson(parametersJson)
                .status(JobStatus.SUBMITTED)
                .idempotencyKey(idempotencyKey)
                .retryCount(0)
                .createdAt(LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build());
        log.info("Created simulation job with ID: {}", savedJob.getId());

        queueService.push(savedJob.getId());
        savedJob.setStatus(JobStatus.QUEUED);
        savedJob.setUpdatedAt(LocalDateTime.now());
        simulationJobRepository.save(savedJob);
        metricsService.recordJobSubmitted();

        return SimulationResponse.builder()
                .jobId(savedJob.getId())
                .status(savedJob.getStatus())
                .message("Job queued successfully")
                .isExisting(false)
                .retryCount(0)
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public SimulationResponse getSimulation(Long jobId) {
        SimulationJob job = simulationJobRepository.findById(jobId)
                .orElseThrow(() -> new SimulationNotFoundException(jobId));
        return describe(job, true);
    }

    @Override
    public long getQueueDepth() {
        return queueService.size();
    }

    private SimulationResponse describe(SimulationJob job, boolean existing) {
        SimulationResponse.SimulationResponseBuilder response = SimulationResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .isExisting(existing)
                .retryCount(job.getRetryCount())
                .failureReason(job.getFailureReason());

        return switch (job.getStatus()) {
            case COMPLETED -> {
                Optional<SimulationResult> result = simulationResultRepository.findByJobId(job.getId());
                if (result.isEmpty()) {
                    log.warn("Job {} marked COMPLETED but no result found", job.getId());
                    yield response.message("Job completed but results not found").build();
                }
                SimulationResult r = result.get();
                yield response.message("Job completed")
                        .finalValue(r.getFinalValue())
                        .totalReturn(r.getTotalReturn())
                        .annualizedReturn(r.getAnnualizedReturn())
                        .maxDrawdown(r.getMaxDrawdown())
                        .winRate(r.getWinRate())
                        .volatility(r.getVolatility())
                        .sharpeRatio(r.getSharpeRatio())
                        .informationRatio(r.getInformationRatio())
                        .maxLosingStreak(r.getMaxLosingStreak())
                        .tradeCount(r.getTradeCount())
                        .ratingScore(r.getRatingScore())
                        .rating(r.getRating())
                        .build();
            }
            case RUNNING -> response.message("Job is currently being processed").build();
            case QUEUED -> response.message("Job is queued and waiting for processing").build();
            case FAILED -> response.message("Job failed after " + job.getRetryCount() + " attempts").build();
            case SUBMITTED -> response.message("Job submitted and awaiting queue placement").build();
        };
    }

    /**
     * SHA-256 of the request payload.
     */
    private String generateIdempotencyKey(SimulationRequest request) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(toJson(request).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SimulationConfigurationException("Request cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }
}
