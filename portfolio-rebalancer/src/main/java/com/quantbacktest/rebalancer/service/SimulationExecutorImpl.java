package com.quantbacktest.rebalancer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.rebalancer.config.SimulationProperties;
import com.quantbacktest.rebalancer.domain.BacktestEngine;
import com.quantbacktest.rebalancer.domain.JobStatus;
import com.quantbacktest.rebalancer.domain.MarketDataProvider;
import com.quantbacktest.rebalancer.domain.PerformanceMetrics;
import com.quantbacktest.rebalancer.domain.PerformanceReport;
import com.quantbacktest.rebalancer.domain.SimulationConfig;
import com.quantbacktest.rebalancer.domain.SimulationConfigurationException;
import com.quantbacktest.rebalancer.domain.SimulationJob;
import com.quantbacktest.rebalancer.domain.SimulationResult;
import com.quantbacktest.rebalancer.domain.SimulationRun;
import com.quantbacktest.rebalancer.domain.strategy.SelectionStrategy;
import com.quantbacktest.rebalancer.infrastructure.QueueService;
import com.quantbacktest.rebalancer.repository.SimulationJobRepository;
import com.quantbacktest.rebalancer.repository.SimulationResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.concurrent.ExecutorService;

/**
 * Runs simulation jobs taken from the queue.
 * Configuration errors fail the job at once; other failures are retried up to
 * {@value #MAX_RETRY_COUNT} times before the job is dead-lettered as FAILED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimulationExecutorImpl implements SimulationExecutor {

    static final int MAX_RETRY_COUNT = 3;
    private static final int MAX_REASON_LENGTH = 1000;

    private final SimulationJobRepository simulationJobRepository;
    private final SimulationResultRepository simulationResultRepository;
    private final QueueService queueService;
    private final MarketDataProvider marketDataProvider;
    private final StrategyFactory strategyFactory;
    private final SimulationProperties properties;
    private final SimulationMetricsService metricsService;
    private final ObjectMapper objectMapper;

    @Qualifier("indicatorExecutorService")
    private final ExecutorService indicatorExecutorService;

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public void executeSimulation(SimulationJob job) {
        if (job == null || job.getId() == null) {
            log.error("Invalid job: job or job ID is null");
            return;
        }

        boolean ownsMdc = MDC.get("jobId") == null;
        if (ownsMdc) {
            MDC.put("jobId", String.valueOf(job.getId()));
        }
        try {
            executeInternal(job);
        } finally {
            if (ownsMdc) {
                MDC.remove("jobId");
            }
        }
    }

    private void executeInternal(SimulationJob job) {
        long startTime = System.currentTimeMillis();

        try {
            // Row lock so two workers holding the same id cannot both start it
            SimulationJob lockedJob = simulationJobRepository.findByIdForUpdate(job.getId())
                    .orElseThrow(() -> new IllegalStateException("Job not found: " + job.getId()));

            if (lockedJob.getStatus() == JobStatus.COMPLETED || lockedJob.getStatus() == JobStatus.RUNNING) {
                log.warn("Already {}. Skipping duplicate execution.", lockedJob.getStatus());
                return;
            }

            lockedJob.setStatus(JobStatus.RUNNING);
            lockedJob.setUpdatedAt(LocalDateTime.now());
            simulationJobRepository.save(lockedJob);
            log.info("Status changed to RUNNING (attempt {})", lockedJob.getRetryCount() + 1);

            SimulationRun run = runSimulation(lockedJob);
            PerformanceReport report = PerformanceMetrics.calculate(
                    run, properties.getRiskFreeRate(), properties.getBenchmarkReturn());
            long executionTimeMs = System.currentTimeMillis() - startTime;

            simulationResultRepository.save(toResult(lockedJob, run, report, executionTimeMs));

            lockedJob.setStatus(JobStatus.COMPLETED);
            lockedJob.setFailureReason(null);
            lockedJob.setUpdatedAt(LocalDateTime.now());
            simulationJobRepository.save(lockedJob);

            log.info("Status changed to COMPLETED in {} ms - total return {}, sharpe {}, rating {}",
                    executionTimeMs, report.getTotalReturn(), report.getSharpeRatio(), report.getRating());
            metricsService.recordJobCompleted(executionTimeMs, report.getTradeCount());

        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent modification detected. Job may have been processed by another worker.");
        } catch (SimulationConfigurationException e) {
            log.error("Configuration error, not retrying: {}", e.getMessage());
            markFailed(job, e);
        } catch (RuntimeException e) {
            log.error("Error during execution: {}", e.getMessage(), e);
            handleFailure(job, e);
        }
    }

    /**
     * Build the run configuration from defaults plus job overrides, then simulate.
     */
    SimulationRun runSimulation(SimulationJob job) {
        SimulationConfig.SimulationConfigBuilder config = properties.toSimulationConfig().toBuilder()
                .initialCapital(job.getInitialCapital());
        if (job.getMaxPositions() != null) {
            config.maxPositions(job.getMaxPositions());
        }

        SelectionStrategy strategy = strategyFactory.createStrategy(job.getStrategyName(), job.getParametersJson());
        log.info("Running {} from {} to {} ({})", strategy.getName(), job.getStartDate(), job.getEndDate(),
                job.getFrequency());

        BacktestEngine engine = new BacktestEngine(config.build(), marketDataProvider, indicatorExecutorService);
        return engine.run(job.getStartDate(), job.getEndDate(), job.getFrequency(), strategy);
    }

    private SimulationResult toResult(SimulationJob job, SimulationRun run, PerformanceReport report,
                                      long executionTimeMs) {
        try {
            return SimulationResult.builder()
                    .job(job)
                    .finalValue(report.getFinalValue())
                    .totalReturn(report.getTotalReturn())
                    .annualizedReturn(report.getAnnualizedReturn())
                    .maxDrawdown(report.getMaxDrawdown())
                    .winRate(report.getWinRate())
                    .volatility(report.getVolatility())
                    .sharpeRatio(report.getSharpeRatio())
                    .informationRatio(report.getInformationRatio())
                    .maxLosingStreak(report.getMaxLosingStreak())
                    .tradeCount(report.getTradeCount())
                    .transactionCosts(report.getTotalTransactionCosts())
                    .ratingScore(report.getRatingScore())
                    .rating(report.getRating())
                    .executionTimeMs(executionTimeMs)
                    .reportJson(objectMapper.writeValueAsString(report))
                    .snapshotsJson(objectMapper.writeValueAsString(run.getSnapshots()))
                    .tradesJson(objectMapper.writeValueAsString(run.getTrades()))
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize simulation result", e);
        }
    }

    /**
     * Record the failure and requeue, or dead-letter once retries are exhausted.
     */
    private void handleFailure(SimulationJob job, Exception error) {
        SimulationJob lockedJob = simulationJobRepository.findByIdForUpdate(job.getId()).orElse(job);
        lockedJob.setRetryCount(lockedJob.getRetryCount() + 1);
        lockedJob.setFailureReason(reason(error));
        lockedJob.setUpdatedAt(LocalDateTime.now());

        if (lockedJob.getRetryCount() >= MAX_RETRY_COUNT) {
            log.error("Failed permanently after {} attempts: {}", lockedJob.getRetryCount(), lockedJob.getFailureReason());
            lockedJob.setStatus(JobStatus.FAILED);
            simulationJobRepository.save(lockedJob);
            metricsService.recordJobFailed();
            return;
        }

        log.warn("Failed (attempt {}/{}): {}. Requeuing for retry...",
                lockedJob.getRetryCount(), MAX_RETRY_COUNT, lockedJob.getFailureReason());
        lockedJob.setStatus(JobStatus.QUEUED);
        simulationJobRepository.save(lockedJob);

        try {
            queueService.push(lockedJob.getId());
            metricsService.recordJobRetried();
        } catch (RuntimeException queueError) {
            log.error("Failed to requeue job: {}", queueError.getMessage());
            lockedJob.setStatus(JobStatus.FAILED);
            simulationJobRepository.save(lockedJob);
            metricsService.recordJobFailed();
        }
    }

    private void markFailed(SimulationJob job, Exception error) {
        SimulationJob lockedJob = simulationJobRepository.findByIdForUpdate(job.getId()).orElse(job);
        lockedJob.setStatus(JobStatus.FAILED);
        lockedJob.setFailureReason(reason(error));
        lockedJob.setUpdatedAt(LocalDateTime.now());
        simulationJobRepository.save(lockedJob);
        metricsService.recordJobFailed();
    }

    private static String reason(Exception error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return message.length() > MAX_REASON_LENGTH ? message.substring(0, MAX_REASON_LENGTH - 3) + "..." : message;
    }
}
