package com.quantbacktest.rebalancer.infrastructure;

import com.quantbacktest.rebalancer.domain.JobStatus;
import com.quantbacktest.rebalancer.domain.SimulationJob;
import com.quantbacktest.rebalancer.repository.SimulationJobRepository;
import com.quantbacktest.rebalancer.service.SimulationExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background worker that polls the Redis queue and runs simulation jobs.
 * Retried jobs wait 1s, 3s or 5s before running again.
 * While a job runs, its id, strategy and rebalance frequency are on the MDC.
 */
@RequiredArgsConstructor
@Slf4j
public class SimulationWorker implements Runnable {

    private final QueueService queueService;
    private final SimulationJobRepository simulationJobRepository;
    private final SimulationExecutor simulationExecutor;
    private final String workerName;

    private volatile boolean running = true;

    private final AtomicLong runsStarted = new AtomicLong();
    private final AtomicLong jobsSkipped = new AtomicLong();

    private static final long[] BACKOFF_DELAYS = { 1000, 3000, 5000 };

    @Override
    public void run() {
        log.info("{} started and polling queue", workerName);

        while (running) {
            try {
                Long jobId = queueService.pop();

                if (jobId != null) {
                    log.info("{} received job ID: {}", workerName, jobId);
                    processJob(jobId);
                }

            } catch (Exception e) {
                log.error("{} encountered error while polling queue: {}",
                        workerName, e.getMessage(), e);

                // Pause so a persistent Redis outage does not spin
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("{} interrupted during error recovery", workerName);
                    break;
                }
            }
        }

        log.info("{} stopped", workerName);
    }

    /**
     * Process a single job fetched from the queue.
     */
    void processJob(Long jobId) {
        MDC.put("jobId", String.valueOf(jobId));
        MDC.put("worker", workerName);

        try {
            Optional<SimulationJob> jobOptional = simulationJobRepository.findById(jobId);

            if (jobOptional.isEmpty()) {
                log.warn("Job not found in database");
                jobsSkipped.incrementAndGet();
                return;
            }

            SimulationJob job = jobOptional.get();
            String skipReason = skipReason(job.getStatus());
            if (skipReason != null) {
                log.warn("Job is already {}. {}", job.getStatus(), skipReason);
                jobsSkipped.incrementAndGet();
                return;
            }

            MDC.put("strategy", job.getStrategyName());
            MDC.put("frequency", String.valueOf(job.getFrequency()));

            if (job.getRetryCount() > 0) {
                applyBackoff(job);
            }

            log.info("Processing - Period: {} to {}, Capital: {}, Max positions: {}, Status: {}, RetryCount: {}",
                    job.getStartDate(), job.getEndDate(), job.getInitialCapital(),
                    job.getMaxPositions() != null ? job.getMaxPositions() : "default",
                    job.getStatus(), job.getRetryCount());

            runsStarted.incrementAndGet();
            long startedAt = System.currentTimeMillis();
            try {
                simulationExecutor.executeSimulation(job);
            } finally {
                log.info("Run attempt finished in {}ms", System.currentTimeMillis() - startedAt);
            }

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
            log.warn("Processing interrupted");
        } catch (Exception e) {
            // Executor owns retry and failure bookkeeping
            log.error("Failed to process job: {}", e.getMessage(), e);
        } finally {
            MDC.remove("jobId");
            MDC.remove("worker");
            MDC.remove("strategy");
            MDC.remove("frequency");
        }
    }

    private static String skipReason(JobStatus status) {
        return switch (status) {
            case COMPLETED -> "Skipping duplicate processing.";
            case RUNNING -> "Another worker may be processing it.";
            case FAILED -> "Failed jobs are not run again.";
            default -> null;
        };
    }

    private void applyBackoff(SimulationJob job) throws InterruptedException {
        int retryIndex = job.getRetryCount() - 1;
        if (retryIndex >= 0 && retryIndex < BACKOFF_DELAYS.length) {
            long delayMs = BACKOFF_DELAYS[retryIndex];
            log.info("Applying backoff: {}ms before retry {}", delayMs, job.getRetryCount());
            Thread.sleep(delayMs);
        }
    }

    /**
     * Gracefully stop the worker.
     */
    public void stop() {
        log.info("Stopping {}", workerName);
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public String getWorkerName() {
        return workerName;
    }

    /** Jobs handed to the executor, whatever their outcome. */
    public long getRunsStarted() {
        return runsStarted.get();
    }

    /** Queue entries dropped because the job was missing or not runnable. */
    public long getJobsSkipped() {
        return jobsSkipped.get();
    }
}
