package com.quantbacktest.rebalancer.infrastructure;

import com.quantbacktest.rebalancer.config.SimulationProperties;
import com.quantbacktest.rebalancer.repository.SimulationJobRepository;
import com.quantbacktest.rebalancer.service.SimulationExecutor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Manages lifecycle of background workers.
 * Starts workers on application startup and shuts them down gracefully.
 */
@Component
@ConditionalOnProperty(name = "rebalancer.workers.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class WorkerManager {

    @Qualifier("workerExecutorService")
    private final ExecutorService workerExecutorService;
    private final QueueService queueService;
    private final SimulationJobRepository simulationJobRepository;
    private final SimulationExecutor simulationExecutor;
    private final SimulationProperties properties;

    private final List<SimulationWorker> workers = new ArrayList<>();

    @PostConstruct
    public void startWorkers() {
        int workerCount = properties.getWorkers().getThreadCount();
        log.info("Starting {} simulation workers", workerCount);

        for (int i = 0; i < workerCount; i++) {
            String workerName = "SimulationWorker-" + (i + 1);
            SimulationWorker worker = new SimulationWorker(
                    queueService,
                    simulationJobRepository,
                    simulationExecutor,
                    workerName);

            workers.add(worker);
            workerExecutorService.submit(worker);
        }

        log.info("All {} workers started", workerCount);
    }

    @PreDestroy
    public void stopWorkers() {
        log.info("Stopping all workers...");

        workers.forEach(SimulationWorker::stop);
        workerExecutorService.shutdown();
        logWorkerSummary();

        try {
            if (!workerExecutorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Workers did not terminate gracefully, forcing shutdown");
                workerExecutorService.shutdownNow();
            } else {
                log.info("All workers stopped gracefully");
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for workers to stop", e);
            workerExecutorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Total simulation runs started across all workers since startup.
     */
    public long totalRunsStarted() {
        return workers.stream().mapToLong(SimulationWorker::getRunsStarted).sum();
    }

    public List<SimulationWorker> getWorkers() {
        return Collections.unmodifiableList(workers);
    }

    private void logWorkerSummary() {
        for (SimulationWorker worker : workers) {
            log.info("{} - runs started: {}, jobs skipped: {}",
                    worker.getWorkerName(), worker.getRunsStarted(), worker.getJobsSkipped());
        }
        log.info("Workers started {} simulation runs in total", totalRunsStarted());
    }
}
