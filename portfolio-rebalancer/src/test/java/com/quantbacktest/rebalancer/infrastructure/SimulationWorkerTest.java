package com.quantbacktest.rebalancer.infrastructure;

import com.quantbacktest.rebalancer.domain.JobStatus;
import com.quantbacktest.rebalancer.domain.RebalanceFrequency;
import com.quantbacktest.rebalancer.domain.SimulationJob;
import com.quantbacktest.rebalancer.repository.SimulationJobRepository;
import com.quantbacktest.rebalancer.service.SimulationExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SimulationWorker lifecycle and job processing.
 */
@ExtendWith(MockitoExtension.class)
class SimulationWorkerTest {

    @Mock
    private QueueService queueService;

    @Mock
    private SimulationJobRepository simulationJobRepository;

    @Mock
    private SimulationExecutor simulationExecutor;

    private SimulationWorker worker;

    @BeforeEach
    void setUp() {
        worker = new SimulationWorker(queueService, simulationJobRepository, simulationExecutor, "TestWorker");
    }

    @Test
    void testRun_PollsAndExecutesQueuedJob() throws Exception {
        // Arrange
        Long jobId = 1L;
        SimulationJob job = createJob(jobId, JobStatus.QUEUED, 0);

        when(queueService.pop()).thenReturn(jobId).thenReturn(null);
        when(simulationJobRepository.findById(jobId)).thenReturn(Optional.of(job));

        // Act
        Thread workerThread = new Thread(worker);
        workerThread.start();
        Thread.sleep(200);
        worker.stop();
        workerThread.join(1000);

        // Assert
        verify(queueService, atLeastOnce()).pop();
        verify(simulationExecutor).executeSimulation(job);
        assertFalse(worker.isRunning());
        assertFalse(workerThread.isAlive());
    }

    @Test
    void testRun_QueueErrorDoesNotStopWorker() throws Exception {
        // Arrange
        when(queueService.pop()).thenThrow(new QueueUnavailableException("Redis down", null)).thenReturn(null);

        // Act
        Thread workerThread = new Thread(worker);
        workerThread.start();
        Thread.sleep(1300);
        worker.stop();
        workerThread.join(2000);

        // Assert
        verify(queueService, atLeast(2)).pop();
        verifyNoInteractions(simulationExecutor);
    }

    @Test
    void testProcessJob_SkipsTerminalAndRunningJobs() {
        // Arrange
        when(simulationJobRepository.findById(1L)).thenReturn(Optional.of(createJob(1L, JobStatus.COMPLETED, 0)));
        when(simulationJobRepository.findById(2L)).thenReturn(Optional.of(createJob(2L, JobStatus.RUNNING, 0)));
        when(simulationJobRepository.findById(3L)).thenReturn(Optional.of(createJob(3L, JobStatus.FAILED, 3)));

        // Act
        worker.processJob(1L);
        worker.processJob(2L);
        worker.processJob(3L);

        // Assert
        verify(simulationExecutor, never()).executeSimulation(any());
        assertEquals(3, worker.getJobsSkipped());
        assertEquals(0, worker.getRunsStarted());
    }

    @Test
    void testProcessJob_JobNotFound() {
        when(simulationJobRepository.findById(999L)).thenReturn(Optional.empty());

        worker.processJob(999L);

        verify(simulationExecutor, never()).executeSimulation(any());
        assertEquals(1, worker.getJobsSkipped());
    }

    @Test
    void testProcessJob_RunContextOnMdcWhileExecuting() {
        // Arrange
        SimulationJob job = createJob(7L, JobStatus.QUEUED, 0);
        when(simulationJobRepository.findById(7L)).thenReturn(Optional.of(job));
        Map<String, String> seen = new HashMap<>();
        doAnswer(invocation -> {
            seen.put("jobId", MDC.get("jobId"));
            seen.put("worker", MDC.get("worker"));
            seen.put("strategy", MDC.get("strategy"));
            seen.put("frequency", MDC.get("frequency"));
            return null;
        }).when(simulationExecutor).executeSimulation(job);

        // Act
        worker.processJob(7L);

        // Assert
        assertEquals("7", seen.get("jobId"));
        assertEquals("TestWorker", seen.get("worker"));
        assertEquals("momentum", seen.get("strategy"));
        assertEquals("QUARTERLY", seen.get("frequency"));
        assertNull(MDC.get("strategy"));
        assertNull(MDC.get("frequency"));
        assertEquals(1, worker.getRunsStarted());
        assertEquals(0, worker.getJobsSkipped());
    }

    @Test
    void testProcessJob_RetryWaitsForBackoff() {
        // Arrange
        SimulationJob job = createJob(1L, JobStatus.QUEUED, 1);
        when(simulationJobRepository.findById(1L)).thenReturn(Optional.of(job));

        // Act
        long startTime = System.currentTimeMillis();
        worker.processJob(1L);
        long elapsed = System.currentTimeMillis() - startTime;

        // Assert
        assertTrue(elapsed >= 1000, "first retry waits at least one second, waited " + elapsed);
        verify(simulationExecutor).executeSimulation(job);
    }

    @Test
    void testProcessJob_ExecutorFailureIsContainedAndMdcCleared() {
        // Arrange
        SimulationJob job = createJob(1L, JobStatus.QUEUED, 0);
        when(simulationJobRepository.findById(1L)).thenReturn(Optional.of(job));
        doThrow(new IllegalStateException("boom")).when(simulationExecutor).executeSimulation(job);

        // Act
        assertDoesNotThrow(() -> worker.processJob(1L));

        // Assert
        assertNull(MDC.get("jobId"));
        assertNull(MDC.get("worker"));
        assertNull(MDC.get("strategy"));
        assertTrue(worker.isRunning());
        assertEquals(1, worker.getRunsStarted());
    }

    private SimulationJob createJob(Long id, JobStatus status, int retryCount) {
        return SimulationJob.builder()
                .id(id)
                .strategyName("momentum")
                .startDate(LocalDate.of(2021, 1, 1))
                .endDate(LocalDate.of(2023, 12, 31))
                .frequency(RebalanceFrequency.QUARTERLY)
                .initialCapital(new BigDecimal("1000000"))
                .status(status)
                .retryCount(retryCount)
                .idempotencyKey("key-" + id)
                .build();
    }
}
