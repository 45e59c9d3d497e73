package com.quantbacktest.rebalancer.infrastructure;

import com.quantbacktest.rebalancer.config.SimulationProperties;
import com.quantbacktest.rebalancer.repository.SimulationJobRepository;
import com.quantbacktest.rebalancer.service.SimulationExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for worker startup and shutdown.
 */
@ExtendWith(MockitoExtension.class)
class WorkerManagerTest {

    @Mock
    private ExecutorService workerExecutorService;

    @Mock
    private QueueService queueService;

    @Mock
    private SimulationJobRepository simulationJobRepository;

    @Mock
    private SimulationExecutor simulationExecutor;

    private WorkerManager workerManager;

    @BeforeEach
    void setUp() {
        SimulationProperties properties = new SimulationProperties();
        properties.getWorkers().setThreadCount(2);
        workerManager = new WorkerManager(workerExecutorService, queueService, simulationJobRepository,
                simulationExecutor, properties);
    }

    @Test
    void testStartWorkers_SubmitsOneWorkerPerThread() {
        // Act
        workerManager.startWorkers();

        // Assert
        verify(workerExecutorService, times(2)).submit(any(Runnable.class));
        assertEquals(2, workerManager.getWorkers().size());
        assertEquals("SimulationWorker-1", workerManager.getWorkers().get(0).getWorkerName());
        assertEquals(0, workerManager.totalRunsStarted());
    }

    @Test
    void testStopWorkers_StopsEveryWorkerAndShutsDownPool() throws Exception {
        // Arrange
        when(workerExecutorService.awaitTermination(anyLong(), eq(TimeUnit.SECONDS))).thenReturn(true);
        workerManager.startWorkers();

        // Act
        workerManager.stopWorkers();

        // Assert
        workerManager.getWorkers().forEach(worker -> assertFalse(worker.isRunning()));
        verify(workerExecutorService).shutdown();
        verify(workerExecutorService, never()).shutdownNow();
    }

    @Test
    void testStopWorkers_ForcesShutdownWhenWorkersHang() throws Exception {
        // Arrange
        when(workerExecutorService.awaitTermination(anyLong(), eq(TimeUnit.SECONDS))).thenReturn(false);
        workerManager.startWorkers();

        // Act
        workerManager.stopWorkers();

        // Assert
        verify(workerExecutorService).shutdownNow();
    }
}
