package com.quantbacktest.rebalancer.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for queue workers and per-instrument indicator evaluation.
 */
@Configuration
@EnableConfigurationProperties(SimulationProperties.class)
public class AsyncConfig {

    @Bean(name = "workerExecutorService", destroyMethod = "shutdown")
    public ExecutorService workerExecutorService(SimulationProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkers().getThreadCount(),
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("SimulationWorker-" + thread.getId());
                    thread.setDaemon(false);
                    return thread;
                });
    }

    @Bean(name = "indicatorExecutorService", destroyMethod = "shutdown")
    public ExecutorService indicatorExecutorService(SimulationProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getWorkers().getIndicatorThreads(),
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("Indicator-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }
}
