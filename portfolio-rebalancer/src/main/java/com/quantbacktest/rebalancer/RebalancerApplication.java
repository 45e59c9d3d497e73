package com.quantbacktest.rebalancer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the portfolio rebalancing simulator.
 * Serves the REST API and runs queued simulations on internal background workers.
 */
@SpringBootApplication
public class RebalancerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RebalancerApplication.class, args);
    }

}
