package com.microsoft.capacityadvisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * App Service Plan Capacity Advisor
 *
 * Recommends capacity and SKU changes for under-utilized plans from their
 * utilization history, under a configurable risk strategy. Runs as a REST
 * service and, when a snapshot file is configured, as a one-shot batch job.
 */
@SpringBootApplication
public class CapacityAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CapacityAdvisorApplication.class, args);
    }
}
