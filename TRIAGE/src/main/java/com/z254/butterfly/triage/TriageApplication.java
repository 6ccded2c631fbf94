package com.z254.butterfly.triage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * TRIAGE - Alert Correlation Engine for the BUTTERFLY Ecosystem.
 *
 * <p>TRIAGE provides:
 * <ul>
 *   <li>Correlation - Clustering of detector alerts into time-bounded incident groups</li>
 *   <li>Root Cause Analysis - Heuristic causal ranking of group members</li>
 *   <li>Suppression - Optional dropping of redundant alerts</li>
 * </ul>
 *
 * <p>TRIAGE integrates with:
 * <ul>
 *   <li>Detectors - Consumes alerts via Kafka</li>
 *   <li>AURORA and notification routing - Read published group summaries</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class TriageApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriageApplication.class, args);
    }
}
