package com.pharmascope.helix;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * HELIX - research job orchestration for PharmaScope.
 *
 * <p>HELIX provides:
 * <ul>
 *   <li>Job Orchestration - one query fanned out to up to ten research agents concurrently</li>
 *   <li>Resilience - per-agent circuit breakers with cached or estimated fallback data</li>
 *   <li>Aggregation - a single report with coverage ratio and composite status</li>
 *   <li>Polling APIs - job status and report retrieval by job id</li>
 * </ul>
 *
 * <p>Agents cover market data, EXIM trade, patents, clinical trials, internal documents,
 * web intelligence, literature, ML property prediction, generative design and NLP synthesis.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class HelixApplication {

    public static void main(String[] args) {
        SpringApplication.run(HelixApplication.class, args);
    }
}
