package com.z254.butterfly.triage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * TRIAGE - Alert Grouping and Correlation Engine for the BUTTERFLY Ecosystem.
 *
 * <p>TRIAGE provides:
 * <ul>
 *   <li>Grouping - Deduplicates raw alerts into incident groups by key hash</li>
 *   <li>Velocity Anomalies - Spike escalation and baseline z-score scans</li>
 *   <li>Correlation - Pair mining of co-occurring groups and real-time scoring</li>
 * </ul>
 *
 * <p>Group changes and audit facts are published to Kafka for the notification and UI layers.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class TriageApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriageApplication.class, args);
    }
}
