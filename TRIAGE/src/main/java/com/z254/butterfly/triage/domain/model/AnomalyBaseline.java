package com.z254.butterfly.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Velocity baseline for one metric of one workspace.
 * Unique per (workspaceId, metricKey).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyBaseline {

    public static final String ALERT_EVENTS_PREFIX = "alert_events:";

    private String workspaceId;

    /** e.g. {@code alert_events:<groupId>} */
    private String metricKey;

    /** Effective mean (seasonal when available, rolling otherwise) */
    private double mean;

    /** Effective standard deviation */
    private double stdDev;

    private Double seasonalMean;
    private Double seasonalStdDev;
    private Integer seasonalHour;

    private int sampleCount;
    private int windowHours;
    private Instant lastUpdated;

    public static String metricKeyForGroup(String groupId) {
        return ALERT_EVENTS_PREFIX + groupId;
    }
}
