package com.z254.butterfly.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Scored edge between two specific incident groups. Unique per ordered id pair.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertCorrelation {

    private String primaryAlertId;
    private String relatedAlertId;
    private double score;

    /** Comma separated reason tags, e.g. {@code time_proximity, same_service} */
    private String reason;

    private Instant updatedAt;
}
