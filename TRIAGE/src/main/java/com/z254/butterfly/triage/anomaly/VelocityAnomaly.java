package com.z254.butterfly.triage.anomaly;

import com.z254.butterfly.triage.domain.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A group whose most recent hour stands out against its baseline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VelocityAnomaly {

    private String alertGroupId;
    private String title;
    private Severity severity;

    /** Events in the most recent hour */
    private double currentVelocity;

    /** Baseline mean events per hour */
    private double baselineVelocity;

    private double percentageIncrease;
    private double zScore;
    private boolean seasonalBaseline;
    private Instant detectedAt;

    /** Synthetic velocity group, set once the anomaly has been recorded */
    private String syntheticGroupId;
}
