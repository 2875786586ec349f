package com.z254.butterfly.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Directional association "source group key tends to be followed by target group key".
 * Unique per (workspaceId, sourceGroupKey, targetGroupKey).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationRule {

    private String workspaceId;
    private String sourceGroupKey;
    private String targetGroupKey;

    /** P(target follows | source occurred), 0.0 to 1.0 */
    private double confidence;

    private Instant lastUpdatedAt;

    public boolean involves(String groupKey) {
        return groupKey.equals(sourceGroupKey) || groupKey.equals(targetGroupKey);
    }

    public String counterpartOf(String groupKey) {
        return groupKey.equals(sourceGroupKey) ? targetGroupKey : sourceGroupKey;
    }
}
