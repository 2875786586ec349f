package com.z254.butterfly.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Deduplicated incident group: every alert sharing a group key inside the grouping
 * window lands on the same group.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class IncidentGroup {

    /** Unique group identifier */
    private String id;

    /** Tenant partition */
    private String workspaceId;

    /** Deduplication key, see {@code GroupKeyHasher} */
    private String groupKey;

    private String title;
    private String project;
    private String environment;

    @Builder.Default
    private GroupStatus status = GroupStatus.OPEN;

    @Builder.Default
    private Severity severity = Severity.INFO;

    private Instant firstSeenAt;
    private Instant lastSeenAt;

    /** Occurrence counter, only ever incremented */
    private long count;

    /** Events per hour at the last update, null until the second occurrence */
    private Double velocityPerHour;

    /** Running maximum of impacted users, null when none were reported */
    private Integer userCount;

    /**
     * Hours between first sighting and {@code now}, never below {@code floorHours}.
     */
    public double hoursSinceFirstSeen(Instant now, double floorHours) {
        double hours = Duration.between(firstSeenAt, now).toMillis() / 3_600_000.0;
        return Math.max(hours, floorHours);
    }
}
