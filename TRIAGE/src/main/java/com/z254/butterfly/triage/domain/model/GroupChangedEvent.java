package com.z254.butterfly.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Fact published whenever ingestion creates or updates an incident group.
 * Notification and UI layers consume these; the core never pushes to them directly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupChangedEvent {

    private String eventId;
    private String workspaceId;
    private String groupId;
    private String groupKey;
    private ChangeType changeType;
    private GroupStatus status;
    private Severity severity;
    private Severity previousSeverity;
    private long count;
    private Double velocityPerHour;
    private boolean velocityAnomaly;
    private Instant occurredAt;

    public boolean isEscalated() {
        return previousSeverity != null && severity != null && severity.isHigherThan(previousSeverity);
    }

    public enum ChangeType {
        CREATED,
        UPDATED
    }
}
