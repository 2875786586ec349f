package com.z254.butterfly.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single ingested alert occurrence, attached to the group it was merged into.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertEvent {

    private String id;
    private String workspaceId;
    private String groupId;
    private String source;
    private String sourceEventId;
    private String title;
    private Instant occurredAt;
}
