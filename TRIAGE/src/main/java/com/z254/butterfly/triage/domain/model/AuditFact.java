package com.z254.butterfly.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Audit record handed to the external audit collaborator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditFact {

    private String workspaceId;
    private String actorUserId;
    private String action;
    private String resourceType;
    private String resourceId;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private Instant recordedAt;
}
