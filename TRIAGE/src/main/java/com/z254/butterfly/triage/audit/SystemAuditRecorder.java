package com.z254.butterfly.triage.audit;

import com.z254.butterfly.triage.domain.model.AuditFact;
import com.z254.butterfly.triage.domain.repository.WorkspaceDirectory;
import com.z254.butterfly.triage.observability.TriageMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Records audit facts for changes the system makes on its own.
 * <p>
 * Such changes have no human actor, so any member of the workspace stands in for it. A
 * workspace without members gets no audit fact. Emission is best effort.
 */
@Slf4j
@Component
public class SystemAuditRecorder {

    private final AuditSink auditSink;
    private final WorkspaceDirectory workspaceDirectory;
    private final TriageMetrics metrics;
    private final Clock clock;

    public SystemAuditRecorder(AuditSink auditSink,
                               WorkspaceDirectory workspaceDirectory,
                               TriageMetrics metrics,
                               Clock clock) {
        this.auditSink = auditSink;
        this.workspaceDirectory = workspaceDirectory;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @return true when a fact was handed to the sink
     */
    public boolean record(String workspaceId, String action, String resourceType,
                          String resourceId, Map<String, Object> metadata) {
        try {
            Optional<String> actor = workspaceDirectory.findAnyMemberId(workspaceId);
            if (actor.isEmpty()) {
                log.debug("No system actor in workspace {}, skipping audit of {}", workspaceId, action);
                return false;
            }

            auditSink.emit(AuditFact.builder()
                    .workspaceId(workspaceId)
                    .actorUserId(actor.get())
                    .action(action)
                    .resourceType(resourceType)
                    .resourceId(resourceId)
                    .metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>())
                    .recordedAt(clock.instant())
                    .build());
            return true;
        } catch (RuntimeException e) {
            metrics.recordSideEffectFailure("audit");
            log.warn("Failed to record audit {} for {} {}: {}", action, resourceType, resourceId, e.getMessage());
            return false;
        }
    }
}
