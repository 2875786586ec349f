package com.z254.butterfly.triage.ingestion;

import com.z254.butterfly.triage.domain.model.AlertEvent;
import com.z254.butterfly.triage.domain.model.NormalizedAlert;
import com.z254.butterfly.triage.domain.repository.AlertEventRepository;
import com.z254.butterfly.triage.domain.repository.IncidentGroupRepository;
import com.z254.butterfly.triage.domain.repository.WorkspaceDirectory;
import com.z254.butterfly.triage.grouping.GroupKeyHasher;
import com.z254.butterfly.triage.grouping.GroupUpsertResult;
import com.z254.butterfly.triage.grouping.GroupingEngine;
import com.z254.butterfly.triage.kafka.GroupChangedProducer;
import com.z254.butterfly.triage.observability.TriageMetrics;
import com.z254.butterfly.triage.observability.TriageStructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Orchestrates the ingestion of normalized alerts: duplicate check by source event, group
 * upsert and event append, then the group-changed fact. Each workspace seen here is registered
 * with the {@link WorkspaceDirectory} so the scheduled jobs pick it up.
 * <p>
 * The first three steps share the group key's unit of work, so a redelivered source event
 * racing its original is recorded once.
 */
@Slf4j
@Component
public class AlertIngestionService {

    private final GroupingEngine groupingEngine;
    private final GroupKeyHasher groupKeyHasher;
    private final IncidentGroupRepository groupRepository;
    private final AlertEventRepository eventRepository;
    private final WorkspaceDirectory workspaceDirectory;
    private final GroupChangedProducer groupChangedProducer;
    private final TriageMetrics metrics;
    private final TriageStructuredLogger logger;
    private final Clock clock;

    public AlertIngestionService(GroupingEngine groupingEngine,
                                 GroupKeyHasher groupKeyHasher,
                                 IncidentGroupRepository groupRepository,
                                 AlertEventRepository eventRepository,
                                 WorkspaceDirectory workspaceDirectory,
                                 GroupChangedProducer groupChangedProducer,
                                 TriageMetrics metrics,
                                 TriageStructuredLogger logger,
                                 Clock clock) {
        this.groupingEngine = groupingEngine;
        this.groupKeyHasher = groupKeyHasher;
        this.groupRepository = groupRepository;
        this.eventRepository = eventRepository;
        this.workspaceDirectory = workspaceDirectory;
        this.groupChangedProducer = groupChangedProducer;
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    public IngestionResult ingest(String workspaceId, NormalizedAlert alert) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId is required");
        }
        if (alert == null) {
            throw new IllegalArgumentException("alert is required");
        }
        if (alert.getFingerprint() == null || alert.getFingerprint().isBlank()) {
            throw new IllegalArgumentException("alert fingerprint is required");
        }
        workspaceDirectory.registerWorkspace(workspaceId);

        NormalizedAlert stamped = alert.getOccurredAt() != null
                ? alert
                : alert.toBuilder().occurredAt(clock.instant()).build();

        String groupKey = groupKeyHasher.hash(stamped);
        Ingested ingested = groupRepository.inKeyTransaction(workspaceId, groupKey,
                () -> ingestLocked(workspaceId, stamped));

        if (ingested == null) {
            metrics.recordDuplicateIgnored();
            logger.logGroupEvent(workspaceId, null, TriageStructuredLogger.GroupEventType.DUPLICATE_IGNORED,
                    "Duplicate source event ignored",
                    Map.of("source", String.valueOf(stamped.getSource()),
                            "sourceEventId", stamped.getSourceEventId()));
            return IngestionResult.duplicateOf();
        }

        metrics.recordAlertIngested();
        groupChangedProducer.publish(workspaceId, ingested.upsert());

        return new IngestionResult(false, ingested.upsert().group(), ingested.event().getId(),
                ingested.upsert().created());
    }

    /**
     * @return null when the source event was already ingested
     */
    private Ingested ingestLocked(String workspaceId, NormalizedAlert alert) {
        String sourceEventId = alert.getSourceEventId();
        if (sourceEventId != null && eventRepository.existsBySourceEventId(workspaceId, sourceEventId)) {
            return null;
        }

        GroupUpsertResult upsert = groupingEngine.upsert(workspaceId, alert);
        AlertEvent event = eventRepository.append(AlertEvent.builder()
                .workspaceId(workspaceId)
                .groupId(upsert.group().getId())
                .source(alert.getSource())
                .sourceEventId(sourceEventId)
                .title(alert.getTitle())
                .occurredAt(alert.getOccurredAt())
                .build());
        return new Ingested(upsert, event);
    }

    private record Ingested(GroupUpsertResult upsert, AlertEvent event) {
    }
}
