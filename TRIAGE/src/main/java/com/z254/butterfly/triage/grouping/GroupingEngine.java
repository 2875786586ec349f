package com.z254.butterfly.triage.grouping;

import com.z254.butterfly.triage.anomaly.VelocityAnomalyDetector;
import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.model.GroupStatus;
import com.z254.butterfly.triage.domain.model.IncidentGroup;
import com.z254.butterfly.triage.domain.model.NormalizedAlert;
import com.z254.butterfly.triage.domain.model.Severity;
import com.z254.butterfly.triage.domain.repository.IncidentGroupRepository;
import com.z254.butterfly.triage.observability.TriageMetrics;
import com.z254.butterfly.triage.observability.TriageStructuredLogger;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Finds or creates the active incident group for an alert and folds the alert into it.
 * <p>
 * The lookup and the write run inside one {@link IncidentGroupRepository#inKeyTransaction}
 * so concurrent alerts with the same key never open two active groups.
 */
@Slf4j
@Service
public class GroupingEngine {

    private final IncidentGroupRepository groupRepository;
    private final GroupKeyHasher groupKeyHasher;
    private final VelocityAnomalyDetector velocityAnomalyDetector;
    private final TriageProperties triageProperties;
    private final TriageMetrics metrics;
    private final TriageStructuredLogger logger;
    private final Clock clock;

    public GroupingEngine(IncidentGroupRepository groupRepository,
                          GroupKeyHasher groupKeyHasher,
                          VelocityAnomalyDetector velocityAnomalyDetector,
                          TriageProperties triageProperties,
                          TriageMetrics metrics,
                          TriageStructuredLogger logger,
                          Clock clock) {
        this.groupRepository = groupRepository;
        this.groupKeyHasher = groupKeyHasher;
        this.velocityAnomalyDetector = velocityAnomalyDetector;
        this.triageProperties = triageProperties;
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    public IncidentGroup upsertGroup(String workspaceId, NormalizedAlert alert) {
        return upsert(workspaceId, alert).group();
    }

    /**
     * Create or update the group for {@code alert} and report what happened.
     */
    public GroupUpsertResult upsert(String workspaceId, NormalizedAlert alert) {
        String groupKey = groupKeyHasher.hash(alert);
        Timer.Sample sample = metrics.startGroupingTimer();
        try {
            return groupRepository.inKeyTransaction(workspaceId, groupKey, () -> {
                Instant windowStart = clock.instant().minus(triageProperties.getGrouping().getWindow());
                Optional<IncidentGroup> existing =
                        groupRepository.findActiveByKey(workspaceId, groupKey, windowStart);

                return existing
                        .map(group -> mergeInto(workspaceId, group, alert))
                        .orElseGet(() -> createGroup(workspaceId, groupKey, alert));
            });
        } finally {
            metrics.recordGroupingLatency(sample);
        }
    }

    private GroupUpsertResult createGroup(String workspaceId, String groupKey, NormalizedAlert alert) {
        IncidentGroup group = IncidentGroup.builder()
                .workspaceId(workspaceId)
                .groupKey(groupKey)
                .title(alert.getTitle())
                .project(alert.getProject())
                .environment(alert.getEnvironment())
                .status(GroupStatus.OPEN)
                .severity(Severity.normalize(alert.getSeverity()))
                .firstSeenAt(alert.getOccurredAt())
                .lastSeenAt(alert.getOccurredAt())
                .count(1)
                .userCount(alert.getUserCount())
                .velocityPerHour(null)
                .build();
        groupRepository.save(group);

        metrics.recordGroupCreated();
        logger.logGroupEvent(workspaceId, group.getId(), TriageStructuredLogger.GroupEventType.CREATED,
                "Incident group opened",
                Map.of("groupKey", groupKey, "severity", group.getSeverity().name()));
        return new GroupUpsertResult(group, true, null, false);
    }

    private GroupUpsertResult mergeInto(String workspaceId, IncidentGroup group, NormalizedAlert alert) {
        Severity previousSeverity = group.getSeverity();
        long newCount = group.getCount() + 1;

        double hours = group.hoursSinceFirstSeen(alert.getOccurredAt(),
                triageProperties.getGrouping().getMinVelocityHours());
        double velocity = newCount / hours;

        boolean anomalous = isVelocityAnomalous(workspaceId, group.getId(), velocity);

        Severity severity = previousSeverity.max(Severity.normalize(alert.getSeverity()));
        if (anomalous && Severity.HIGH.isHigherThan(severity)) {
            severity = Severity.HIGH;
        }

        int users = Math.max(
                group.getUserCount() != null ? group.getUserCount() : 0,
                alert.getUserCount() != null ? alert.getUserCount() : 0);

        group.setCount(newCount);
        group.setLastSeenAt(alert.getOccurredAt());
        group.setVelocityPerHour(velocity);
        group.setSeverity(severity);
        group.setUserCount(users > 0 ? users : null);
        groupRepository.save(group);

        GroupUpsertResult result = new GroupUpsertResult(group, false, previousSeverity, anomalous);
        metrics.recordGroupUpdated(result.autoEscalated());
        if (severity != previousSeverity) {
            logger.logGroupEvent(workspaceId, group.getId(),
                    TriageStructuredLogger.GroupEventType.SEVERITY_ESCALATED,
                    "Incident group severity raised",
                    Map.of("from", previousSeverity.name(), "to", severity.name(),
                            "velocityAnomaly", anomalous));
        } else {
            logger.logGroupEvent(workspaceId, group.getId(), TriageStructuredLogger.GroupEventType.UPDATED,
                    "Incident group updated",
                    Map.of("count", newCount, "velocityPerHour", velocity));
        }
        return result;
    }

    /**
     * Spike check that never fails the upsert: any error counts as "not anomalous".
     */
    private boolean isVelocityAnomalous(String workspaceId, String groupId, double velocity) {
        try {
            return velocityAnomalyDetector.checkVelocityAnomaly(workspaceId, groupId, velocity);
        } catch (RuntimeException e) {
            metrics.recordSpikeCheckFailure();
            logger.logGroupEvent(workspaceId, groupId, TriageStructuredLogger.GroupEventType.SPIKE_CHECK_FAILED,
                    "Velocity spike check failed, continuing without escalation",
                    Map.of("error", e.getClass().getSimpleName()));
            log.debug("Spike check failure for group {}", groupId, e);
            return false;
        }
    }
}
