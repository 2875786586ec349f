package com.z254.butterfly.triage.anomaly;

import com.z254.butterfly.triage.audit.SystemAuditRecorder;
import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.model.IncidentGroup;
import com.z254.butterfly.triage.domain.model.NormalizedAlert;
import com.z254.butterfly.triage.domain.repository.IncidentGroupRepository;
import com.z254.butterfly.triage.grouping.GroupUpsertResult;
import com.z254.butterfly.triage.grouping.GroupingEngine;
import com.z254.butterfly.triage.observability.TriageMetrics;
import com.z254.butterfly.triage.observability.TriageStructuredLogger;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Batch velocity scan over the active groups of a workspace.
 * <p>
 * Each candidate is compared with its baseline; a group is anomalous when its current hour has
 * at least {@code minVelocity} events and a z-score of at least {@code zScoreThreshold}.
 * Recording turns every anomaly into a synthetic LOW group keyed on {@code velocity:<groupId>},
 * pushed through the regular grouping path so repeated detections update the same group.
 */
@Slf4j
@Service
public class WorkspaceAnomalyScanner {

    static final String VELOCITY_FINGERPRINT_PREFIX = "velocity:";
    static final String TITLE_PREFIX = "High Error Velocity Detected: ";
    static final String AUDIT_ACTION = "anomaly.detected";
    static final String AUDIT_RESOURCE_TYPE = "AlertGroup";

    private final IncidentGroupRepository groupRepository;
    private final BaselineCalculator baselineCalculator;
    private final GroupingEngine groupingEngine;
    private final SystemAuditRecorder auditRecorder;
    private final TriageProperties triageProperties;
    private final TriageMetrics metrics;
    private final TriageStructuredLogger logger;
    private final Clock clock;

    public WorkspaceAnomalyScanner(IncidentGroupRepository groupRepository,
                                   BaselineCalculator baselineCalculator,
                                   GroupingEngine groupingEngine,
                                   SystemAuditRecorder auditRecorder,
                                   TriageProperties triageProperties,
                                   TriageMetrics metrics,
                                   TriageStructuredLogger logger,
                                   Clock clock) {
        this.groupRepository = groupRepository;
        this.baselineCalculator = baselineCalculator;
        this.groupingEngine = groupingEngine;
        this.auditRecorder = auditRecorder;
        this.triageProperties = triageProperties;
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    /**
     * Report anomalous groups without writing anything but baselines.
     */
    public List<VelocityAnomaly> detectWorkspaceAnomalies(String workspaceId) {
        TriageProperties.Anomaly config = triageProperties.getAnomaly();
        Timer.Sample sample = metrics.startAnomalyScanTimer();
        List<VelocityAnomaly> anomalies = new ArrayList<>();

        List<IncidentGroup> candidates = groupRepository.findActiveWithMinCount(
                workspaceId, config.getCandidateMinCount(), config.getMaxGroupsPerScan());

        for (IncidentGroup group : candidates) {
            try {
                evaluate(workspaceId, group, config).ifPresent(anomalies::add);
            } catch (RuntimeException e) {
                log.warn("Skipping group {} in anomaly scan of workspace {}: {}",
                        group.getId(), workspaceId, e.getMessage());
            }
        }

        metrics.recordAnomalyScan(sample, anomalies.size());
        if (!anomalies.isEmpty()) {
            log.warn("Detected {} velocity anomalies in workspace {}", anomalies.size(), workspaceId);
        }
        return anomalies;
    }

    /**
     * Detect anomalies and record each one as a synthetic incident group.
     */
    public List<VelocityAnomaly> detectAndRecordAnomalies(String workspaceId) {
        List<VelocityAnomaly> anomalies = detectWorkspaceAnomalies(workspaceId);
        for (VelocityAnomaly anomaly : anomalies) {
            try {
                record(workspaceId, anomaly);
            } catch (RuntimeException e) {
                log.error("Failed to record velocity anomaly for group {}: {}",
                        anomaly.getAlertGroupId(), e.getMessage(), e);
            }
        }
        return anomalies;
    }

    private Optional<VelocityAnomaly> evaluate(String workspaceId, IncidentGroup group,
                                               TriageProperties.Anomaly config) {
        Optional<GroupStats> computed = baselineCalculator.computeGroupStats(workspaceId, group.getId());
        if (computed.isEmpty()) {
            return Optional.empty();
        }
        GroupStats stats = computed.get();

        if (stats.currentCount() < config.getMinVelocity()) {
            return Optional.empty();
        }
        double zScore = stats.zScore();
        if (zScore < config.getZScoreThreshold()) {
            return Optional.empty();
        }

        return Optional.of(VelocityAnomaly.builder()
                .alertGroupId(group.getId())
                .title(group.getTitle())
                .severity(group.getSeverity())
                .currentVelocity(stats.currentCount())
                .baselineVelocity(stats.mean())
                .percentageIncrease(stats.percentageIncrease())
                .zScore(zScore)
                .seasonalBaseline(stats.seasonal())
                .detectedAt(clock.instant())
                .build());
    }

    private void record(String workspaceId, VelocityAnomaly anomaly) {
        IncidentGroup source = groupRepository.findById(anomaly.getAlertGroupId()).orElse(null);
        NormalizedAlert alert = NormalizedAlert.builder()
                .source(triageProperties.getAnomaly().getSyntheticSource())
                .project(source != null ? source.getProject() : null)
                .environment(source != null ? source.getEnvironment() : null)
                .fingerprint(VELOCITY_FINGERPRINT_PREFIX + anomaly.getAlertGroupId())
                .title(TITLE_PREFIX + anomaly.getTitle())
                .message(describe(anomaly))
                .severity(triageProperties.getAnomaly().getSyntheticSeverity().name())
                .tag("sourceGroupId", anomaly.getAlertGroupId())
                .occurredAt(clock.instant())
                .build();

        GroupUpsertResult result = groupingEngine.upsert(workspaceId, alert);
        anomaly.setSyntheticGroupId(result.group().getId());

        if (result.created()) {
            metrics.recordSyntheticGroupCreated();
            logger.logGroupEvent(workspaceId, result.group().getId(),
                    TriageStructuredLogger.GroupEventType.ANOMALY_RECORDED,
                    "Velocity anomaly recorded as incident group",
                    Map.of("sourceGroupId", anomaly.getAlertGroupId(), "zScore", anomaly.getZScore()));
            auditRecorder.record(workspaceId, AUDIT_ACTION, AUDIT_RESOURCE_TYPE, result.group().getId(),
                    Map.of("sourceGroupId", anomaly.getAlertGroupId(),
                            "currentVelocity", anomaly.getCurrentVelocity(),
                            "baselineVelocity", anomaly.getBaselineVelocity(),
                            "zScore", anomaly.getZScore()));
        }
    }

    static String describe(VelocityAnomaly anomaly) {
        return String.format(Locale.ROOT,
                "Alert velocity spiked to %.0f events in the last hour (baseline %.2f/h, z-score %.2f, +%.0f%%)",
                anomaly.getCurrentVelocity(), anomaly.getBaselineVelocity(),
                anomaly.getZScore(), anomaly.getPercentageIncrease());
    }
}
