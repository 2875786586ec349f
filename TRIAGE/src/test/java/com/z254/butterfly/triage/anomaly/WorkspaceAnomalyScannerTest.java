package com.z254.butterfly.triage.anomaly;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.triage.audit.AuditSink;
import com.z254.butterfly.triage.audit.SystemAuditRecorder;
import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.model.AlertEvent;
import com.z254.butterfly.triage.domain.model.AuditFact;
import com.z254.butterfly.triage.domain.model.GroupStatus;
import com.z254.butterfly.triage.domain.model.IncidentGroup;
import com.z254.butterfly.triage.domain.model.Severity;
import com.z254.butterfly.triage.domain.repository.InMemoryAlertEventRepository;
import com.z254.butterfly.triage.domain.repository.InMemoryAnomalyBaselineRepository;
import com.z254.butterfly.triage.domain.repository.InMemoryIncidentGroupRepository;
import com.z254.butterfly.triage.domain.repository.InMemoryWorkspaceDirectory;
import com.z254.butterfly.triage.grouping.GroupKeyHasher;
import com.z254.butterfly.triage.grouping.GroupingEngine;
import com.z254.butterfly.triage.observability.TriageMetrics;
import com.z254.butterfly.triage.observability.TriageStructuredLogger;
import com.z254.butterfly.triage.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class WorkspaceAnomalyScannerTest {

    private static final String WS = "ws-1";
    private static final Instant NOW = Instant.parse("2026-03-10T12:30:00Z");

    @Mock
    private AuditSink auditSink;

    private MutableClock clock;
    private InMemoryIncidentGroupRepository groupRepository;
    private InMemoryAlertEventRepository eventRepository;
    private InMemoryWorkspaceDirectory workspaceDirectory;
    private TriageProperties properties;
    private TriageMetrics metrics;
    private WorkspaceAnomalyScanner scanner;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        groupRepository = new InMemoryIncidentGroupRepository();
        eventRepository = new InMemoryAlertEventRepository();
        workspaceDirectory = new InMemoryWorkspaceDirectory();
        properties = new TriageProperties();
        metrics = new TriageMetrics(new SimpleMeterRegistry());
        TriageStructuredLogger logger = new TriageStructuredLogger(new ObjectMapper());

        BaselineCalculator baselineCalculator = new BaselineCalculator(groupRepository, eventRepository,
                new InMemoryAnomalyBaselineRepository(), properties, metrics, clock);
        VelocityAnomalyDetector detector = new VelocityAnomalyDetector(groupRepository, properties, clock);
        GroupingEngine groupingEngine = new GroupingEngine(groupRepository, new GroupKeyHasher(), detector,
                properties, metrics, logger, clock);
        SystemAuditRecorder auditRecorder = new SystemAuditRecorder(auditSink, workspaceDirectory, metrics, clock);

        scanner = new WorkspaceAnomalyScanner(groupRepository, baselineCalculator, groupingEngine,
                auditRecorder, properties, metrics, logger, clock);
    }

    private IncidentGroup groupWithRecentEvents(String title, int recentEvents) {
        IncidentGroup group = groupRepository.save(IncidentGroup.builder()
                .workspaceId(WS)
                .groupKey("key-" + title)
                .title(title)
                .project("checkout")
                .environment("production")
                .severity(Severity.MEDIUM)
                .firstSeenAt(NOW.minus(Duration.ofHours(3)))
                .lastSeenAt(NOW)
                .count(Math.max(recentEvents, 5))
                .build());
        for (int i = 0; i < recentEvents; i++) {
            eventRepository.append(AlertEvent.builder()
                    .workspaceId(WS)
                    .groupId(group.getId())
                    .occurredAt(NOW.minus(Duration.ofMinutes(5 + i)))
                    .build());
        }
        return group;
    }

    @Nested
    @DisplayName("Detection")
    class DetectionTests {

        @Test
        @DisplayName("hour far above baseline is reported")
        void spikeIsReported() {
            IncidentGroup group = groupWithRecentEvents("Checkout 500s", 10);

            List<VelocityAnomaly> anomalies = scanner.detectWorkspaceAnomalies(WS);

            assertThat(anomalies).hasSize(1);
            VelocityAnomaly anomaly = anomalies.get(0);
            assertThat(anomaly.getAlertGroupId()).isEqualTo(group.getId());
            assertThat(anomaly.getCurrentVelocity()).isEqualTo(10.0);
            assertThat(anomaly.getBaselineVelocity()).isCloseTo(10.0 / 24, within(1e-9));
            assertThat(anomaly.getZScore()).isGreaterThanOrEqualTo(3.0);
            assertThat(anomaly.getPercentageIncrease()).isCloseTo(2300.0, within(1e-6));
            assertThat(anomaly.getDetectedAt()).isEqualTo(NOW);
            assertThat(anomaly.getSyntheticGroupId()).isNull();
        }

        @Test
        @DisplayName("hour below the minimum velocity is ignored")
        void lowVolumeIsIgnored() {
            groupWithRecentEvents("Rare warning", 4);

            assertThat(scanner.detectWorkspaceAnomalies(WS)).isEmpty();
        }

        @Test
        @DisplayName("steady traffic does not reach the z-score threshold")
        void steadyTrafficIsNormal() {
            IncidentGroup group = groupWithRecentEvents("Steady", 6);
            for (int hour = 1; hour < 24; hour++) {
                for (int i = 0; i < 6; i++) {
                    eventRepository.append(AlertEvent.builder()
                            .workspaceId(WS)
                            .groupId(group.getId())
                            .occurredAt(NOW.minus(Duration.ofHours(hour)).minus(Duration.ofMinutes(1 + i)))
                            .build());
                }
            }

            assertThat(scanner.detectWorkspaceAnomalies(WS)).isEmpty();
        }

        @Test
        @DisplayName("resolved groups are not candidates")
        void resolvedGroupsAreSkipped() {
            IncidentGroup group = groupWithRecentEvents("Fixed", 10);
            group.setStatus(GroupStatus.RESOLVED);
            groupRepository.save(group);

            assertThat(scanner.detectWorkspaceAnomalies(WS)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Recording")
    class RecordingTests {

        @Test
        @DisplayName("anomaly becomes a synthetic LOW group and an audit fact")
        void anomalyIsRecordedAsSyntheticGroup() {
            workspaceDirectory.addMember(WS, "user-7");
            IncidentGroup source = groupWithRecentEvents("Checkout 500s", 10);

            List<VelocityAnomaly> anomalies = scanner.detectAndRecordAnomalies(WS);

            String syntheticId = anomalies.get(0).getSyntheticGroupId();
            IncidentGroup synthetic = groupRepository.findById(syntheticId).orElseThrow();
            assertThat(synthetic.getTitle()).isEqualTo("High Error Velocity Detected: Checkout 500s");
            assertThat(synthetic.getSeverity()).isEqualTo(Severity.LOW);
            assertThat(synthetic.getProject()).isEqualTo(source.getProject());
            assertThat(synthetic.getEnvironment()).isEqualTo(source.getEnvironment());
            assertThat(synthetic.getGroupKey()).isEqualTo(new GroupKeyHasher()
                    .hash("signalcraft", "checkout", "production", "velocity:" + source.getId()));
            assertThat(metrics.getSyntheticGroupsCreated().count()).isEqualTo(1.0);

            ArgumentCaptor<AuditFact> fact = ArgumentCaptor.forClass(AuditFact.class);
            verify(auditSink).emit(fact.capture());
            assertThat(fact.getValue().getAction()).isEqualTo("anomaly.detected");
            assertThat(fact.getValue().getResourceType()).isEqualTo("AlertGroup");
            assertThat(fact.getValue().getResourceId()).isEqualTo(syntheticId);
            assertThat(fact.getValue().getActorUserId()).isEqualTo("user-7");
            assertThat(fact.getValue().getMetadata()).containsEntry("sourceGroupId", source.getId());
        }

        @Test
        @DisplayName("repeated scans update the same synthetic group")
        void repeatedScansAreDeduplicated() {
            workspaceDirectory.addMember(WS, "user-7");
            groupWithRecentEvents("Checkout 500s", 10);

            String first = scanner.detectAndRecordAnomalies(WS).get(0).getSyntheticGroupId();
            clock.advance(Duration.ofMinutes(1));
            String second = scanner.detectAndRecordAnomalies(WS).get(0).getSyntheticGroupId();

            assertThat(second).isEqualTo(first);
            assertThat(groupRepository.findById(first).orElseThrow().getCount()).isEqualTo(2);
            verify(auditSink, times(1)).emit(any());
        }

        @Test
        @DisplayName("workspace without members gets no audit fact")
        void noMembersNoAudit() {
            groupWithRecentEvents("Checkout 500s", 10);

            List<VelocityAnomaly> anomalies = scanner.detectAndRecordAnomalies(WS);

            assertThat(anomalies.get(0).getSyntheticGroupId()).isNotNull();
            verify(auditSink, never()).emit(any());
        }
    }
}
