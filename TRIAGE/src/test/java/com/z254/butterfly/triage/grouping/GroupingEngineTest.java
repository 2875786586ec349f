package com.z254.butterfly.triage.grouping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.triage.anomaly.VelocityAnomalyDetector;
import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.model.GroupStatus;
import com.z254.butterfly.triage.domain.model.IncidentGroup;
import com.z254.butterfly.triage.domain.model.NormalizedAlert;
import com.z254.butterfly.triage.domain.model.Severity;
import com.z254.butterfly.triage.domain.repository.InMemoryIncidentGroupRepository;
import com.z254.butterfly.triage.observability.TriageMetrics;
import com.z254.butterfly.triage.observability.TriageStructuredLogger;
import com.z254.butterfly.triage.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GroupingEngineTest {

    private static final String WS = "ws-1";
    private static final Instant NOW = Instant.parse("2026-03-10T12:30:00Z");

    @Mock
    private VelocityAnomalyDetector velocityAnomalyDetector;

    private MutableClock clock;
    private InMemoryIncidentGroupRepository groupRepository;
    private TriageMetrics metrics;
    private GroupingEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        groupRepository = new InMemoryIncidentGroupRepository();
        metrics = new TriageMetrics(new SimpleMeterRegistry());
        engine = new GroupingEngine(groupRepository, new GroupKeyHasher(), velocityAnomalyDetector,
                new TriageProperties(), metrics, new TriageStructuredLogger(new ObjectMapper()), clock);
    }

    private NormalizedAlert alert(String severity) {
        return NormalizedAlert.builder()
                .source("sentry")
                .project("checkout")
                .environment("production")
                .fingerprint("TimeoutException@PaymentClient")
                .title("Payment gateway timeout")
                .severity(severity)
                .occurredAt(clock.instant())
                .build();
    }

    @Nested
    @DisplayName("Group creation and merging")
    class CreationTests {

        @Test
        @DisplayName("first alert opens a group with count 1 and no velocity")
        void firstAlertOpensGroup() {
            GroupUpsertResult result = engine.upsert(WS, alert("error"));

            IncidentGroup group = result.group();
            assertThat(result.created()).isTrue();
            assertThat(group.getId()).isNotNull();
            assertThat(group.getStatus()).isEqualTo(GroupStatus.OPEN);
            assertThat(group.getCount()).isEqualTo(1);
            assertThat(group.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(group.getVelocityPerHour()).isNull();
            assertThat(group.getFirstSeenAt()).isEqualTo(NOW);
            assertThat(group.getTitle()).isEqualTo("Payment gateway timeout");
            assertThat(metrics.getGroupsCreated().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("second alert inside the window updates the same group")
        void secondAlertInsideWindowMerges() {
            IncidentGroup first = engine.upsertGroup(WS, alert("low"));
            clock.advance(Duration.ofMinutes(30));

            GroupUpsertResult second = engine.upsert(WS, alert("low"));

            assertThat(second.created()).isFalse();
            assertThat(second.group().getId()).isEqualTo(first.getId());
            assertThat(second.group().getCount()).isEqualTo(2);
            assertThat(second.group().getLastSeenAt()).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
            // 2 events over half an hour
            assertThat(second.group().getVelocityPerHour()).isCloseTo(4.0, within(1e-9));
            assertThat(groupRepository.findByWorkspace(WS)).hasSize(1);
        }

        @Test
        @DisplayName("velocity uses a 0.1h floor for bursts")
        void velocityFloorForBursts() {
            engine.upsertGroup(WS, alert("low"));
            clock.advance(Duration.ofSeconds(1));

            IncidentGroup group = engine.upsertGroup(WS, alert("low"));

            assertThat(group.getVelocityPerHour()).isCloseTo(20.0, within(1e-9));
        }

        @Test
        @DisplayName("alert after the window opens a new group")
        void alertAfterWindowOpensNewGroup() {
            IncidentGroup first = engine.upsertGroup(WS, alert("low"));
            clock.advance(Duration.ofMinutes(61));

            GroupUpsertResult later = engine.upsert(WS, alert("low"));

            assertThat(later.created()).isTrue();
            assertThat(later.group().getId()).isNotEqualTo(first.getId());
            assertThat(later.group().getGroupKey()).isEqualTo(first.getGroupKey());
        }

        @Test
        @DisplayName("resolved groups are not reopened")
        void resolvedGroupIsNotReused() {
            IncidentGroup first = engine.upsertGroup(WS, alert("low"));
            first.setStatus(GroupStatus.RESOLVED);
            groupRepository.save(first);

            IncidentGroup next = engine.upsertGroup(WS, alert("low"));

            assertThat(next.getId()).isNotEqualTo(first.getId());
        }

        @Test
        @DisplayName("workspaces never share groups")
        void workspacesAreIsolated() {
            IncidentGroup a = engine.upsertGroup(WS, alert("low"));
            IncidentGroup b = engine.upsertGroup("ws-2", alert("low"));

            assertThat(a.getId()).isNotEqualTo(b.getId());
            assertThat(a.getGroupKey()).isEqualTo(b.getGroupKey());
        }
    }

    @Nested
    @DisplayName("Severity and user count")
    class SeverityTests {

        @Test
        @DisplayName("severity never decreases")
        void severityIsMonotonic() {
            engine.upsertGroup(WS, alert("critical"));

            IncidentGroup group = engine.upsertGroup(WS, alert("info"));

            assertThat(group.getSeverity()).isEqualTo(Severity.CRITICAL);
        }

        @Test
        @DisplayName("higher incoming severity raises the group")
        void incomingSeverityRaisesGroup() {
            engine.upsertGroup(WS, alert("warning"));

            GroupUpsertResult result = engine.upsert(WS, alert("fatal"));

            assertThat(result.group().getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(result.previousSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(result.autoEscalated()).isFalse();
        }

        @Test
        @DisplayName("velocity anomaly forces at least HIGH")
        void anomalyForcesHigh() {
            when(velocityAnomalyDetector.checkVelocityAnomaly(eq(WS), anyString(), anyDouble()))
                    .thenReturn(true);
            engine.upsertGroup(WS, alert("low"));

            GroupUpsertResult result = engine.upsert(WS, alert("low"));

            assertThat(result.group().getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(result.velocityAnomaly()).isTrue();
            assertThat(result.autoEscalated()).isTrue();
            assertThat(metrics.getSeverityAutoEscalations().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("velocity anomaly leaves CRITICAL alone")
        void anomalyDoesNotLowerCritical() {
            when(velocityAnomalyDetector.checkVelocityAnomaly(eq(WS), anyString(), anyDouble()))
                    .thenReturn(true);
            engine.upsertGroup(WS, alert("critical"));

            IncidentGroup group = engine.upsertGroup(WS, alert("low"));

            assertThat(group.getSeverity()).isEqualTo(Severity.CRITICAL);
        }

        @Test
        @DisplayName("failing spike check does not fail the upsert")
        void spikeCheckFailureIsNotAnomalous() {
            IncidentGroup first = engine.upsertGroup(WS, alert("low"));
            when(velocityAnomalyDetector.checkVelocityAnomaly(eq(WS), eq(first.getId()), anyDouble()))
                    .thenThrow(new IllegalStateException("baseline store down"));

            GroupUpsertResult result = engine.upsert(WS, alert("low"));

            assertThat(result.group().getCount()).isEqualTo(2);
            assertThat(result.group().getSeverity()).isEqualTo(Severity.LOW);
            assertThat(result.velocityAnomaly()).isFalse();
            assertThat(metrics.getSpikeCheckFailures().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("spike check receives the new velocity")
        void spikeCheckReceivesVelocity() {
            IncidentGroup first = engine.upsertGroup(WS, alert("low"));
            clock.advance(Duration.ofHours(1));

            engine.upsertGroup(WS, alert("low"));

            verify(velocityAnomalyDetector).checkVelocityAnomaly(WS, first.getId(), 2.0);
        }

        @Test
        @DisplayName("user count keeps the maximum and stays null when nothing is reported")
        void userCountIsRunningMaximum() {
            engine.upsertGroup(WS, alert("low").toBuilder().userCount(7).build());
            IncidentGroup afterLower = engine.upsertGroup(WS, alert("low").toBuilder().userCount(3).build());
            IncidentGroup afterNull = engine.upsertGroup(WS, alert("low"));

            assertThat(afterLower.getUserCount()).isEqualTo(7);
            assertThat(afterNull.getUserCount()).isEqualTo(7);

            engine.upsertGroup("ws-2", alert("low"));
            IncidentGroup noUsers = engine.upsertGroup("ws-2", alert("low"));
            assertThat(noUsers.getUserCount()).isNull();
        }
    }

    @Nested
    @DisplayName("Concurrent ingestion")
    class ConcurrencyTests {

        @Test
        @DisplayName("parallel alerts for one key share a single group")
        void parallelUpsertsShareOneGroup() throws Exception {
            int alerts = 200;
            ExecutorService pool = Executors.newFixedThreadPool(16);
            List<GroupUpsertResult> results = new ArrayList<>();
            try {
                List<Callable<GroupUpsertResult>> calls = new ArrayList<>();
                for (int i = 0; i < alerts; i++) {
                    calls.add(() -> engine.upsert(WS, alert("error")));
                }
                for (Future<GroupUpsertResult> future : pool.invokeAll(calls)) {
                    results.add(future.get());
                }
            } finally {
                pool.shutdownNow();
            }

            List<IncidentGroup> groups = groupRepository.findByWorkspace(WS);
            assertThat(groups).hasSize(1);
            assertThat(groups.get(0).getCount()).isEqualTo(alerts);
            assertThat(results).filteredOn(GroupUpsertResult::created).hasSize(1);
            assertThat(results).extracting(r -> r.group().getId()).containsOnly(groups.get(0).getId());
            assertThat(metrics.getGroupsCreated().count()).isEqualTo(1.0);
        }
    }
}
