package com.z254.butterfly.triage.audit;

import com.z254.butterfly.triage.domain.model.AuditFact;
import com.z254.butterfly.triage.domain.repository.InMemoryWorkspaceDirectory;
import com.z254.butterfly.triage.observability.TriageMetrics;
import com.z254.butterfly.triage.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SystemAuditRecorderTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:30:00Z");

    @Mock
    private AuditSink auditSink;

    private InMemoryWorkspaceDirectory workspaceDirectory;
    private SimpleMeterRegistry meterRegistry;
    private SystemAuditRecorder recorder;

    @BeforeEach
    void setUp() {
        workspaceDirectory = new InMemoryWorkspaceDirectory();
        meterRegistry = new SimpleMeterRegistry();
        recorder = new SystemAuditRecorder(auditSink, workspaceDirectory,
                new TriageMetrics(meterRegistry), new MutableClock(NOW));
    }

    @Test
    void emitsFactWithAnyMemberAsActor() {
        workspaceDirectory.addMember("ws-1", "user-1");

        boolean recorded = recorder.record("ws-1", "anomaly.detected", "AlertGroup", "g-1", Map.of("k", "v"));

        ArgumentCaptor<AuditFact> fact = ArgumentCaptor.forClass(AuditFact.class);
        verify(auditSink).emit(fact.capture());
        assertThat(recorded).isTrue();
        assertThat(fact.getValue().getActorUserId()).isEqualTo("user-1");
        assertThat(fact.getValue().getRecordedAt()).isEqualTo(NOW);
        assertThat(fact.getValue().getMetadata()).containsEntry("k", "v");
    }

    @Test
    void skipsWorkspaceWithoutMembers() {
        workspaceDirectory.registerWorkspace("ws-empty");

        assertThat(recorder.record("ws-empty", "anomaly.detected", "AlertGroup", "g-1", null)).isFalse();
        verifyNoInteractions(auditSink);
    }

    @Test
    void sinkFailureIsSwallowedAndCounted() {
        workspaceDirectory.addMember("ws-1", "user-1");
        doThrow(new IllegalStateException("broker down")).when(auditSink).emit(any());

        assertThat(recorder.record("ws-1", "anomaly.detected", "AlertGroup", "g-1", null)).isFalse();
        assertThat(meterRegistry.get("triage.side_effects.failed").tag("kind", "audit").counter().count())
                .isEqualTo(1.0);
    }
}
