package com.z254.butterfly.triage.scheduling;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.triage.anomaly.VelocityAnomaly;
import com.z254.butterfly.triage.anomaly.WorkspaceAnomalyScanner;
import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.repository.InMemoryWorkspaceDirectory;
import com.z254.butterfly.triage.health.TriageHealthIndicator;
import com.z254.butterfly.triage.observability.TriageStructuredLogger;
import com.z254.butterfly.triage.observability.TriageStructuredLogger.JobType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyScanSchedulerTest {

    @Mock
    private WorkspaceAnomalyScanner anomalyScanner;

    @Mock
    private TriageHealthIndicator healthIndicator;

    private InMemoryWorkspaceDirectory workspaceDirectory;
    private TriageProperties properties;
    private AnomalyScanScheduler scheduler;

    @BeforeEach
    void setUp() {
        workspaceDirectory = new InMemoryWorkspaceDirectory();
        properties = new TriageProperties();
        scheduler = new AnomalyScanScheduler(anomalyScanner, workspaceDirectory, properties,
                healthIndicator, new TriageStructuredLogger(new ObjectMapper()));
    }

    @Test
    void everyWorkspaceIsScannedDespiteFailures() {
        workspaceDirectory.registerWorkspace("ws-a");
        workspaceDirectory.registerWorkspace("ws-b");
        when(anomalyScanner.detectAndRecordAnomalies("ws-a")).thenThrow(new IllegalStateException("boom"));
        when(anomalyScanner.detectAndRecordAnomalies("ws-b"))
                .thenReturn(List.of(VelocityAnomaly.builder().alertGroupId("g-1").build()));

        assertThat(scheduler.runAll()).isEqualTo(1);
        verify(anomalyScanner).detectAndRecordAnomalies("ws-b");
        verify(healthIndicator).recordJobRun(JobType.ANOMALY_SCAN, 2, 1);
    }

    @Test
    void disabledJobDoesNothing() {
        workspaceDirectory.registerWorkspace("ws-a");
        properties.getScheduler().setAnomalyScanEnabled(false);

        scheduler.scheduledRun();

        verifyNoInteractions(anomalyScanner, healthIndicator);
    }

    @Test
    void noWorkspacesStillReportsRun() {
        assertThat(scheduler.runAll()).isZero();
        verify(healthIndicator).recordJobRun(JobType.ANOMALY_SCAN, 0, 0);
    }
}
