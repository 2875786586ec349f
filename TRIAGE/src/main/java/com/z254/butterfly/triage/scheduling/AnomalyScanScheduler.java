package com.z254.butterfly.triage.scheduling;

import com.z254.butterfly.triage.anomaly.VelocityAnomaly;
import com.z254.butterfly.triage.anomaly.WorkspaceAnomalyScanner;
import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.repository.WorkspaceDirectory;
import com.z254.butterfly.triage.health.TriageHealthIndicator;
import com.z254.butterfly.triage.observability.TriageStructuredLogger;
import com.z254.butterfly.triage.observability.TriageStructuredLogger.JobEventType;
import com.z254.butterfly.triage.observability.TriageStructuredLogger.JobType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Runs the baseline anomaly scan, with synthetic group recording, for every workspace.
 */
@Slf4j
@Component
public class AnomalyScanScheduler {

    private final WorkspaceAnomalyScanner anomalyScanner;
    private final WorkspaceDirectory workspaceDirectory;
    private final TriageProperties triageProperties;
    private final TriageHealthIndicator healthIndicator;
    private final TriageStructuredLogger logger;

    public AnomalyScanScheduler(WorkspaceAnomalyScanner anomalyScanner,
                                WorkspaceDirectory workspaceDirectory,
                                TriageProperties triageProperties,
                                TriageHealthIndicator healthIndicator,
                                TriageStructuredLogger logger) {
        this.anomalyScanner = anomalyScanner;
        this.workspaceDirectory = workspaceDirectory;
        this.triageProperties = triageProperties;
        this.healthIndicator = healthIndicator;
        this.logger = logger;
    }

    @Scheduled(fixedDelayString = "${triage.scheduler.anomaly-scan-interval:PT15M}",
            initialDelayString = "${triage.scheduler.anomaly-scan-interval:PT15M}")
    public void scheduledRun() {
        if (!triageProperties.getScheduler().isAnomalyScanEnabled()) {
            return;
        }
        runAll();
    }

    /**
     * @return number of workspaces whose scan failed
     */
    public int runAll() {
        List<String> workspaces = workspaceDirectory.listWorkspaceIds();
        logger.logJobEvent(null, JobType.ANOMALY_SCAN, JobEventType.STARTED, "Anomaly scan started",
                Map.of("workspaces", workspaces.size()));
        int failures = 0;
        for (String workspaceId : workspaces) {
            try {
                List<VelocityAnomaly> anomalies = logger.timeJob(JobType.ANOMALY_SCAN, workspaceId,
                        () -> anomalyScanner.detectAndRecordAnomalies(workspaceId));
                logger.logJobEvent(workspaceId, JobType.ANOMALY_SCAN, JobEventType.COMPLETED,
                        "Anomaly scan completed",
                        Map.of("anomalies", anomalies.size()));
            } catch (RuntimeException e) {
                failures++;
                logger.logJobEvent(workspaceId, JobType.ANOMALY_SCAN, JobEventType.FAILED,
                        "Anomaly scan failed",
                        Map.of("error", String.valueOf(e.getMessage())));
                log.debug("Anomaly scan failure for workspace {}", workspaceId, e);
            }
        }
        healthIndicator.recordJobRun(JobType.ANOMALY_SCAN, workspaces.size(), failures);
        return failures;
    }
}
