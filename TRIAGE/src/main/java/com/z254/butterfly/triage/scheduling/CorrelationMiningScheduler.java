package com.z254.butterfly.triage.scheduling;

import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.correlation.CorrelationRuleMiner;
import com.z254.butterfly.triage.correlation.MiningSummary;
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
 * Runs correlation rule mining for every workspace on a fixed cadence.
 * A failing workspace is logged and the run moves on.
 */
@Slf4j
@Component
public class CorrelationMiningScheduler {

    private final CorrelationRuleMiner ruleMiner;
    private final WorkspaceDirectory workspaceDirectory;
    private final TriageProperties triageProperties;
    private final TriageHealthIndicator healthIndicator;
    private final TriageStructuredLogger logger;

    public CorrelationMiningScheduler(CorrelationRuleMiner ruleMiner,
                                      WorkspaceDirectory workspaceDirectory,
                                      TriageProperties triageProperties,
                                      TriageHealthIndicator healthIndicator,
                                      TriageStructuredLogger logger) {
        this.ruleMiner = ruleMiner;
        this.workspaceDirectory = workspaceDirectory;
        this.triageProperties = triageProperties;
        this.healthIndicator = healthIndicator;
        this.logger = logger;
    }

    @Scheduled(fixedDelayString = "${triage.scheduler.correlation-mining-interval:PT1H}",
            initialDelayString = "${triage.scheduler.correlation-mining-interval:PT1H}")
    public void scheduledRun() {
        if (!triageProperties.getScheduler().isCorrelationMiningEnabled()) {
            return;
        }
        runAll();
    }

    /**
     * @return number of workspaces whose mining failed
     */
    public int runAll() {
        List<String> workspaces = workspaceDirectory.listWorkspaceIds();
        logger.logJobEvent(null, JobType.CORRELATION_MINING, JobEventType.STARTED, "Correlation mining started",
                Map.of("workspaces", workspaces.size()));
        int failures = 0;
        for (String workspaceId : workspaces) {
            try {
                MiningSummary summary = logger.timeJob(JobType.CORRELATION_MINING, workspaceId,
                        () -> ruleMiner.analyzeCorrelations(workspaceId));
                if (summary.skipped()) {
                    logger.logJobEvent(workspaceId, JobType.CORRELATION_MINING, JobEventType.SKIPPED,
                            "Not enough events to mine correlations",
                            Map.of("eventsScanned", summary.eventsScanned()));
                } else {
                    logger.logJobEvent(workspaceId, JobType.CORRELATION_MINING, JobEventType.COMPLETED,
                            "Correlation mining completed",
                            Map.of("eventsScanned", summary.eventsScanned(),
                                    "pairsCounted", summary.pairsCounted(),
                                    "rulesUpserted", summary.rulesUpserted()));
                }
            } catch (RuntimeException e) {
                failures++;
                logger.logJobEvent(workspaceId, JobType.CORRELATION_MINING, JobEventType.FAILED,
                        "Correlation mining failed",
                        Map.of("error", String.valueOf(e.getMessage())));
                log.debug("Correlation mining failure for workspace {}", workspaceId, e);
            }
        }
        healthIndicator.recordJobRun(JobType.CORRELATION_MINING, workspaces.size(), failures);
        return failures;
    }
}
