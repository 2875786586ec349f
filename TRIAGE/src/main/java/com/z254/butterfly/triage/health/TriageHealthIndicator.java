package com.z254.butterfly.triage.health;

import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.observability.TriageStructuredLogger.JobType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for TRIAGE service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Last run of each scheduled job and how many workspaces failed in it</li>
 *     <li>Which jobs are enabled</li>
 * </ul>
 * A job whose last run failed for every workspace it touched marks the service DOWN.
 */
@Slf4j
@Component
public class TriageHealthIndicator implements ReactiveHealthIndicator {

    private final TriageProperties triageProperties;
    private final Clock clock;

    private final Map<JobType, JobRun> lastRuns = new EnumMap<>(JobType.class);

    public TriageHealthIndicator(TriageProperties triageProperties, Clock clock) {
        this.triageProperties = triageProperties;
        this.clock = clock;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        boolean healthy = true;

        synchronized (lastRuns) {
            for (JobType job : JobType.values()) {
                String prefix = job.name().toLowerCase() + ".";
                JobRun run = lastRuns.get(job);
                if (run == null) {
                    details.put(prefix + "lastRun", "NEVER");
                    continue;
                }
                details.put(prefix + "lastRun", run.finishedAt().toString());
                details.put(prefix + "workspaces", run.workspaces());
                details.put(prefix + "failures", run.failures());
                if (run.failedEverywhere()) {
                    healthy = false;
                    details.put(prefix + "error", "Last run failed for every workspace");
                }
            }
        }

        details.put("correlationMiningEnabled", triageProperties.getScheduler().isCorrelationMiningEnabled());
        details.put("anomalyScanEnabled", triageProperties.getScheduler().isAnomalyScanEnabled());
        details.put("groupingWindow", triageProperties.getGrouping().getWindow().toString());

        if (healthy) {
            return Health.up()
                    .withDetails(details)
                    .build();
        } else {
            return Health.down()
                    .withDetails(details)
                    .build();
        }
    }

    public void recordJobRun(JobType job, int workspaces, int failures) {
        synchronized (lastRuns) {
            lastRuns.put(job, new JobRun(clock.instant(), workspaces, failures));
        }
        if (failures > 0) {
            log.warn("Job {} finished with {} of {} workspaces failing", job, failures, workspaces);
        }
    }

    private record JobRun(Instant finishedAt, int workspaces, int failures) {

        boolean failedEverywhere() {
            return workspaces > 0 && failures >= workspaces;
        }
    }
}
