package com.z254.butterfly.triage.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Structured logging utility for TRIAGE service.
 * <p>
 * Every entry is a human message followed by {@code data=} and a JSON object. Workspace, group
 * and job ids are also placed in the MDC for the duration of the call.
 */
@Slf4j
@Component
public class TriageStructuredLogger {

    // MDC keys
    public static final String MDC_WORKSPACE_ID = "workspaceId";
    public static final String MDC_GROUP_ID = "groupId";
    public static final String MDC_JOB = "job";

    private static final Duration SLOW_JOB_STEP = Duration.ofMinutes(1);

    private final ObjectMapper objectMapper;

    public TriageStructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Log an incident group lifecycle event.
     */
    public void logGroupEvent(String workspaceId, String groupId, GroupEventType eventType,
                              String message, Map<String, Object> details) {
        try (MDC.MDCCloseable ws = MDC.putCloseable(MDC_WORKSPACE_ID, Objects.toString(workspaceId, ""));
             MDC.MDCCloseable group = MDC.putCloseable(MDC_GROUP_ID, Objects.toString(groupId, ""))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("groupId", groupId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case CREATED, SEVERITY_ESCALATED ->
                        log.info("{} | data={}", message, toJson(logData));
                case SPIKE_CHECK_FAILED ->
                        log.warn("{} | data={}", message, toJson(logData));
                case UPDATED, DUPLICATE_IGNORED ->
                        log.debug("{} | data={}", message, toJson(logData));
                default -> log.info("{} | data={}", message, toJson(logData));
            }
        }
    }

    /**
     * Log a background job event.
     */
    public void logJobEvent(String workspaceId, JobType job, JobEventType eventType,
                            String message, Map<String, Object> details) {
        try (MDC.MDCCloseable ws = MDC.putCloseable(MDC_WORKSPACE_ID, Objects.toString(workspaceId, ""));
             MDC.MDCCloseable jobName = MDC.putCloseable(MDC_JOB, job.name())) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("job", job.name());
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case STARTED, SKIPPED ->
                        log.debug("{} | data={}", message, toJson(logData));
                case COMPLETED ->
                        log.info("{} | data={}", message, toJson(logData));
                case FAILED ->
                        log.error("{} | data={}", message, toJson(logData));
                default -> log.info("{} | data={}", message, toJson(logData));
            }
        }
    }

    /**
     * Runs one job step for a workspace and logs how long it took, whether or not it threw.
     */
    public <T> T timeJob(JobType job, String workspaceId, Supplier<T> step) {
        long startNanos = System.nanoTime();
        boolean success = false;
        try {
            T result = step.get();
            success = true;
            return result;
        } finally {
            logJobDuration(workspaceId, job, Duration.ofNanos(System.nanoTime() - startNanos), success);
        }
    }

    private void logJobDuration(String workspaceId, JobType job, Duration elapsed, boolean success) {
        try (MDC.MDCCloseable ws = MDC.putCloseable(MDC_WORKSPACE_ID, Objects.toString(workspaceId, ""));
             MDC.MDCCloseable jobName = MDC.putCloseable(MDC_JOB, job.name())) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", "DURATION");
            logData.put("job", job.name());
            logData.put("durationMs", elapsed.toMillis());
            logData.put("success", success);

            if (elapsed.compareTo(SLOW_JOB_STEP) > 0) {
                log.warn("Slow {} step took {}ms | data={}", job, elapsed.toMillis(), toJson(logData));
            } else {
                log.debug("{} step took {}ms | data={}", job, elapsed.toMillis(), toJson(logData));
            }
        }
    }

    private String toJson(Map<String, Object> logData) {
        try {
            return objectMapper.writeValueAsString(logData);
        } catch (JsonProcessingException e) {
            return logData.toString();
        }
    }

    public enum GroupEventType {
        CREATED, UPDATED, SEVERITY_ESCALATED, DUPLICATE_IGNORED,
        SPIKE_CHECK_FAILED, ANOMALY_RECORDED
    }

    public enum JobType {
        CORRELATION_MINING, ANOMALY_SCAN
    }

    public enum JobEventType {
        STARTED, SKIPPED, COMPLETED, FAILED
    }
}
