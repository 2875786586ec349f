package com.z254.butterfly.triage.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.triage.observability.TriageStructuredLogger.GroupEventType;
import com.z254.butterfly.triage.observability.TriageStructuredLogger.JobEventType;
import com.z254.butterfly.triage.observability.TriageStructuredLogger.JobType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TriageStructuredLoggerTest {

    private final TriageStructuredLogger logger = new TriageStructuredLogger(new ObjectMapper());

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void groupAndJobEventsLeaveNoMdcBehind() {
        logger.logGroupEvent("ws-1", "group-1", GroupEventType.CREATED, "Group created",
                Map.of("severity", "HIGH"));
        logger.logGroupEvent("ws-1", null, GroupEventType.DUPLICATE_IGNORED, "Duplicate source event ignored", null);
        logger.logJobEvent(null, JobType.ANOMALY_SCAN, JobEventType.STARTED, "Anomaly scan started",
                Map.of("workspaces", 0));

        assertThat(MDC.get(TriageStructuredLogger.MDC_WORKSPACE_ID)).isNull();
        assertThat(MDC.get(TriageStructuredLogger.MDC_GROUP_ID)).isNull();
        assertThat(MDC.get(TriageStructuredLogger.MDC_JOB)).isNull();
    }

    @Test
    void timeJobReturnsTheStepResult() {
        String result = logger.timeJob(JobType.CORRELATION_MINING, "ws-1", () -> "mined");

        assertThat(result).isEqualTo("mined");
        assertThat(MDC.get(TriageStructuredLogger.MDC_JOB)).isNull();
    }

    @Test
    void timeJobPropagatesStepFailure() {
        assertThatThrownBy(() -> logger.timeJob(JobType.ANOMALY_SCAN, "ws-1", () -> {
            throw new IllegalStateException("event store down");
        })).isInstanceOf(IllegalStateException.class).hasMessage("event store down");

        assertThat(MDC.get(TriageStructuredLogger.MDC_WORKSPACE_ID)).isNull();
    }
}
