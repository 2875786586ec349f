package com.z254.butterfly.triage.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Alert event after source-specific normalization. Immutable.
 */
@Value
@Builder(toBuilder = true)
public class NormalizedAlert {

    String source;
    String sourceEventId;
    String project;
    String environment;
    String fingerprint;
    String title;
    String message;

    /** Raw severity label as reported by the source */
    String severity;

    @Singular
    Map<String, String> tags;

    Instant occurredAt;

    /** Impacted users reported by the source, if any */
    Integer userCount;
}
