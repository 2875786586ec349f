package com.z254.butterfly.triage.correlation;

import com.z254.butterfly.triage.domain.model.IncidentGroup;

/**
 * A group related to a target incident, with its score and informational reason tags.
 */
public record CorrelatedIncident(IncidentGroup group, double score, String reason) {
}
