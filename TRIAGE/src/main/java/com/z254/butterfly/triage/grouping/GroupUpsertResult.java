package com.z254.butterfly.triage.grouping;

import com.z254.butterfly.triage.domain.model.IncidentGroup;
import com.z254.butterfly.triage.domain.model.Severity;

/**
 * Outcome of a single group upsert.
 *
 * @param group            the group as committed
 * @param created          whether the alert opened a new group
 * @param previousSeverity severity before the update, null for new groups
 * @param velocityAnomaly  whether the spike check flagged the update
 */
public record GroupUpsertResult(IncidentGroup group,
                                boolean created,
                                Severity previousSeverity,
                                boolean velocityAnomaly) {

    public boolean autoEscalated() {
        return velocityAnomaly && previousSeverity != null
                && group.getSeverity() == Severity.HIGH
                && Severity.HIGH.isHigherThan(previousSeverity);
    }
}
