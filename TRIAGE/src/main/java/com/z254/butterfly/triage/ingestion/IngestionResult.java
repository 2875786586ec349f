package com.z254.butterfly.triage.ingestion;

import com.z254.butterfly.triage.domain.model.IncidentGroup;

/**
 * Outcome of ingesting one alert. Duplicates carry no group and no event.
 */
public record IngestionResult(boolean duplicate, IncidentGroup group, String eventId, boolean groupCreated) {

    static IngestionResult duplicateOf() {
        return new IngestionResult(true, null, null, false);
    }
}
