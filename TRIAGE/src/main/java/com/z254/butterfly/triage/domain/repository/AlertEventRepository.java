package com.z254.butterfly.triage.domain.repository;

import com.z254.butterfly.triage.domain.model.AlertEvent;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store of ingested alert events.
 */
public interface AlertEventRepository {

    /**
     * Append an event, assigning an ID when it has none.
     */
    AlertEvent append(AlertEvent event);

    boolean existsBySourceEventId(String workspaceId, String sourceEventId);

    /**
     * All events of a workspace at or after {@code since}, oldest first.
     */
    List<AlertEvent> findByWorkspaceSince(String workspaceId, Instant since);

    /**
     * Events of one group in {@code [from, to)}, oldest first.
     */
    List<AlertEvent> findByGroupBetween(String workspaceId, String groupId, Instant from, Instant to);
}
