package com.z254.butterfly.triage.domain.repository;

import com.z254.butterfly.triage.domain.model.IncidentGroup;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Repository abstraction for incident group persistence.
 */
public interface IncidentGroupRepository {

    /**
     * Persist the given group, assigning an ID when it has none. Existing groups are replaced.
     */
    IncidentGroup save(IncidentGroup group);

    Optional<IncidentGroup> findById(String id);

    /**
     * Find the OPEN or ACK group for a key whose {@code lastSeenAt} is at or after
     * {@code windowStart}.
     */
    Optional<IncidentGroup> findActiveByKey(String workspaceId, String groupKey, Instant windowStart);

    List<IncidentGroup> findByWorkspace(String workspaceId);

    /**
     * OPEN or ACK groups with at least {@code minCount} occurrences, most recently seen first.
     */
    List<IncidentGroup> findActiveWithMinCount(String workspaceId, long minCount, int limit);

    /**
     * Groups whose {@code firstSeenAt} lies in {@code [from, to]}.
     */
    List<IncidentGroup> findFirstSeenBetween(String workspaceId, Instant from, Instant to);

    List<IncidentGroup> findByGroupKeys(String workspaceId, Collection<String> groupKeys, int limit);

    /**
     * Run {@code work} as one atomic unit with respect to every other unit of work on the
     * same {@code (workspaceId, groupKey)}.
     */
    <T> T inKeyTransaction(String workspaceId, String groupKey, Supplier<T> work);
}
