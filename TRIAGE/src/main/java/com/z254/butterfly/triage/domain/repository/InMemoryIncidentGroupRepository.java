package com.z254.butterfly.triage.domain.repository;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.z254.butterfly.triage.domain.model.IncidentGroup;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Basic in-memory repository used until a durable store is wired up.
 * <p>
 * Groups are copied on the way in and out so callers only observe committed state.
 */
@Repository
public class InMemoryIncidentGroupRepository implements IncidentGroupRepository {

    private final Map<String, IncidentGroup> store = new ConcurrentHashMap<>();

    // Weak values: a lock lives as long as some thread holds a reference to it.
    private final LoadingCache<String, ReentrantLock> keyLocks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    @Override
    public IncidentGroup save(IncidentGroup group) {
        if (group.getId() == null) {
            group.setId(UUID.randomUUID().toString());
        }
        store.put(group.getId(), copy(group));
        return group;
    }

    @Override
    public Optional<IncidentGroup> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(this::copy);
    }

    @Override
    public Optional<IncidentGroup> findActiveByKey(String workspaceId, String groupKey, Instant windowStart) {
        return store.values().stream()
                .filter(g -> g.getWorkspaceId().equals(workspaceId))
                .filter(g -> g.getGroupKey().equals(groupKey))
                .filter(g -> g.getStatus().isActive())
                .filter(g -> !g.getLastSeenAt().isBefore(windowStart))
                .max(Comparator.comparing(IncidentGroup::getLastSeenAt))
                .map(this::copy);
    }

    @Override
    public List<IncidentGroup> findByWorkspace(String workspaceId) {
        return store.values().stream()
                .filter(g -> g.getWorkspaceId().equals(workspaceId))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<IncidentGroup> findActiveWithMinCount(String workspaceId, long minCount, int limit) {
        return store.values().stream()
                .filter(g -> g.getWorkspaceId().equals(workspaceId))
                .filter(g -> g.getStatus().isActive())
                .filter(g -> g.getCount() >= minCount)
                .sorted(Comparator.comparing(IncidentGroup::getLastSeenAt).reversed())
                .limit(limit)
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<IncidentGroup> findFirstSeenBetween(String workspaceId, Instant from, Instant to) {
        return store.values().stream()
                .filter(g -> g.getWorkspaceId().equals(workspaceId))
                .filter(g -> !g.getFirstSeenAt().isBefore(from) && !g.getFirstSeenAt().isAfter(to))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<IncidentGroup> findByGroupKeys(String workspaceId, Collection<String> groupKeys, int limit) {
        return store.values().stream()
                .filter(g -> g.getWorkspaceId().equals(workspaceId))
                .filter(g -> groupKeys.contains(g.getGroupKey()))
                .limit(limit)
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public <T> T inKeyTransaction(String workspaceId, String groupKey, Supplier<T> work) {
        ReentrantLock lock = keyLocks.get(workspaceId + "|" + groupKey);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private IncidentGroup copy(IncidentGroup group) {
        return group.toBuilder().build();
    }
}
