package com.z254.butterfly.triage.domain.repository;

import com.z254.butterfly.triage.domain.model.AlertEvent;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

/**
 * In-memory event log partitioned by workspace.
 */
@Repository
public class InMemoryAlertEventRepository implements AlertEventRepository {

    private final Map<String, Queue<AlertEvent>> eventsByWorkspace = new ConcurrentHashMap<>();

    @Override
    public AlertEvent append(AlertEvent event) {
        if (event.getId() == null) {
            event.setId(UUID.randomUUID().toString());
        }
        eventsByWorkspace.computeIfAbsent(event.getWorkspaceId(), k -> new ConcurrentLinkedQueue<>())
                .add(event);
        return event;
    }

    @Override
    public boolean existsBySourceEventId(String workspaceId, String sourceEventId) {
        if (sourceEventId == null) {
            return false;
        }
        return eventsByWorkspace.getOrDefault(workspaceId, new ConcurrentLinkedQueue<>()).stream()
                .anyMatch(e -> sourceEventId.equals(e.getSourceEventId()));
    }

    @Override
    public List<AlertEvent> findByWorkspaceSince(String workspaceId, Instant since) {
        return eventsByWorkspace.getOrDefault(workspaceId, new ConcurrentLinkedQueue<>()).stream()
                .filter(e -> !e.getOccurredAt().isBefore(since))
                .sorted(Comparator.comparing(AlertEvent::getOccurredAt))
                .collect(Collectors.toList());
    }

    @Override
    public List<AlertEvent> findByGroupBetween(String workspaceId, String groupId, Instant from, Instant to) {
        return eventsByWorkspace.getOrDefault(workspaceId, new ConcurrentLinkedQueue<>()).stream()
                .filter(e -> groupId.equals(e.getGroupId()))
                .filter(e -> !e.getOccurredAt().isBefore(from) && e.getOccurredAt().isBefore(to))
                .sorted(Comparator.comparing(AlertEvent::getOccurredAt))
                .collect(Collectors.toList());
    }
}
