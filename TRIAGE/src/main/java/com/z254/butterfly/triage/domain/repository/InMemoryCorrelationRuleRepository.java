package com.z254.butterfly.triage.domain.repository;

import com.z254.butterfly.triage.domain.model.CorrelationRule;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryCorrelationRuleRepository implements CorrelationRuleRepository {

    private final Map<String, CorrelationRule> store = new ConcurrentHashMap<>();

    @Override
    public CorrelationRule upsert(CorrelationRule rule) {
        store.put(key(rule.getWorkspaceId(), rule.getSourceGroupKey(), rule.getTargetGroupKey()), copy(rule));
        return copy(rule);
    }

    @Override
    public Optional<CorrelationRule> find(String workspaceId, String sourceGroupKey, String targetGroupKey) {
        return Optional.ofNullable(store.get(key(workspaceId, sourceGroupKey, targetGroupKey))).map(this::copy);
    }

    @Override
    public List<CorrelationRule> findByWorkspace(String workspaceId) {
        return store.values().stream()
                .filter(r -> r.getWorkspaceId().equals(workspaceId))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<CorrelationRule> findInvolving(String workspaceId, String groupKey, double minConfidence, int limit) {
        return store.values().stream()
                .filter(r -> r.getWorkspaceId().equals(workspaceId))
                .filter(r -> r.involves(groupKey))
                .filter(r -> r.getConfidence() >= minConfidence)
                .sorted(Comparator.comparingDouble(CorrelationRule::getConfidence).reversed())
                .limit(limit)
                .map(this::copy)
                .collect(Collectors.toList());
    }

    private CorrelationRule copy(CorrelationRule rule) {
        return rule.toBuilder().build();
    }

    private String key(String workspaceId, String source, String target) {
        return workspaceId + "|" + source + "::" + target;
    }
}
