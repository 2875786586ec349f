package com.z254.butterfly.triage.domain.repository;

import com.z254.butterfly.triage.domain.model.AnomalyBaseline;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryAnomalyBaselineRepository implements AnomalyBaselineRepository {

    private final Map<String, AnomalyBaseline> store = new ConcurrentHashMap<>();

    @Override
    public AnomalyBaseline upsert(AnomalyBaseline baseline) {
        store.put(key(baseline.getWorkspaceId(), baseline.getMetricKey()), copy(baseline));
        return copy(baseline);
    }

    @Override
    public Optional<AnomalyBaseline> find(String workspaceId, String metricKey) {
        return Optional.ofNullable(store.get(key(workspaceId, metricKey))).map(this::copy);
    }

    private AnomalyBaseline copy(AnomalyBaseline baseline) {
        return baseline.toBuilder().build();
    }

    private String key(String workspaceId, String metricKey) {
        return workspaceId + "|" + metricKey;
    }
}
