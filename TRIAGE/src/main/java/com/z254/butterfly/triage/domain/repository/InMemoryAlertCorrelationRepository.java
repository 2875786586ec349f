package com.z254.butterfly.triage.domain.repository;

import com.z254.butterfly.triage.domain.model.AlertCorrelation;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryAlertCorrelationRepository implements AlertCorrelationRepository {

    private final Map<String, AlertCorrelation> store = new ConcurrentHashMap<>();

    @Override
    public AlertCorrelation upsert(AlertCorrelation correlation) {
        store.put(correlation.getPrimaryAlertId() + "::" + correlation.getRelatedAlertId(), copy(correlation));
        return copy(correlation);
    }

    @Override
    public List<AlertCorrelation> findInvolving(String groupId) {
        return store.values().stream()
                .filter(c -> groupId.equals(c.getPrimaryAlertId()) || groupId.equals(c.getRelatedAlertId()))
                .sorted(Comparator.comparingDouble(AlertCorrelation::getScore).reversed())
                .map(this::copy)
                .collect(Collectors.toList());
    }

    private AlertCorrelation copy(AlertCorrelation correlation) {
        return correlation.toBuilder().build();
    }
}
