package com.z254.butterfly.triage.domain.repository;

import com.z254.butterfly.triage.domain.model.AnomalyBaseline;

import java.util.Optional;

/**
 * Baselines keyed by (workspaceId, metricKey).
 */
public interface AnomalyBaselineRepository {

    /**
     * Insert or replace the baseline for its (workspaceId, metricKey).
     */
    AnomalyBaseline upsert(AnomalyBaseline baseline);

    Optional<AnomalyBaseline> find(String workspaceId, String metricKey);
}
