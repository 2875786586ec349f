package com.z254.butterfly.triage.domain.repository;

import com.z254.butterfly.triage.domain.model.CorrelationRule;

import java.util.List;
import java.util.Optional;

/**
 * Directional correlation rules, unique per (workspaceId, sourceGroupKey, targetGroupKey).
 */
public interface CorrelationRuleRepository {

    CorrelationRule upsert(CorrelationRule rule);

    Optional<CorrelationRule> find(String workspaceId, String sourceGroupKey, String targetGroupKey);

    List<CorrelationRule> findByWorkspace(String workspaceId);

    /**
     * Rules where {@code groupKey} is source or target, highest confidence first.
     */
    List<CorrelationRule> findInvolving(String workspaceId, String groupKey, double minConfidence, int limit);
}
