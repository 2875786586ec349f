package com.z254.butterfly.triage.domain.repository;

import com.z254.butterfly.triage.domain.model.AlertCorrelation;

import java.util.List;

/**
 * Instance-level correlation edges, unique per (primaryAlertId, relatedAlertId).
 */
public interface AlertCorrelationRepository {

    AlertCorrelation upsert(AlertCorrelation correlation);

    /**
     * Edges where the group is primary or related, highest score first.
     */
    List<AlertCorrelation> findInvolving(String groupId);
}
