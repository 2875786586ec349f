package com.z254.butterfly.triage.audit;

import com.z254.butterfly.triage.domain.model.AuditFact;

/**
 * Destination for audit facts produced by the core.
 */
public interface AuditSink {

    void emit(AuditFact fact);
}
