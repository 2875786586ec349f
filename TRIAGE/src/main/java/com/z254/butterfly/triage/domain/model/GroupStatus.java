package com.z254.butterfly.triage.domain.model;

/**
 * Incident group lifecycle state.
 */
public enum GroupStatus {
    OPEN,
    ACK,
    RESOLVED;

    /**
     * Whether new matching alerts may still be merged into a group in this state.
     */
    public boolean isActive() {
        return this == OPEN || this == ACK;
    }
}
