package com.z254.butterfly.triage.domain.repository;

import java.util.List;
import java.util.Optional;

/**
 * Tenant enumeration and membership lookups used by scheduled jobs and audit emission.
 */
public interface WorkspaceDirectory {

    /**
     * Makes the workspace visible to {@link #listWorkspaceIds()}. Idempotent.
     */
    void registerWorkspace(String workspaceId);

    List<String> listWorkspaceIds();

    /**
     * Any user of the workspace, used as the acting user for system-initiated changes.
     */
    Optional<String> findAnyMemberId(String workspaceId);
}
