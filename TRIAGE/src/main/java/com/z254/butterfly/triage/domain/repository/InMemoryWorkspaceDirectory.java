package com.z254.butterfly.triage.domain.repository;

import com.z254.butterfly.triage.config.TriageProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * Workspaces become known either through {@code triage.directory.members} at startup or the
 * first time an alert is ingested for them.
 */
@Repository
public class InMemoryWorkspaceDirectory implements WorkspaceDirectory {

    private final Map<String, Set<String>> membersByWorkspace = new ConcurrentHashMap<>();

    public InMemoryWorkspaceDirectory() {
    }

    @Autowired
    public InMemoryWorkspaceDirectory(TriageProperties triageProperties) {
        triageProperties.getDirectory().getMembers()
                .forEach((workspaceId, userIds) -> userIds.forEach(userId -> addMember(workspaceId, userId)));
    }

    @Override
    public void registerWorkspace(String workspaceId) {
        membersByWorkspace.computeIfAbsent(workspaceId, k -> new ConcurrentSkipListSet<>());
    }

    public void addMember(String workspaceId, String userId) {
        membersByWorkspace.computeIfAbsent(workspaceId, k -> new ConcurrentSkipListSet<>()).add(userId);
    }

    @Override
    public List<String> listWorkspaceIds() {
        return new ArrayList<>(membersByWorkspace.keySet());
    }

    @Override
    public Optional<String> findAnyMemberId(String workspaceId) {
        return membersByWorkspace.getOrDefault(workspaceId, Set.of()).stream().findFirst();
    }
}
