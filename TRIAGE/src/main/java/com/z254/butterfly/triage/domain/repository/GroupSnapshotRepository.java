package com.z254.butterfly.triage.domain.repository;

import com.z254.butterfly.triage.domain.model.GroupSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Key-value store for serialized incident groups.
 */
public interface GroupSnapshotRepository {

    /**
     * Store the snapshot under its group id, replacing any previous one.
     */
    void put(GroupSnapshot snapshot);

    Optional<GroupSnapshot> get(String groupId);

    /**
     * Retrieve all stored snapshots.
     */
    List<GroupSnapshot> list();

    void delete(String groupId);
}
