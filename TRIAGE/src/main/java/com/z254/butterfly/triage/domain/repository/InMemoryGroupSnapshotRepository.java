package com.z254.butterfly.triage.domain.repository;

import com.z254.butterfly.triage.domain.model.GroupSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local snapshot store. Groups survive engine restarts but not JVM restarts.
 */
public class InMemoryGroupSnapshotRepository implements GroupSnapshotRepository {

    private final Map<String, GroupSnapshot> store = new ConcurrentHashMap<>();

    @Override
    public void put(GroupSnapshot snapshot) {
        store.put(snapshot.getGroupId(), snapshot);
    }

    @Override
    public Optional<GroupSnapshot> get(String groupId) {
        return Optional.ofNullable(store.get(groupId));
    }

    @Override
    public List<GroupSnapshot> list() {
        return new ArrayList<>(store.values());
    }

    @Override
    public void delete(String groupId) {
        store.remove(groupId);
    }
}
