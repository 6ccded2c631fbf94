package com.z254.butterfly.triage.domain.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.triage.domain.model.GroupSnapshot;
import com.z254.butterfly.triage.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed snapshot store. Each group is a JSON string under {@code <prefix>group:<id>}
 * whose key TTL follows the group's expiry, so Redis drops expired groups on its own.
 */
@Slf4j
public class RedisGroupSnapshotRepository implements GroupSnapshotRepository {

    static final String GROUP_SEGMENT = "group:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration timeout;
    private final Clock clock;

    public RedisGroupSnapshotRepository(ReactiveRedisTemplate<String, String> redisTemplate,
                                        ObjectMapper objectMapper,
                                        String keyPrefix,
                                        Duration timeout,
                                        Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public void put(GroupSnapshot snapshot) {
        String key = key(snapshot.getGroupId());
        Duration ttl = Duration.between(clock.instant(), snapshot.getExpiresAt());
        if (ttl.isZero() || ttl.isNegative()) {
            delete(snapshot.getGroupId());
            return;
        }
        String json = write(snapshot);
        try {
            redisTemplate.opsForValue().set(key, json, ttl).block(timeout);
            log.debug("Stored group {} with ttl {}", snapshot.getGroupId(), ttl);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to store group " + snapshot.getGroupId(), e);
        }
    }

    @Override
    public Optional<GroupSnapshot> get(String groupId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(key(groupId)).block(timeout);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to read group " + groupId, e);
        }
        return Optional.ofNullable(json).map(this::read);
    }

    @Override
    public List<GroupSnapshot> list() {
        List<String> values;
        try {
            values = redisTemplate.keys(keyPrefix + GROUP_SEGMENT + "*")
                    .flatMap(k -> redisTemplate.opsForValue().get(k))
                    .collectList()
                    .block(timeout);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to list groups", e);
        }
        if (values == null) {
            return List.of();
        }
        List<GroupSnapshot> snapshots = new ArrayList<>(values.size());
        for (String value : values) {
            try {
                snapshots.add(read(value));
            } catch (PersistenceException e) {
                log.warn("Skipping unreadable group snapshot: {}", e.getCause().getMessage());
            }
        }
        return snapshots;
    }

    @Override
    public void delete(String groupId) {
        try {
            redisTemplate.delete(key(groupId)).block(timeout);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to delete group " + groupId, e);
        }
    }

    private String key(String groupId) {
        return keyPrefix + GROUP_SEGMENT + groupId;
    }

    private String write(GroupSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize group " + snapshot.getGroupId(), e);
        }
    }

    private GroupSnapshot read(String json) {
        try {
            return objectMapper.readValue(json, GroupSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize group snapshot", e);
        }
    }
}
