package com.z254.butterfly.triage.domain.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.triage.domain.model.Alert;
import com.z254.butterfly.triage.exception.PersistenceException;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed alert store, one JSON string per alert under {@code <prefix>alert:<id>}.
 */
public class RedisAlertRepository implements AlertRepository {

    static final String ALERT_SEGMENT = "alert:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration timeout;
    private final Duration retention;

    public RedisAlertRepository(ReactiveRedisTemplate<String, String> redisTemplate,
                                ObjectMapper objectMapper,
                                String keyPrefix,
                                Duration timeout,
                                Duration retention) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.timeout = timeout;
        this.retention = retention;
    }

    @Override
    public void save(Alert alert) {
        String json;
        try {
            json = objectMapper.writeValueAsString(alert);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize alert " + alert.getAlertId(), e);
        }
        try {
            redisTemplate.opsForValue().set(keyPrefix + ALERT_SEGMENT + alert.getAlertId(), json, retention)
                    .block(timeout);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to store alert " + alert.getAlertId(), e);
        }
    }

    @Override
    public Optional<Alert> getAlert(String alertId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(keyPrefix + ALERT_SEGMENT + alertId).block(timeout);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to read alert " + alertId, e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Alert.class));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize alert " + alertId, e);
        }
    }
}
