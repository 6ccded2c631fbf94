package com.z254.butterfly.triage.domain.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.butterfly.triage.domain.model.Alert;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed alert store. Entries expire after the retention period, which should
 * outlive the longest expected group lifetime.
 */
public class InMemoryAlertRepository implements AlertRepository {

    static final long MAX_ALERTS = 100_000;

    private final Cache<String, Alert> cache;

    public InMemoryAlertRepository(Duration retention) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .maximumSize(MAX_ALERTS)
                .build();
    }

    @Override
    public void save(Alert alert) {
        cache.put(alert.getAlertId(), alert);
    }

    @Override
    public Optional<Alert> getAlert(String alertId) {
        return Optional.ofNullable(cache.getIfPresent(alertId));
    }
}
