package com.z254.butterfly.triage.health;

import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.correlation.CorrelationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Health indicator for the TRIAGE service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Active incident groups</li>
 *     <li>Persistence store and its latest outcome</li>
 *     <li>Last expiry sweep</li>
 * </ul>
 * Persistence failures never take the service down, since correlation continues in memory;
 * they are reported as {@code DEGRADED} until the next successful store operation.
 */
@Slf4j
@Component
public class TriageHealthIndicator implements ReactiveHealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Persistence failing, correlating in memory only");

    private final CorrelationEngine engine;
    private final TriageProperties triageProperties;

    public TriageHealthIndicator(CorrelationEngine engine, TriageProperties triageProperties) {
        this.engine = engine;
        this.triageProperties = triageProperties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();

        details.put("activeGroups", engine.activeGroupCount());
        details.put("persistenceStore", triageProperties.getPersistence().getStore());
        details.put("similarityThreshold", engine.getSettings().getSimilarityThreshold());
        details.put("maxGroupSize", engine.getSettings().getMaxGroupSize());
        details.put("lastCleanup", engine.getLastCleanupAt().map(Instant::toString).orElse("NEVER"));

        Optional<Instant> lastSuccess = engine.getLastPersistenceSuccess();
        Optional<Instant> lastFailure = engine.getLastPersistenceFailure();
        lastSuccess.ifPresent(t -> details.put("lastPersistenceSuccess", t.toString()));
        lastFailure.ifPresent(t -> details.put("lastPersistenceFailure", t.toString()));

        boolean degraded = lastFailure.isPresent()
                && (lastSuccess.isEmpty() || lastFailure.get().isAfter(lastSuccess.get()));
        if (degraded) {
            log.warn("Reporting DEGRADED health: last persistence failure at {}", lastFailure.get());
            return Health.status(DEGRADED).withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }
}
