package com.z254.butterfly.triage.observability;

import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for the TRIAGE service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Alert intake (processed, rejected, suppressed)</li>
 *     <li>Group lifecycle (created, expired, active, size)</li>
 *     <li>Root-cause analysis (latency, candidates per run)</li>
 *     <li>Persistence failures by operation</li>
 * </ul>
 */
@Component
public class TriageMetrics {

    private final MeterRegistry meterRegistry;

    // Alert metrics
    @Getter
    private final Counter alertsProcessed;
    @Getter
    private final Counter alertsRejected;
    @Getter
    private final Counter alertsSuppressed;

    // Group metrics
    @Getter
    private final Counter groupsCreated;
    @Getter
    private final Counter groupsExpired;
    private final DistributionSummary groupSize;
    private final AtomicInteger activeGroups;

    // RCA metrics
    @Getter
    private final Counter rcaCompleted;
    private final Timer rcaLatency;
    private final DistributionSummary rootCausesIdentified;

    private final Map<String, Counter> persistenceFailures = new ConcurrentHashMap<>();

    public TriageMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.alertsProcessed = Counter.builder("triage.alerts.processed")
                .description("Alerts assigned to a group")
                .register(meterRegistry);
        this.alertsRejected = Counter.builder("triage.alerts.rejected")
                .description("Alerts rejected by validation")
                .register(meterRegistry);
        this.alertsSuppressed = Counter.builder("triage.alerts.suppressed")
                .description("Alerts dropped as redundant")
                .register(meterRegistry);

        this.groupsCreated = Counter.builder("triage.groups.created")
                .description("Incident groups created")
                .register(meterRegistry);
        this.groupsExpired = Counter.builder("triage.groups.expired")
                .description("Incident groups removed after expiry")
                .register(meterRegistry);
        this.groupSize = DistributionSummary.builder("triage.groups.size")
                .description("Group size after each insertion")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);
        this.activeGroups = meterRegistry.gauge("triage.groups.active", new AtomicInteger(0));

        this.rcaCompleted = Counter.builder("triage.rca.completed")
                .description("Root-cause analyses completed")
                .register(meterRegistry);
        this.rcaLatency = Timer.builder("triage.rca.latency")
                .description("Root-cause analysis latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        this.rootCausesIdentified = DistributionSummary.builder("triage.rca.root_causes")
                .description("Root causes identified per analysis")
                .register(meterRegistry);
    }

    // ========== Alert Methods ==========

    public void recordAlertProcessed(int resultingGroupSize) {
        alertsProcessed.increment();
        groupSize.record(resultingGroupSize);
    }

    public void recordAlertRejected() {
        alertsRejected.increment();
    }

    public void recordAlertSuppressed() {
        alertsSuppressed.increment();
    }

    // ========== Group Methods ==========

    public void recordGroupCreated() {
        groupsCreated.increment();
    }

    public void recordGroupsExpired(int count) {
        groupsExpired.increment(count);
    }

    public void setActiveGroups(int count) {
        activeGroups.set(count);
    }

    // ========== RCA Methods ==========

    public Timer.Sample startRcaTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordRcaCompleted(Timer.Sample sample, int rootCauseCount) {
        sample.stop(rcaLatency);
        rcaCompleted.increment();
        rootCausesIdentified.record(rootCauseCount);
    }

    // ========== Persistence Methods ==========

    public void recordPersistenceFailure(String operation) {
        persistenceFailures.computeIfAbsent(operation, op ->
                Counter.builder("triage.persistence.failures")
                        .tag("operation", op)
                        .description("Failed store operations")
                        .register(meterRegistry))
                .increment();
    }
}
