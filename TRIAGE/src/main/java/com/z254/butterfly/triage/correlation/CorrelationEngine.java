package com.z254.butterfly.triage.correlation;

import com.z254.butterfly.triage.domain.model.Alert;
import com.z254.butterfly.triage.domain.model.GroupSnapshot;
import com.z254.butterfly.triage.domain.model.GroupSummary;
import com.z254.butterfly.triage.domain.model.IncidentGroup;
import com.z254.butterfly.triage.domain.repository.AlertRepository;
import com.z254.butterfly.triage.domain.repository.GroupSnapshotRepository;
import com.z254.butterfly.triage.exception.InvalidAlertException;
import com.z254.butterfly.triage.exception.TriageValidationException;
import com.z254.butterfly.triage.ingest.AlertValidator;
import com.z254.butterfly.triage.observability.TriageMetrics;
import com.z254.butterfly.triage.observability.TriageStructuredLogger;
import com.z254.butterfly.triage.observability.TriageStructuredLogger.AlertEventType;
import com.z254.butterfly.triage.observability.TriageStructuredLogger.GroupEventType;
import com.z254.butterfly.triage.rca.CausalHeuristic;
import com.z254.butterfly.triage.rca.RootCauseAnalyzer;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Assigns incoming alerts to incident groups and keeps root causes current.
 * <p>
 * The engine exclusively owns its groups. Every operation that reads or mutates the group map
 * runs under a single lock, so matching an alert and creating its group are atomic with respect
 * to other insertions.
 * <p>
 * Persistence is best-effort. Store writes are captured under the lock and performed after it is
 * released, in the order they were captured, so a slow or failing store never stalls correlation.
 * Failures are logged and counted and correlation continues on in-memory state.
 */
@Slf4j
public class CorrelationEngine {

    private final CorrelationSettings settings;
    private final GroupSnapshotRepository snapshotRepository;
    private final AlertRepository alertRepository;
    private final Clock clock;
    private final TriageMetrics metrics;
    private final TriageStructuredLogger structuredLogger;

    private final SimilarityScorer scorer;
    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final AlertValidator validator = new AlertValidator();

    // Insertion order decides ties between equally similar groups
    private final Map<String, IncidentGroup> groups = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    // Writes captured under the lock, drained in FIFO order under the write lock
    private final Queue<Runnable> pendingWrites = new ConcurrentLinkedQueue<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile Instant lastCleanupAt;
    private volatile Instant lastPersistenceSuccess;
    private volatile Instant lastPersistenceFailure;

    public CorrelationEngine(CorrelationSettings settings,
                             GroupSnapshotRepository snapshotRepository,
                             AlertRepository alertRepository,
                             Clock clock,
                             TriageMetrics metrics,
                             TriageStructuredLogger structuredLogger) {
        this.settings = settings.validate();
        this.snapshotRepository = snapshotRepository;
        this.alertRepository = alertRepository;
        this.clock = clock;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.scorer = new SimilarityScorer(settings.getTimeWindow());
        this.rootCauseAnalyzer = new RootCauseAnalyzer(new CausalHeuristic(settings.getTimeWindow()));
    }

    /**
     * Best group for an alert. {@code groupId} is null when no active, non-full group exists.
     */
    public record GroupMatch(String groupId, double score) {

        static GroupMatch none() {
            return new GroupMatch(null, 0.0);
        }

        public boolean isPresent() {
            return groupId != null;
        }
    }

    // ========== Correlation ==========

    /**
     * Route an alert to the most similar group, or to a new group when no group reaches the
     * similarity threshold.
     *
     * @return id of the group now holding the alert
     * @throws InvalidAlertException if the alert lacks required fields
     */
    public String processAlert(Alert alert) {
        validate(alert);
        lock.lock();
        try {
            return correlate(alert);
        } finally {
            lock.unlock();
            flushWrites();
        }
    }

    /**
     * Drop the alert if an active suppressing group considers it redundant, otherwise process
     * it. The check and the assignment happen under one lock acquisition.
     *
     * @return id of the group now holding the alert, empty if the alert was suppressed
     * @throws InvalidAlertException if the alert lacks required fields
     */
    public Optional<String> processUnlessSuppressed(Alert alert) {
        validate(alert);
        lock.lock();
        try {
            if (suppress(alert)) {
                return Optional.empty();
            }
            return Optional.of(correlate(alert));
        } finally {
            lock.unlock();
            flushWrites();
        }
    }

    /**
     * Batch entry point. Expired groups are swept first, alerts are processed in the given
     * order, and invalid alerts are skipped without aborting the batch.
     *
     * @return active groups keyed by id, in creation order
     */
    public Map<String, IncidentGroup> correlateAlerts(Collection<Alert> alerts) {
        return correlateAlerts(alerts, false);
    }

    /**
     * @param suppressRedundant drop alerts that an active suppressing group considers redundant
     */
    public Map<String, IncidentGroup> correlateAlerts(Collection<Alert> alerts, boolean suppressRedundant) {
        lock.lock();
        try {
            cleanupOldGroups();

            for (Alert alert : alerts) {
                try {
                    validate(alert);
                } catch (InvalidAlertException e) {
                    log.debug("Skipping invalid alert in batch: {}", e.getMessage());
                    continue;
                }
                if (!suppressRedundant || !suppress(alert)) {
                    correlate(alert);
                }
            }

            for (IncidentGroup group : groups.values()) {
                if (group.isActive() && group.getRootCauses().isEmpty()) {
                    List<Alert> rootCauses = identifyRootCauses(group);
                    if (!rootCauses.isEmpty()) {
                        group.setRootCauses(rootCauses);
                    }
                }
            }
            return getAllGroups();
        } finally {
            lock.unlock();
            flushWrites();
        }
    }

    /**
     * Scan active groups below the size limit for the highest group similarity. The first
     * group wins ties.
     */
    public GroupMatch findSimilarGroup(Alert alert) {
        lock.lock();
        try {
            GroupMatch best = GroupMatch.none();
            for (IncidentGroup group : groups.values()) {
                if (!group.isActive() || group.size() >= settings.getMaxGroupSize()) {
                    continue;
                }
                double score = calculateGroupSimilarity(alert, group);
                if (!best.isPresent() || score > best.score()) {
                    best = new GroupMatch(group.getGroupId(), score);
                }
            }
            return best;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Maximum pairwise similarity between the alert and any member, 0.0 for an empty group.
     */
    public double calculateGroupSimilarity(Alert alert, IncidentGroup group) {
        double max = 0.0;
        for (Alert member : group.getAlerts()) {
            max = Math.max(max, scorer.score(alert, member));
        }
        return max;
    }

    public List<Alert> identifyRootCauses(IncidentGroup group) {
        Timer.Sample sample = metrics.startRcaTimer();
        List<Alert> rootCauses = rootCauseAnalyzer.identifyRootCauses(group);
        metrics.recordRcaCompleted(sample, rootCauses.size());
        if (!rootCauses.isEmpty()) {
            structuredLogger.logGroupEvent(group.getGroupId(), GroupEventType.ROOT_CAUSES_IDENTIFIED,
                    "Identified root causes", Map.of(
                            "rootCauseIds", rootCauses.stream().map(Alert::getAlertId).toList(),
                            "groupSize", group.size()));
        }
        return rootCauses;
    }

    /**
     * @param groupId group to check, or {@code null} to check every active group
     */
    public boolean shouldSuppressAlert(Alert alert, String groupId) {
        lock.lock();
        try {
            if (groupId != null) {
                return getGroup(groupId).map(group -> group.shouldSuppress(alert)).orElse(false);
            }
            return groups.values().stream()
                    .filter(IncidentGroup::isActive)
                    .anyMatch(group -> group.shouldSuppress(alert));
        } finally {
            lock.unlock();
        }
    }

    // ========== Group access ==========

    /**
     * @return the group if it exists and has not expired
     */
    public Optional<IncidentGroup> getGroup(String groupId) {
        lock.lock();
        try {
            return Optional.ofNullable(groups.get(groupId)).filter(IncidentGroup::isActive);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Active groups keyed by id, in creation order. The returned map is a detached copy.
     */
    public Map<String, IncidentGroup> getAllGroups() {
        lock.lock();
        try {
            Map<String, IncidentGroup> active = new LinkedHashMap<>();
            groups.forEach((id, group) -> {
                if (group.isActive()) {
                    active.put(id, group);
                }
            });
            return Collections.unmodifiableMap(active);
        } finally {
            lock.unlock();
        }
    }

    public Optional<GroupSummary> summarize(String groupId) {
        lock.lock();
        try {
            return getGroup(groupId).map(IncidentGroup::summary);
        } finally {
            lock.unlock();
        }
    }

    public List<GroupSummary> getGroupSummaries() {
        lock.lock();
        try {
            return getAllGroups().values().stream().map(IncidentGroup::summary).toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enable or disable suppression on an active group.
     *
     * @return false if no active group has the id
     */
    public boolean setSuppression(String groupId, boolean enabled) {
        lock.lock();
        try {
            Optional<IncidentGroup> group = getGroup(groupId);
            if (group.isEmpty()) {
                return false;
            }
            group.get().setSuppressionEnabled(enabled);
            structuredLogger.logGroupEvent(groupId, GroupEventType.SUPPRESSION_CHANGED,
                    "Suppression " + (enabled ? "enabled" : "disabled"), Map.of("enabled", enabled));
            GroupSnapshot snapshot = group.get().toSnapshot();
            pendingWrites.add(() -> putSnapshot(snapshot, "set_suppression"));
            return true;
        } finally {
            lock.unlock();
            flushWrites();
        }
    }

    public int activeGroupCount() {
        return getAllGroups().size();
    }

    // ========== Maintenance ==========

    /**
     * Remove expired groups and their stored snapshots.
     *
     * @return number of groups removed
     */
    public int cleanupOldGroups() {
        lock.lock();
        try {
            List<String> expired = new ArrayList<>();
            Iterator<IncidentGroup> it = groups.values().iterator();
            while (it.hasNext()) {
                IncidentGroup group = it.next();
                if (!group.isActive()) {
                    it.remove();
                    expired.add(group.getGroupId());
                }
            }

            for (String groupId : expired) {
                pendingWrites.add(() -> deleteSnapshot(groupId));
            }

            lastCleanupAt = clock.instant();
            updateActiveGauge();
            if (!expired.isEmpty()) {
                metrics.recordGroupsExpired(expired.size());
                structuredLogger.logGroupEvent(null, GroupEventType.GROUPS_EXPIRED,
                        "Removed expired groups", Map.of("count", expired.size(), "remaining", groups.size()));
            }
            return expired.size();
        } finally {
            lock.unlock();
            flushWrites();
        }
    }

    /**
     * Write every active group to the snapshot store and delete snapshots of inactive ones.
     *
     * @return true if every store operation succeeded
     */
    public boolean saveGroups() {
        AtomicBoolean success = new AtomicBoolean(true);
        AtomicInteger saved = new AtomicInteger();
        lock.lock();
        try {
            for (IncidentGroup group : groups.values()) {
                if (group.isActive()) {
                    GroupSnapshot snapshot = group.toSnapshot();
                    pendingWrites.add(() -> {
                        if (putSnapshot(snapshot, "save_groups")) {
                            saved.incrementAndGet();
                        } else {
                            success.set(false);
                        }
                    });
                } else {
                    String groupId = group.getGroupId();
                    pendingWrites.add(() -> {
                        if (!deleteSnapshot(groupId)) {
                            success.set(false);
                        }
                    });
                }
            }
        } finally {
            lock.unlock();
            flushWrites();
        }
        structuredLogger.logGroupEvent(null, GroupEventType.GROUPS_SAVED,
                "Saved incident groups", Map.of("saved", saved.get(), "success", success.get()));
        return success.get();
    }

    /**
     * Restore groups from the snapshot store. Expired, unreadable and memberless snapshots are
     * skipped and groups already held in memory are kept as they are. Store reads happen
     * outside the engine lock.
     *
     * @return number of groups restored
     */
    public int loadGroups() {
        List<GroupSnapshot> snapshots;
        try {
            snapshots = snapshotRepository.list();
        } catch (RuntimeException e) {
            recordPersistenceFailure("load_groups", null, e);
            return 0;
        }

        Instant now = clock.instant();
        List<IncidentGroup> restored = new ArrayList<>();
        for (GroupSnapshot snapshot : snapshots) {
            if (snapshot.getExpiresAt() == null || !now.isBefore(snapshot.getExpiresAt())) {
                continue;
            }
            IncidentGroup group;
            try {
                group = IncidentGroup.fromSnapshot(snapshot, alertRepository, clock, scorer,
                        settings.getMembershipExtension());
            } catch (TriageValidationException e) {
                log.warn("Skipping invalid group snapshot {}: {}", snapshot.getGroupId(), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                recordPersistenceFailure("load_group", snapshot.getGroupId(), e);
                continue;
            }
            if (group.size() == 0) {
                log.warn("Skipping group snapshot {} with no resolvable members", snapshot.getGroupId());
                continue;
            }
            restored.add(group);
        }

        int loaded = 0;
        lock.lock();
        try {
            for (IncidentGroup group : restored) {
                if (groups.putIfAbsent(group.getGroupId(), group) == null) {
                    loaded++;
                }
            }
            updateActiveGauge();
        } finally {
            lock.unlock();
        }

        lastPersistenceSuccess = clock.instant();
        structuredLogger.logGroupEvent(null, GroupEventType.GROUPS_LOADED,
                "Loaded incident groups", Map.of("loaded", loaded, "stored", snapshots.size()));
        return loaded;
    }

    public CorrelationSettings getSettings() {
        return settings;
    }

    public Optional<Instant> getLastCleanupAt() {
        return Optional.ofNullable(lastCleanupAt);
    }

    public Optional<Instant> getLastPersistenceSuccess() {
        return Optional.ofNullable(lastPersistenceSuccess);
    }

    public Optional<Instant> getLastPersistenceFailure() {
        return Optional.ofNullable(lastPersistenceFailure);
    }

    // ========== Internals ==========

    private void validate(Alert alert) {
        try {
            validator.validate(alert);
        } catch (InvalidAlertException e) {
            metrics.recordAlertRejected();
            structuredLogger.logAlertEvent(e.getAlertId(), null, AlertEventType.ALERT_REJECTED,
                    "Rejected alert", Map.of("violations", e.getViolations()));
            throw e;
        }
    }

    /**
     * Assign a validated alert. Caller holds the lock.
     */
    private String correlate(Alert alert) {
        GroupMatch match = findSimilarGroup(alert);
        IncidentGroup group;

        if (match.isPresent() && match.score() >= settings.getSimilarityThreshold()) {
            group = groups.get(match.groupId());
            if (group.addAlert(alert)) {
                structuredLogger.logGroupEvent(group.getGroupId(), GroupEventType.ALERT_GROUPED,
                        "Alert joined group", Map.of("alertId", alert.getAlertId(), "score", match.score(),
                                "size", group.size()));
            } else {
                structuredLogger.logAlertEvent(alert.getAlertId(), group.getGroupId(), AlertEventType.ALERT_DUPLICATE,
                        "Alert already grouped", null);
            }
        } else {
            group = new IncidentGroup(clock, scorer, settings.getGroupTtl(), settings.getMembershipExtension());
            group.addAlert(alert);
            groups.put(group.getGroupId(), group);
            metrics.recordGroupCreated();
            structuredLogger.logGroupEvent(group.getGroupId(), GroupEventType.GROUP_CREATED,
                    "Created incident group", Map.of("name", group.getName(), "alertId", alert.getAlertId(),
                            "bestScore", match.score()));
        }

        if (group.size() >= 2) {
            List<Alert> rootCauses = identifyRootCauses(group);
            if (!rootCauses.isEmpty()) {
                group.setRootCauses(rootCauses);
            }
        }

        metrics.recordAlertProcessed(group.size());
        updateActiveGauge();
        captureGroupWrite(group, alert);
        return group.getGroupId();
    }

    /**
     * Suppression gate for ingestion. Caller holds the lock.
     */
    private boolean suppress(Alert alert) {
        boolean redundant = groups.values().stream()
                .filter(IncidentGroup::isActive)
                .anyMatch(group -> group.shouldSuppress(alert));
        if (redundant) {
            metrics.recordAlertSuppressed();
            structuredLogger.logAlertEvent(alert.getAlertId(), null, AlertEventType.ALERT_SUPPRESSED,
                    "Suppressed redundant alert", null);
        }
        return redundant;
    }

    private void captureGroupWrite(IncidentGroup group, Alert alert) {
        GroupSnapshot snapshot = group.toSnapshot();
        pendingWrites.add(() -> {
            try {
                alertRepository.save(alert);
            } catch (RuntimeException e) {
                recordPersistenceFailure("save_alert", snapshot.getGroupId(), e);
            }
            putSnapshot(snapshot, "save_group");
        });
    }

    /**
     * Perform captured writes once the outermost engine call has released its lock. Whoever
     * holds the write lock drains the queue, so on return every write captured by this thread
     * has completed.
     */
    private void flushWrites() {
        if (lock.isHeldByCurrentThread()) {
            return;
        }
        writeLock.lock();
        try {
            Runnable write;
            while ((write = pendingWrites.poll()) != null) {
                write.run();
            }
        } finally {
            writeLock.unlock();
        }
    }

    private boolean putSnapshot(GroupSnapshot snapshot, String operation) {
        try {
            snapshotRepository.put(snapshot);
            lastPersistenceSuccess = clock.instant();
            return true;
        } catch (RuntimeException e) {
            recordPersistenceFailure(operation, snapshot.getGroupId(), e);
            return false;
        }
    }

    private boolean deleteSnapshot(String groupId) {
        try {
            snapshotRepository.delete(groupId);
            return true;
        } catch (RuntimeException e) {
            recordPersistenceFailure("delete_group", groupId, e);
            return false;
        }
    }

    private void recordPersistenceFailure(String operation, String groupId, RuntimeException e) {
        lastPersistenceFailure = clock.instant();
        metrics.recordPersistenceFailure(operation);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", operation);
        details.put("error", String.valueOf(e.getMessage()));
        structuredLogger.logGroupEvent(groupId, GroupEventType.PERSISTENCE_FAILED,
                "Persistence operation failed, continuing in memory", details);
        log.debug("Persistence failure detail", e);
    }

    private void updateActiveGauge() {
        int active = 0;
        for (IncidentGroup group : groups.values()) {
            if (group.isActive()) {
                active++;
            }
        }
        metrics.setActiveGroups(active);
    }
}
