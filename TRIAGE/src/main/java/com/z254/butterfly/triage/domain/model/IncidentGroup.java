package com.z254.butterfly.triage.domain.model;

import com.z254.butterfly.triage.correlation.SimilarityScorer;
import com.z254.butterfly.triage.domain.repository.AlertRepository;
import com.z254.butterfly.triage.exception.RootCauseNotMemberException;
import com.z254.butterfly.triage.exception.TriageValidationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A time-bounded cluster of related alerts with an optional ranked set of root causes.
 * <p>
 * Instances are owned by the correlation engine, which serializes all mutation. Reads from
 * other threads see consistent member lists but may observe a group between two updates.
 */
@Slf4j
public class IncidentGroup {

    static final String PLACEHOLDER_PREFIX = "Alert Group";
    static final double SUPPRESSION_THRESHOLD = 0.9;

    private final String groupId;
    private final Instant createdAt;
    private final Clock clock;
    private final SimilarityScorer scorer;
    private final Duration membershipExtension;

    private final List<Alert> alerts = new CopyOnWriteArrayList<>();
    private final Set<String> alertIds = ConcurrentHashMap.newKeySet();
    private volatile List<Alert> rootCauses = List.of();

    private volatile String name;
    private volatile Instant updatedAt;
    private volatile Instant expiresAt;
    private volatile boolean suppressionEnabled;

    /**
     * Create an empty group expiring {@code ttl} from now.
     */
    public IncidentGroup(Clock clock, SimilarityScorer scorer, Duration ttl, Duration membershipExtension) {
        this(UUID.randomUUID().toString(), clock, scorer, clock.instant(), ttl, membershipExtension);
    }

    private IncidentGroup(String groupId, Clock clock, SimilarityScorer scorer,
                          Instant createdAt, Duration ttl, Duration membershipExtension) {
        this.groupId = groupId;
        this.clock = clock;
        this.scorer = scorer;
        this.membershipExtension = membershipExtension;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.expiresAt = createdAt.plus(ttl);
        this.name = PLACEHOLDER_PREFIX + " " + groupId.substring(0, Math.min(8, groupId.length()));
    }

    /**
     * Append an alert unless a member with the same id exists.
     *
     * @return true if the alert was added
     */
    public boolean addAlert(Alert alert) {
        if (!alertIds.add(alert.getAlertId())) {
            return false;
        }
        alerts.add(alert);

        if (alerts.size() == 1 && name.startsWith(PLACEHOLDER_PREFIX)) {
            String component = alert.getComponent() != null ? alert.getComponent() : "Unknown";
            name = alert.getAlertType() + " - " + component;
        }

        expiresAt = expiresAt.plus(membershipExtension);
        touch();
        return true;
    }

    /**
     * Replace the root causes. Every candidate must be a current member.
     *
     * @throws RootCauseNotMemberException on the first non-member; the group is left unchanged
     */
    public void setRootCauses(Collection<Alert> candidates) {
        Map<String, Alert> members = new LinkedHashMap<>();
        alerts.forEach(a -> members.put(a.getAlertId(), a));

        List<Alert> resolved = new ArrayList<>(candidates.size());
        for (Alert candidate : candidates) {
            Alert member = members.get(candidate.getAlertId());
            if (member == null) {
                throw new RootCauseNotMemberException(groupId, candidate.getAlertId());
            }
            resolved.add(member);
        }
        rootCauses = List.copyOf(resolved);
        touch();
    }

    /**
     * True when suppression is enabled, the group is live and non-empty, the alert is not
     * CRITICAL, and some member scores above {@value #SUPPRESSION_THRESHOLD} against it.
     */
    public boolean shouldSuppress(Alert alert) {
        if (!suppressionEnabled || alerts.isEmpty() || !isActive()
                || alert.getSeverity() == AlertSeverity.CRITICAL) {
            return false;
        }
        return alerts.stream().anyMatch(member -> scorer.score(alert, member) > SUPPRESSION_THRESHOLD);
    }

    public boolean isActive() {
        return clock.instant().isBefore(expiresAt);
    }

    public void extendExpiration(Duration extension) {
        if (extension.isNegative()) {
            throw new IllegalArgumentException("Expiration can only be extended: " + extension);
        }
        expiresAt = expiresAt.plus(extension);
        touch();
    }

    public void setSuppressionEnabled(boolean suppressionEnabled) {
        this.suppressionEnabled = suppressionEnabled;
        touch();
    }

    private void touch() {
        Instant now = clock.instant();
        if (now.isAfter(updatedAt)) {
            updatedAt = now;
        }
    }

    public String getGroupId() {
        return groupId;
    }

    public String getName() {
        return name;
    }

    /** Members in insertion order, unmodifiable */
    public List<Alert> getAlerts() {
        return List.copyOf(alerts);
    }

    public int size() {
        return alerts.size();
    }

    public boolean contains(String alertId) {
        return alertIds.contains(alertId);
    }

    public List<Alert> getRootCauses() {
        return rootCauses;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isSuppressionEnabled() {
        return suppressionEnabled;
    }

    public GroupSummary summary() {
        List<Alert> members = getAlerts();
        List<Alert> causes = rootCauses;

        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (Alert alert : members) {
            distribution.merge(alert.getSeverity().name(), 1, Integer::sum);
        }
        Optional<Alert> mostRecent = members.stream().max(Comparator.comparing(Alert::getCreatedAt));

        GroupSummary.GroupSummaryBuilder builder = GroupSummary.builder()
                .groupId(groupId)
                .name(name)
                .alertCount(members.size())
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .expiresAt(expiresAt)
                .active(isActive())
                .suppressionEnabled(suppressionEnabled)
                .severityDistribution(distribution)
                .rootCauseCount(causes.size())
                .mostRecentAlertId(mostRecent.map(Alert::getAlertId).orElse(null))
                .mostRecentTime(mostRecent.map(Alert::getCreatedAt).orElse(null));

        if (!causes.isEmpty()) {
            builder.rootCauseIds(causes.stream().map(Alert::getAlertId).toList())
                    .rootCauseDetails(causes.stream()
                            .map(a -> GroupSummary.RootCauseDetail.builder()
                                    .id(a.getAlertId())
                                    .type(a.getAlertType())
                                    .component(a.getComponent())
                                    .description(a.getDescription())
                                    .build())
                            .toList());
        }
        return builder.build();
    }

    public GroupSnapshot toSnapshot() {
        return GroupSnapshot.builder()
                .groupId(groupId)
                .name(name)
                .alertIds(new ArrayList<>(alerts.stream().map(Alert::getAlertId).toList()))
                .rootCauseIds(new ArrayList<>(rootCauses.stream().map(Alert::getAlertId).toList()))
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .expiresAt(expiresAt)
                .suppressionEnabled(suppressionEnabled)
                .build();
    }

    /**
     * Rebuild a group from its snapshot. Member ids the repository cannot resolve are dropped.
     * Root causes resolve from the restored members first and fall back to the repository, but
     * only ids listed as members of the snapshot are kept.
     *
     * @throws TriageValidationException if the snapshot is structurally invalid
     */
    public static IncidentGroup fromSnapshot(GroupSnapshot snapshot, AlertRepository alertRepository,
                                             Clock clock, SimilarityScorer scorer, Duration membershipExtension) {
        if (snapshot.getGroupId() == null || snapshot.getCreatedAt() == null || snapshot.getExpiresAt() == null) {
            throw new TriageValidationException("Snapshot is missing groupId, createdAt or expiresAt");
        }
        if (snapshot.getExpiresAt().isBefore(snapshot.getCreatedAt())) {
            throw new TriageValidationException("Snapshot " + snapshot.getGroupId() + " expires before it was created");
        }

        IncidentGroup group = new IncidentGroup(snapshot.getGroupId(), clock, scorer,
                snapshot.getCreatedAt(), Duration.ZERO, membershipExtension);
        group.expiresAt = snapshot.getExpiresAt();
        if (snapshot.getName() != null) {
            group.name = snapshot.getName();
        }
        group.suppressionEnabled = snapshot.isSuppressionEnabled();

        List<String> memberIds = snapshot.getAlertIds() != null ? snapshot.getAlertIds() : List.of();
        for (String alertId : memberIds) {
            Optional<Alert> alert = alertRepository.getAlert(alertId);
            if (alert.isPresent()) {
                if (group.alertIds.add(alertId)) {
                    group.alerts.add(alert.get());
                }
            } else {
                log.warn("Alert {} of group {} could not be resolved, dropping it", alertId, group.groupId);
            }
        }

        List<Alert> causes = new ArrayList<>();
        List<String> rootCauseIds = snapshot.getRootCauseIds() != null ? snapshot.getRootCauseIds() : List.of();
        for (String rootCauseId : rootCauseIds) {
            Optional<Alert> member = group.alerts.stream()
                    .filter(a -> a.getAlertId().equals(rootCauseId))
                    .findFirst();
            if (member.isPresent()) {
                causes.add(member.get());
                continue;
            }
            Optional<Alert> fromRepository = memberIds.contains(rootCauseId)
                    ? alertRepository.getAlert(rootCauseId)
                    : Optional.empty();
            if (fromRepository.isPresent()) {
                group.alertIds.add(rootCauseId);
                group.alerts.add(fromRepository.get());
                causes.add(fromRepository.get());
            } else {
                log.warn("Root cause {} of group {} is not a resolvable member, dropping it", rootCauseId, group.groupId);
            }
        }
        group.rootCauses = List.copyOf(causes);

        // updatedAt must not precede createdAt
        Instant storedUpdate = snapshot.getUpdatedAt();
        group.updatedAt = storedUpdate != null && storedUpdate.isAfter(group.createdAt) ? storedUpdate : group.createdAt;
        return group;
    }

    @Override
    public String toString() {
        return "IncidentGroup{" + groupId + ", name='" + name + "', alerts=" + alerts.size()
                + ", rootCauses=" + rootCauses.size() + ", expiresAt=" + expiresAt + "}";
    }
}
