package com.z254.butterfly.triage.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * A single failure or anomaly signal emitted by an upstream detector.
 * <p>
 * Alerts are produced outside this service and treated as immutable. {@code alertId}
 * is the identity used for group membership.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Alert {

    /** Globally unique identifier */
    String alertId;

    /** Alert category, e.g. {@code pipeline_failure} */
    String alertType;

    /** Component that raised the alert, nullable */
    String component;

    /** Pipeline execution the alert belongs to, nullable */
    String executionId;

    AlertSeverity severity;

    /** Free-form key/value context, compared as {@code key:value} pairs */
    @Builder.Default
    Map<String, String> context = Map.of();

    Instant createdAt;

    String description;

    /**
     * Look up a single context value.
     */
    public Optional<String> contextValue(String key) {
        return context == null ? Optional.empty() : Optional.ofNullable(context.get(key));
    }
}
