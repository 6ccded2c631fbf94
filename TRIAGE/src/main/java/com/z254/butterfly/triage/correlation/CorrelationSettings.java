package com.z254.butterfly.triage.correlation;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tunables of a {@link CorrelationEngine} instance.
 */
@Value
@Builder(toBuilder = true)
public class CorrelationSettings {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.7;
    public static final int DEFAULT_TIME_WINDOW_MINUTES = 60;
    public static final int DEFAULT_GROUP_TTL_MINUTES = 120;
    public static final int DEFAULT_MAX_GROUP_SIZE = 50;

    /** Minimum group similarity for an alert to join an existing group */
    @Builder.Default
    double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;

    /** Horizon for temporal similarity and cause/effect distance */
    @Builder.Default
    int timeWindowMinutes = DEFAULT_TIME_WINDOW_MINUTES;

    /** Initial lifetime of a new group */
    @Builder.Default
    int groupTtlMinutes = DEFAULT_GROUP_TTL_MINUTES;

    /** Groups at this size stop accepting alerts */
    @Builder.Default
    int maxGroupSize = DEFAULT_MAX_GROUP_SIZE;

    public static CorrelationSettings defaults() {
        return builder().build();
    }

    public Duration getTimeWindow() {
        return Duration.ofMinutes(timeWindowMinutes);
    }

    public Duration getGroupTtl() {
        return Duration.ofMinutes(groupTtlMinutes);
    }

    /**
     * Expiration extension granted for every alert added to a group: half the TTL,
     * in whole minutes.
     */
    public Duration getMembershipExtension() {
        return Duration.ofMinutes(groupTtlMinutes / 2);
    }

    /**
     * @throws IllegalArgumentException if any option is out of range
     */
    public CorrelationSettings validate() {
        if (Double.isNaN(similarityThreshold) || similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be within [0, 1]: " + similarityThreshold);
        }
        if (timeWindowMinutes <= 0) {
            throw new IllegalArgumentException("timeWindowMinutes must be positive: " + timeWindowMinutes);
        }
        if (groupTtlMinutes <= 0) {
            throw new IllegalArgumentException("groupTtlMinutes must be positive: " + groupTtlMinutes);
        }
        if (maxGroupSize <= 0) {
            throw new IllegalArgumentException("maxGroupSize must be positive: " + maxGroupSize);
        }
        return this;
    }
}
