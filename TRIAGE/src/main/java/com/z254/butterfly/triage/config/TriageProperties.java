package com.z254.butterfly.triage.config;

import com.z254.butterfly.triage.correlation.CorrelationSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.time.Duration;

/**
 * Configuration properties for the TRIAGE service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Correlation engine tunables and maintenance schedule</li>
 *     <li>Group and alert persistence</li>
 *     <li>Kafka topics</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "triage")
public class TriageProperties {

    @Valid
    private final Correlation correlation = new Correlation();
    @Valid
    private final Persistence persistence = new Persistence();
    @Valid
    private final Kafka kafka = new Kafka();

    /**
     * Correlation engine configuration.
     */
    @Data
    public static class Correlation {
        /** Minimum group similarity for an alert to join an existing group */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double similarityThreshold = CorrelationSettings.DEFAULT_SIMILARITY_THRESHOLD;

        /** Window for temporal similarity and causal distance */
        @Positive
        private int timeWindowMinutes = CorrelationSettings.DEFAULT_TIME_WINDOW_MINUTES;

        /** Lifetime of a new group */
        @Positive
        private int groupTtlMinutes = CorrelationSettings.DEFAULT_GROUP_TTL_MINUTES;

        @Positive
        private int maxGroupSize = CorrelationSettings.DEFAULT_MAX_GROUP_SIZE;

        /** Delay between expiry sweeps */
        @NotNull
        private Duration cleanupInterval = Duration.ofMinutes(5);

        /** Drop redundant alerts before correlation */
        private boolean suppressOnIngest = false;

        public CorrelationSettings toSettings() {
            return CorrelationSettings.builder()
                    .similarityThreshold(similarityThreshold)
                    .timeWindowMinutes(timeWindowMinutes)
                    .groupTtlMinutes(groupTtlMinutes)
                    .maxGroupSize(maxGroupSize)
                    .build();
        }
    }

    /**
     * Snapshot and alert store configuration.
     */
    @Data
    public static class Persistence {
        @Pattern(regexp = "in-memory|redis")
        private String store = "in-memory";

        @NotBlank
        private String redisKeyPrefix = "triage:";

        /** Upper bound for a single blocking store call */
        @NotNull
        private Duration timeout = Duration.ofSeconds(2);

        /** How long stored alerts remain resolvable */
        @NotNull
        private Duration alertRetention = Duration.ofHours(6);
    }

    /**
     * Kafka configuration.
     */
    @Data
    public static class Kafka {
        private boolean enabled = true;

        private final Topics topics = new Topics();

        @Data
        public static class Topics {
            private String alertsInput = "triage.alerts.detected";
            private String groupUpdates = "triage.groups.updated";
            private String alertsDlq = "triage.alerts.dlq";
        }
    }
}
