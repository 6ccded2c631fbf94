package com.z254.butterfly.triage.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read model of an incident group consumed by notification routing and self-healing
 * action selection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GroupSummary {

    private String groupId;
    private String name;
    private int alertCount;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;
    private boolean active;
    private boolean suppressionEnabled;

    /** Member count per severity name */
    private Map<String, Integer> severityDistribution;

    private int rootCauseCount;
    private String mostRecentAlertId;
    private Instant mostRecentTime;

    /** Present only when root causes have been identified */
    private List<String> rootCauseIds;

    /** Present only when root causes have been identified */
    private List<RootCauseDetail> rootCauseDetails;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RootCauseDetail {
        private String id;
        private String type;
        private String component;
        private String description;
    }
}
