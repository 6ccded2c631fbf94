package com.z254.butterfly.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Serialized form of an {@link IncidentGroup}. Member alerts are stored by id only and
 * resolved through an alert repository on restore.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupSnapshot {

    private String groupId;

    private String name;

    @Builder.Default
    private List<String> alertIds = new ArrayList<>();

    @Builder.Default
    private List<String> rootCauseIds = new ArrayList<>();

    private Instant createdAt;

    private Instant updatedAt;

    private Instant expiresAt;

    private boolean suppressionEnabled;
}
