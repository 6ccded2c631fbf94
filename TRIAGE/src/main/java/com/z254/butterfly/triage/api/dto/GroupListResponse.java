package com.z254.butterfly.triage.api.dto;

import com.z254.butterfly.triage.domain.model.GroupSummary;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response DTO for group list.
 */
@Data
@Builder
public class GroupListResponse {
    private List<GroupSummary> groups;
    private long total;
    private int page;
    private int size;
}
