package com.z254.butterfly.triage.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestResponse {
    private String alertId;
    /** Absent when the alert was suppressed */
    private String groupId;
    private boolean suppressed;
}
