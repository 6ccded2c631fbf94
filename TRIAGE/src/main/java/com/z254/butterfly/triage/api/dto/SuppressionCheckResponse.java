package com.z254.butterfly.triage.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SuppressionCheckResponse {
    private String alertId;
    /** Group checked, absent when every active group was checked */
    private String groupId;
    private boolean suppress;
}
