package com.z254.butterfly.triage.api.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CleanupResponse {
    private int removed;
    private int remaining;
}
