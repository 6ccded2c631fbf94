package com.z254.butterfly.triage.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Request DTO for alert ingestion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRequest {

    @NotBlank
    private String alertId;

    @NotBlank
    private String alertType;

    private String component;

    private String executionId;

    /** CRITICAL, HIGH, MEDIUM, LOW or INFO, case-insensitive */
    @NotBlank
    private String severity;

    private Map<String, String> context;

    @NotNull
    private Instant createdAt;

    private String description;
}
