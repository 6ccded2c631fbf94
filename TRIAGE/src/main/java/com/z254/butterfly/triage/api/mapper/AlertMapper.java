package com.z254.butterfly.triage.api.mapper;

import com.z254.butterfly.triage.api.dto.AlertRequest;
import com.z254.butterfly.triage.domain.model.Alert;
import com.z254.butterfly.triage.domain.model.AlertSeverity;
import com.z254.butterfly.triage.exception.TriageValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mapper for alert request to domain conversion.
 */
public final class AlertMapper {

    private AlertMapper() {}

    /**
     * @throws TriageValidationException if the severity is not a known level
     */
    public static Alert toDomain(AlertRequest request) {
        AlertSeverity severity = AlertSeverity.fromValue(request.getSeverity());
        if (severity == null && request.getSeverity() != null) {
            throw new TriageValidationException("Unknown severity: " + request.getSeverity());
        }
        return Alert.builder()
                .alertId(request.getAlertId())
                .alertType(request.getAlertType())
                .component(request.getComponent())
                .executionId(request.getExecutionId())
                .severity(severity)
                .context(context(request.getContext()))
                .createdAt(request.getCreatedAt())
                .description(request.getDescription())
                .build();
    }

    /**
     * Entries with a null key or value carry nothing to compare and are dropped.
     */
    private static Map<String, String> context(Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, String> context = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (key != null && value != null) {
                context.put(key, value);
            }
        });
        return Collections.unmodifiableMap(context);
    }
}
