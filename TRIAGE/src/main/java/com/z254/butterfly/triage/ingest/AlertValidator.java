package com.z254.butterfly.triage.ingest;

import com.z254.butterfly.triage.domain.model.Alert;
import com.z254.butterfly.triage.exception.InvalidAlertException;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that an alert carries the fields scoring and causal analysis read unconditionally.
 */
public class AlertValidator {

    public void validate(Alert alert) {
        if (alert == null) {
            throw new InvalidAlertException(null, List.of("alert is null"));
        }
        List<String> violations = new ArrayList<>();
        if (isBlank(alert.getAlertId())) {
            violations.add("alertId is required");
        }
        if (isBlank(alert.getAlertType())) {
            violations.add("alertType is required");
        }
        if (alert.getSeverity() == null) {
            violations.add("severity is required");
        }
        if (alert.getCreatedAt() == null) {
            violations.add("createdAt is required");
        }
        if (!violations.isEmpty()) {
            throw new InvalidAlertException(isBlank(alert.getAlertId()) ? null : alert.getAlertId(), violations);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
