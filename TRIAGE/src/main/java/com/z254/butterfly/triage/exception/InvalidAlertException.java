package com.z254.butterfly.triage.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised for alerts that lack the fields correlation depends on.
 */
@Getter
public class InvalidAlertException extends TriageValidationException {

    /** Alert id when one was supplied, otherwise {@code null} */
    private final String alertId;

    private final List<String> violations;

    public InvalidAlertException(String alertId, List<String> violations) {
        super("Invalid alert " + (alertId != null ? alertId : "<no id>") + ": " + String.join(", ", violations));
        this.alertId = alertId;
        this.violations = List.copyOf(violations);
    }
}
