package com.z254.butterfly.triage.exception;

/**
 * Base type for contract violations detected by the correlation core.
 */
public class TriageValidationException extends RuntimeException {

    public TriageValidationException(String message) {
        super(message);
    }

    public TriageValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
