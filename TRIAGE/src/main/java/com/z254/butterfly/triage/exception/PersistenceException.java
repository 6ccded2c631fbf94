package com.z254.butterfly.triage.exception;

/**
 * Raised by store implementations when a read or write fails. The correlation engine
 * catches it and continues on in-memory state.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
