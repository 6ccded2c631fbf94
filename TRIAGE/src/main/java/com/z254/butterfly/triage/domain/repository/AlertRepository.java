package com.z254.butterfly.triage.domain.repository;

import com.z254.butterfly.triage.domain.model.Alert;

import java.util.Optional;

/**
 * Lookup of alerts by id, used when rebuilding groups from snapshots.
 */
public interface AlertRepository {

    /**
     * Persist the alert. Existing alerts with the same id are replaced.
     */
    void save(Alert alert);

    /**
     * Look up an alert by ID.
     */
    Optional<Alert> getAlert(String alertId);
}
