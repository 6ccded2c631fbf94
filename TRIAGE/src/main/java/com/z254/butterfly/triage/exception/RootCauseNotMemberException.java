package com.z254.butterfly.triage.exception;

import lombok.Getter;

/**
 * Raised when a root-cause candidate is not a member of the group it is assigned to.
 */
@Getter
public class RootCauseNotMemberException extends TriageValidationException {

    private final String groupId;
    private final String alertId;

    public RootCauseNotMemberException(String groupId, String alertId) {
        super("Root cause alert " + alertId + " is not in group " + groupId);
        this.groupId = groupId;
        this.alertId = alertId;
    }
}
