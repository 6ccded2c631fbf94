package com.z254.butterfly.triage.exception;

import lombok.Getter;

/**
 * Raised when an operation names a group that does not exist or has expired.
 */
@Getter
public class GroupNotFoundException extends RuntimeException {

    private final String groupId;

    public GroupNotFoundException(String groupId) {
        super("No active group " + groupId);
        this.groupId = groupId;
    }
}
