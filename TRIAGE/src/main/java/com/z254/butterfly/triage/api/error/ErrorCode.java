package com.z254.butterfly.triage.api.error;

public enum ErrorCode {
    BAD_REQUEST, INVALID_ALERT, GROUP_NOT_FOUND, INTERNAL_ERROR
}
