package com.nextsub.auth.audit;

public enum AuditOutcome {
    SUCCESS,
    FAILURE,
    RATE_LIMITED
}
