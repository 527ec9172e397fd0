package com.nextsub.auth.audit;

public enum AuditAction {
    REQUEST_CODE,
    VERIFY_CODE,
    LOGOUT
}
