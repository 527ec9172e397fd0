package com.nextsub.auth.audit;

public final class AuditMasks {

    private static final int CODE_TAIL = 2;
    private static final int MIN_CODE_LENGTH_FOR_TAIL = 8;

    private AuditMasks() {
    }

    public static String maskCode(String code) {
        if (code == null || code.length() < MIN_CODE_LENGTH_FOR_TAIL) {
            return "****";
        }
        return "****" + code.substring(code.length() - CODE_TAIL);
    }

    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return "";
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
