package com.nextsub.auth.verification;

public record VerificationCheckResult(VerificationCodeStatus status, int attemptsUsed, int maxAttempts) {

    public static VerificationCheckResult of(VerificationCodeStatus status) {
        return new VerificationCheckResult(status, 0, 0);
    }

    public boolean isSuccess() {
        return status == VerificationCodeStatus.SUCCESS;
    }

    public int attemptsRemaining() {
        return Math.max(0, maxAttempts - attemptsUsed);
    }
}
