package com.nextsub.auth.code;

import java.time.Instant;

/**
 * 一条未完成的管理员验证码挑战。
 *
 * <p>不可变；计数与失效的变更由 {@link AdminCodeStore} 的原子操作产生新快照。</p>
 */
public record AdminCodeRecord(
        String id,
        String principalId,
        String codeDigest,
        Instant issuedAt,
        Instant expiresAt,
        int attemptsUsed,
        int maxAttempts,
        boolean consumed,
        String clientIp,
        String userAgent
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isExhausted() {
        return attemptsUsed >= maxAttempts;
    }

    /**
     * 未使用、未过期且尝试次数未超限。
     */
    public boolean isLive(Instant now) {
        return !consumed && !isExpired(now) && !isExhausted();
    }

    AdminCodeRecord withFailedAttempt() {
        if (consumed) {
            return this;
        }
        int attempts = Math.min(attemptsUsed + 1, maxAttempts);
        return new AdminCodeRecord(id, principalId, codeDigest, issuedAt, expiresAt,
                attempts, maxAttempts, attempts >= maxAttempts, clientIp, userAgent);
    }

    AdminCodeRecord asConsumed() {
        return new AdminCodeRecord(id, principalId, codeDigest, issuedAt, expiresAt,
                attemptsUsed, maxAttempts, true, clientIp, userAgent);
    }
}
