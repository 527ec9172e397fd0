package com.nextsub.auth.audit;

import lombok.Builder;

import java.time.Instant;

/**
 * 审计记录，只追加，不修改。
 *
 * @param reason 内部分类，如 IDENTITY_MISMATCH、TOO_MANY_ATTEMPTS；对外响应不暴露
 * @param detail 非敏感上下文，验证码只记录掩码后的尾部
 */
@Builder
public record AdminAuditEntry(
        Instant timestamp,
        AuditAction action,
        AuditOutcome outcome,
        String reason,
        String principalId,
        String clientKey,
        String clientAgent,
        String detail
) {
}
