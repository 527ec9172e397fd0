package com.nextsub.auth.service;

import com.nextsub.auth.audit.AdminAuditLogger;
import com.nextsub.auth.audit.AuditAction;
import com.nextsub.auth.audit.AuditMasks;
import com.nextsub.auth.audit.AuditOutcome;
import com.nextsub.auth.code.AdminCodeGenerator;
import com.nextsub.auth.code.AdminCodeRecord;
import com.nextsub.auth.code.AdminCodeStore;
import com.nextsub.auth.code.CodeHasher;
import com.nextsub.auth.config.AuthProperties;
import com.nextsub.auth.model.ClientInfo;
import com.nextsub.auth.notify.CodeDispatcher;
import com.nextsub.auth.notify.NotificationException;
import com.nextsub.auth.ratelimit.RateLimitAction;
import com.nextsub.auth.ratelimit.RateLimitDecision;
import com.nextsub.auth.ratelimit.RateLimiter;
import com.nextsub.auth.token.AdminSessionToken;
import com.nextsub.auth.token.JwtService;
import com.nextsub.auth.verification.AdminCodeVerifier;
import com.nextsub.auth.verification.VerificationCheckResult;
import com.nextsub.common.exception.BusinessException;
import com.nextsub.common.exception.ErrorCode;
import com.nextsub.common.exception.RateLimitedException;
import com.nextsub.common.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * 管理员一次性验证码登录编排。
 * <p>
 * 申请验证码：限流 → 身份校验 → 生成 → 摘要入库（替换旧码）→ 投递；
 * 校验验证码：限流 → 身份校验 → 状态机校验 → 签发会话令牌。
 * 安全策略：
 * - 管理员身份来自配置，邮箱去空白并转小写后比较；身份不符时不触碰验证码存储；
 * - 校验失败的各种原因（不存在/过期/已使用/错误/超限）对外统一为“验证码无效或已过期”；
 * - 明文验证码只交给投递通道，审计只记录掩码。
 * 审计：每个终态（含限流拒绝）写一条审计记录。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminAuthService {

    static final String REASON_RATE_LIMITED = "RATE_LIMITED";
    static final String REASON_IDENTITY_MISMATCH = "IDENTITY_MISMATCH";
    static final String REASON_CODE_ISSUED = "CODE_ISSUED";
    static final String REASON_STORE_UNAVAILABLE = "STORE_UNAVAILABLE";
    static final String REASON_LOGOUT = "LOGOUT";

    private final AuthProperties properties;
    private final RateLimiter rateLimiter;
    private final AdminCodeGenerator codeGenerator;
    private final CodeHasher codeHasher;
    private final AdminCodeStore codeStore;
    private final AdminCodeVerifier codeVerifier;
    private final CodeDispatcher codeDispatcher;
    private final JwtService jwtService;
    private final AdminAuditLogger auditLogger;

    public RequestCodeResult requestCode(String email, ClientInfo client) {
        AuthProperties.RateLimit limits = properties.getRateLimit();
        RateLimitDecision decision = checkRateLimit(AuditAction.REQUEST_CODE, RateLimitAction.REQUEST_CODE,
                limits.getRequestCodeLimit(), email, client);

        String principal = normalizeEmail(email);
        if (!isAdmin(principal)) {
            auditLogger.record(AuditAction.REQUEST_CODE, AuditOutcome.FAILURE, REASON_IDENTITY_MISMATCH,
                    AuditMasks.maskEmail(principal), client, null);
            throw new BusinessException(ErrorCode.ADMIN_IDENTITY_MISMATCH, "Only the admin email can request admin code");
        }

        AuthProperties.Code cfg = properties.getCode();
        String code = codeGenerator.generate();
        AdminCodeRecord issued;
        try {
            issued = codeStore.issue(principal, codeHasher.hash(code), cfg.getTtl(), cfg.getMaxAttempts(), client);
        } catch (StoreUnavailableException ex) {
            auditLogger.record(AuditAction.REQUEST_CODE, AuditOutcome.FAILURE, REASON_STORE_UNAVAILABLE,
                    principal, client, null);
            throw ex;
        }
        String recordId = issued.id();
        Instant expiresAt = issued.expiresAt();

        try {
            codeDispatcher.dispatch(principal, code, expiresAt, client);
        } catch (NotificationException ex) {
            log.error("Admin code delivery failed, recordId={}", recordId, ex);
            auditLogger.record(AuditAction.REQUEST_CODE, AuditOutcome.FAILURE, CodeDispatcher.REASON_NOTIFICATION_FAILURE,
                    principal, client, "recordId=" + recordId);
            throw new BusinessException(ErrorCode.NOTIFICATION_FAILED, ErrorCode.NOTIFICATION_FAILED.getDefaultMessage(), ex);
        }

        auditLogger.record(AuditAction.REQUEST_CODE, AuditOutcome.SUCCESS, REASON_CODE_ISSUED,
                principal, client, "recordId=" + recordId + ", code=" + AuditMasks.maskCode(code));
        log.info("Admin code issued, recordId={}, expiresAt={}", recordId, expiresAt);
        return new RequestCodeResult(expiresAt, decision);
    }

    public VerifyCodeResult verifyCode(String email, String code, ClientInfo client) {
        AuthProperties.RateLimit limits = properties.getRateLimit();
        RateLimitDecision decision = checkRateLimit(AuditAction.VERIFY_CODE, RateLimitAction.VERIFY_CODE,
                limits.getVerifyCodeLimit(), email, client);

        String principal = normalizeEmail(email);
        if (!isAdmin(principal)) {
            auditLogger.record(AuditAction.VERIFY_CODE, AuditOutcome.FAILURE, REASON_IDENTITY_MISMATCH,
                    AuditMasks.maskEmail(principal), client, null);
            throw new BusinessException(ErrorCode.ADMIN_IDENTITY_MISMATCH);
        }

        VerificationCheckResult result;
        try {
            result = codeVerifier.verify(principal, code);
        } catch (StoreUnavailableException ex) {
            auditLogger.record(AuditAction.VERIFY_CODE, AuditOutcome.FAILURE, REASON_STORE_UNAVAILABLE,
                    principal, client, null);
            throw ex;
        }
        String detail = "attempts=" + result.attemptsUsed() + "/" + result.maxAttempts()
                + ", code=" + AuditMasks.maskCode(code);
        if (!result.isSuccess()) {
            auditLogger.record(AuditAction.VERIFY_CODE, AuditOutcome.FAILURE, result.status().name(),
                    principal, client, detail);
            throw new BusinessException(ErrorCode.INVALID_OR_EXPIRED_CODE);
        }

        AdminSessionToken session = jwtService.issueAdminToken(principal, properties.getAdmin().getRole());
        auditLogger.record(AuditAction.VERIFY_CODE, AuditOutcome.SUCCESS, result.status().name(),
                principal, client, detail);
        log.info("Admin authenticated, session expiresAt={}", session.expiresAt());
        return new VerifyCodeResult(session, decision);
    }

    public void logout(String principalId, ClientInfo client) {
        auditLogger.record(AuditAction.LOGOUT, AuditOutcome.SUCCESS, REASON_LOGOUT, principalId, client, null);
    }

    private RateLimitDecision checkRateLimit(AuditAction auditAction, RateLimitAction action, int limit,
                                             String email, ClientInfo client) {
        Duration window = properties.getRateLimit().getWindow();
        RateLimitDecision decision = rateLimiter.checkAndIncrement(client.ip(), action, limit, window);
        if (!decision.allowed()) {
            auditLogger.record(auditAction, AuditOutcome.RATE_LIMITED, REASON_RATE_LIMITED,
                    AuditMasks.maskEmail(normalizeEmail(email)), client,
                    "count=" + decision.count() + "/" + decision.limit());
            throw new RateLimitedException("Too many requests. Please try again later.", decision.retryAfter());
        }
        return decision;
    }

    private boolean isAdmin(String principal) {
        return StringUtils.hasText(principal) && principal.equals(normalizeEmail(properties.getAdmin().getEmail()));
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
