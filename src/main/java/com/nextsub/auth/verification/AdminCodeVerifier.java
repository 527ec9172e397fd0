package com.nextsub.auth.verification;

import com.nextsub.auth.code.AdminCodeRecord;
import com.nextsub.auth.code.AdminCodeStore;
import com.nextsub.auth.code.CodeHasher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * 管理员验证码校验状态机。
 * <p>
 * NoLiveCode → AwaitingMatch → {SUCCESS | TOO_MANY_ATTEMPTS | MISMATCH/ALREADY_CONSUMED}：
 * - 没有可用记录（不存在/已使用/已过期/已耗尽）时不触碰任何计数；
 * - 摘要匹配后以 CAS 消费记录，竞争失败视为普通校验失败；
 * - 不匹配时原子累加失败次数，达到上限即同步作废。
 * 各状态对外统一表现为“验证码无效或已过期”，区分仅用于审计。
 */
@Component
@RequiredArgsConstructor
public class AdminCodeVerifier {

    private final AdminCodeStore codeStore;
    private final CodeHasher codeHasher;
    private final Clock clock;

    public VerificationCheckResult verify(String principalId, String candidateCode) {
        Optional<AdminCodeRecord> live = codeStore.loadLive(principalId);
        if (live.isEmpty()) {
            return classifyMissing(principalId);
        }
        AdminCodeRecord record = live.get();

        if (codeHasher.matches(candidateCode, record.codeDigest())) {
            if (codeStore.consume(record.id())) {
                return result(VerificationCodeStatus.SUCCESS, record.attemptsUsed(), record);
            }
            return result(VerificationCodeStatus.ALREADY_CONSUMED, record.attemptsUsed(), record);
        }

        int attempts = codeStore.recordFailedAttempt(record.id());
        if (attempts < 0) {
            // 校验期间记录被新签发的验证码替换
            return result(VerificationCodeStatus.ALREADY_CONSUMED, record.attemptsUsed(), record);
        }
        if (attempts >= record.maxAttempts()) {
            codeStore.consume(record.id());
            return result(VerificationCodeStatus.TOO_MANY_ATTEMPTS, attempts, record);
        }
        return result(VerificationCodeStatus.MISMATCH, attempts, record);
    }

    // 仅用于区分审计原因，不改变任何计数
    private VerificationCheckResult classifyMissing(String principalId) {
        Optional<AdminCodeRecord> latest = codeStore.loadLatest(principalId);
        if (latest.isEmpty()) {
            return VerificationCheckResult.of(VerificationCodeStatus.NOT_FOUND);
        }
        AdminCodeRecord record = latest.get();
        if (record.isExhausted()) {
            return result(VerificationCodeStatus.TOO_MANY_ATTEMPTS, record.attemptsUsed(), record);
        }
        if (record.consumed()) {
            return result(VerificationCodeStatus.ALREADY_CONSUMED, record.attemptsUsed(), record);
        }
        if (record.isExpired(Instant.now(clock))) {
            return result(VerificationCodeStatus.EXPIRED, record.attemptsUsed(), record);
        }
        // 两次读取之间记录刚被替换
        return result(VerificationCodeStatus.ALREADY_CONSUMED, record.attemptsUsed(), record);
    }

    private static VerificationCheckResult result(VerificationCodeStatus status, int attempts, AdminCodeRecord record) {
        return new VerificationCheckResult(status, attempts, record.maxAttempts());
    }
}
