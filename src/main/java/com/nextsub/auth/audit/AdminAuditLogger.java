package com.nextsub.auth.audit;

import com.nextsub.auth.model.ClientInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * 管理员认证审计入口。
 * <p>
 * 以应用事件发出审计记录，由 {@link AuditEntryListener} 在独立线程池中写入各 {@link AuditSink}。
 * 发布失败（如线程池队列已满）只记录告警，不影响登录主流程。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminAuditLogger {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public void record(AdminAuditEntry entry) {
        try {
            eventPublisher.publishEvent(entry);
        } catch (RuntimeException ex) {
            log.warn("Failed to publish admin audit entry action={} outcome={} reason={}",
                    entry.action(), entry.outcome(), entry.reason(), ex);
        }
    }

    public void record(AuditAction action, AuditOutcome outcome, String reason,
                       String principalId, ClientInfo client, String detail) {
        record(AdminAuditEntry.builder()
                .timestamp(Instant.now(clock))
                .action(action)
                .outcome(outcome)
                .reason(reason)
                .principalId(principalId)
                .clientKey(client.ip())
                .clientAgent(client.userAgent())
                .detail(detail)
                .build());
    }
}
