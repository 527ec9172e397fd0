package com.nextsub.auth.notify;

import com.nextsub.auth.audit.AdminAuditLogger;
import com.nextsub.auth.audit.AuditAction;
import com.nextsub.auth.audit.AuditOutcome;
import com.nextsub.auth.config.AsyncConfig;
import com.nextsub.auth.config.AuthProperties;
import com.nextsub.auth.model.ClientInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * 验证码投递。
 * <p>
 * 默认同步发送，失败向上抛出 {@link NotificationException}；
 * `auth.notify.async=true` 时交给通知线程池，响应不等待投递结果，失败只记日志与审计；
 * 线程池拒绝任务时同样抛出 {@link NotificationException}。
 */
@Slf4j
@Component
public class CodeDispatcher {

    public static final String REASON_NOTIFICATION_FAILURE = "NOTIFICATION_FAILURE";

    private final CodeSender codeSender;
    private final TaskExecutor executor;
    private final AdminAuditLogger auditLogger;
    private final boolean async;

    public CodeDispatcher(CodeSender codeSender,
                          @Qualifier(AsyncConfig.NOTIFICATION_EXECUTOR) TaskExecutor executor,
                          AdminAuditLogger auditLogger,
                          AuthProperties properties) {
        this.codeSender = codeSender;
        this.executor = executor;
        this.auditLogger = auditLogger;
        this.async = properties.getNotify().isAsync();
    }

    public void dispatch(String email, String code, Instant expiresAt, ClientInfo client) {
        if (!async) {
            codeSender.sendCode(email, code, expiresAt);
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    codeSender.sendCode(email, code, expiresAt);
                } catch (RuntimeException ex) {
                    log.error("Async admin code delivery failed for {}", email, ex);
                    auditLogger.record(AuditAction.REQUEST_CODE, AuditOutcome.FAILURE, REASON_NOTIFICATION_FAILURE,
                            email, client, ex.getClass().getSimpleName());
                }
            });
        } catch (TaskRejectedException ex) {
            // 线程池已满，按同步投递失败处理
            throw new NotificationException("Admin code delivery rejected by notification executor", ex);
        }
    }
}
