package com.nextsub.auth.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 写入 `ADMIN_AUDIT` 日志，logback 将其路由到独立的滚动文件。
 */
@Component
@Order(0)
public class LoggingAuditSink implements AuditSink {

    private static final Logger AUDIT = LoggerFactory.getLogger("ADMIN_AUDIT");

    @Override
    public void append(AdminAuditEntry entry) {
        AUDIT.info("ts={} action={} outcome={} reason={} principal={} client={} agent=\"{}\" detail=\"{}\"",
                entry.timestamp(), entry.action(), entry.outcome(), entry.reason(),
                entry.principalId(), entry.clientKey(), entry.clientAgent(), entry.detail());
    }
}
