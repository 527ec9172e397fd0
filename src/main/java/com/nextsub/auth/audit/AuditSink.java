package com.nextsub.auth.audit;

/**
 * 审计落地目标。实现方可以抛出异常，由监听器统一吞掉并告警。
 */
public interface AuditSink {

    void append(AdminAuditEntry entry);
}
