package com.nextsub.auth.audit;

import com.nextsub.auth.config.AuthProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 进程内审计环形缓冲，`auth.store.type=memory` 时启用。
 */
@Component
@Order(1)
@ConditionalOnProperty(prefix = "auth.store", name = "type", havingValue = "memory")
public class InMemoryAuditSink implements AuditSink {

    private final Deque<AdminAuditEntry> entries = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final int maxEntries;

    public InMemoryAuditSink(AuthProperties properties) {
        this.maxEntries = Math.max(1, properties.getAudit().getMemoryMaxEntries());
    }

    @Override
    public void append(AdminAuditEntry entry) {
        entries.addFirst(entry);
        if (size.incrementAndGet() > maxEntries && entries.pollLast() != null) {
            size.decrementAndGet();
        }
    }

    /**
     * 最近的记录，新记录在前。
     */
    public List<AdminAuditEntry> recent() {
        return new ArrayList<>(entries);
    }
}
