package com.nextsub.auth.audit;

import com.nextsub.auth.config.AsyncConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class AuditEntryListener {

    private final List<AuditSink> sinks;

    @Async(AsyncConfig.AUDIT_EXECUTOR)
    @EventListener
    public void onAuditEntry(AdminAuditEntry entry) {
        for (AuditSink sink : sinks) {
            try {
                sink.append(entry);
            } catch (RuntimeException ex) {
                log.warn("Audit sink {} failed for action={} outcome={}",
                        sink.getClass().getSimpleName(), entry.action(), entry.outcome(), ex);
            }
        }
    }
}
