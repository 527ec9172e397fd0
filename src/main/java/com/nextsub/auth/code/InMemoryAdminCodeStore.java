package com.nextsub.auth.code;

import com.nextsub.auth.model.ClientInfo;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 进程内验证码存储，用于本地开发与单实例部署。
 * <p>
 * 所有读改写都走 {@link ConcurrentHashMap#compute} 系列方法，按键原子；
 * 过期记录不主动清理，下一次签发时被替换。
 */
@Component
@ConditionalOnProperty(prefix = "auth.store", name = "type", havingValue = "memory")
public class InMemoryAdminCodeStore implements AdminCodeStore {

    private final ConcurrentHashMap<String, AdminCodeRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> latestByPrincipal = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryAdminCodeStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public AdminCodeRecord issue(String principalId, String codeDigest, Duration ttl, int maxAttempts, ClientInfo client) {
        Instant issuedAt = Instant.now(clock);
        String id = UUID.randomUUID().toString();
        AdminCodeRecord fresh = new AdminCodeRecord(id, principalId, codeDigest, issuedAt, issuedAt.plus(ttl),
                0, maxAttempts, false, client.ip(), client.userAgent());
        latestByPrincipal.compute(principalId, (key, previousId) -> {
            if (previousId != null) {
                records.remove(previousId);
            }
            records.put(id, fresh);
            return id;
        });
        return fresh;
    }

    @Override
    public Optional<AdminCodeRecord> loadLive(String principalId) {
        Instant now = Instant.now(clock);
        return loadLatest(principalId).filter(record -> record.isLive(now));
    }

    @Override
    public Optional<AdminCodeRecord> loadLatest(String principalId) {
        String id = latestByPrincipal.get(principalId);
        return id == null ? Optional.empty() : Optional.ofNullable(records.get(id));
    }

    @Override
    public int recordFailedAttempt(String recordId) {
        AdminCodeRecord updated = records.computeIfPresent(recordId, (key, record) -> record.withFailedAttempt());
        return updated == null ? -1 : updated.attemptsUsed();
    }

    @Override
    public boolean consume(String recordId) {
        AtomicBoolean switched = new AtomicBoolean(false);
        records.computeIfPresent(recordId, (key, record) -> {
            if (record.consumed()) {
                return record;
            }
            switched.set(true);
            return record.asConsumed();
        });
        return switched.get();
    }
}
