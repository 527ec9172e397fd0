package com.nextsub.auth.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 进程内固定窗口限流。
 * <p>
 * 计数表按键 {@code compute}，判定与自增在同一原子步骤内完成；
 * 已结束的窗口由定时任务清理，防止来源地址过多时无限增长。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "auth.store", name = "type", havingValue = "memory")
public class InMemoryRateLimiter implements RateLimiter {

    private record Window(Instant start, Instant end, int count) {
    }

    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateLimiter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public RateLimitDecision checkAndIncrement(String clientKey, RateLimitAction action, int limit, Duration window) {
        Instant now = Instant.now(clock);
        AtomicReference<RateLimitDecision> decision = new AtomicReference<>();
        windows.compute(key(clientKey, action), (key, existing) -> {
            Window current = existing == null || !now.isBefore(existing.end())
                    ? new Window(now, now.plus(window), 0)
                    : existing;
            if (current.count() >= limit) {
                decision.set(RateLimitDecision.denied(limit, current.count(), current.end(),
                        Duration.between(now, current.end())));
                return current;
            }
            Window next = new Window(current.start(), current.end(), current.count() + 1);
            decision.set(RateLimitDecision.allowed(limit, next.count(), next.end()));
            return next;
        });
        return decision.get();
    }

    @Scheduled(fixedDelayString = "${auth.rate-limit.purge-interval:PT5M}")
    public void purgeElapsed() {
        Instant now = Instant.now(clock);
        int before = windows.size();
        windows.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().end()));
        int removed = before - windows.size();
        if (removed > 0) {
            log.debug("Purged {} elapsed rate limit windows", removed);
        }
    }

    int size() {
        return windows.size();
    }

    private static String key(String clientKey, RateLimitAction action) {
        return action.getKey() + ":" + clientKey;
    }
}
