package com.nextsub.auth.ratelimit;

import com.nextsub.auth.config.AuthProperties;
import com.nextsub.common.exception.StoreUnavailableException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 基于 Redis 的固定窗口限流，适用于多实例部署。
 * <p>
 * 窗口即带 TTL 的计数键 `{prefix}rl:{action}:{client}`：键不存在时以计数 1 创建并设置窗口时长；
 * 已达上限时不再自增，返回 `PTTL` 作为剩余等待时间。判断与自增在一个 Lua 脚本内完成，
 * 放行时另读一次 `PTTL` 得到窗口重置时间。
 */
@Component
@ConditionalOnProperty(prefix = "auth.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisRateLimiter implements RateLimiter {

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;
    private final String keyPrefix;
    private final DefaultRedisScript<Long> windowScript;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, Clock clock, AuthProperties properties) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.keyPrefix = properties.getStore().getKeyPrefix();
        this.windowScript = new DefaultRedisScript<>();
        this.windowScript.setResultType(Long.class);
        this.windowScript.setScriptText(WINDOW_LUA);
    }

    @Override
    public RateLimitDecision checkAndIncrement(String clientKey, RateLimitAction action, int limit, Duration window) {
        String key = keyPrefix + "rl:" + action.getKey() + ":" + clientKey;
        Instant now = Instant.now(clock);
        try {
            Long result = redisTemplate.execute(windowScript, List.of(key),
                    String.valueOf(limit), String.valueOf(window.toMillis()));
            if (result == null) {
                throw new IllegalStateException("Rate limit script returned no result for " + key);
            }
            if (result < 0) {
                Duration retryAfter = Duration.ofMillis(-result);
                return RateLimitDecision.denied(limit, Math.max(limit, 0), now.plus(retryAfter), retryAfter);
            }
            Long ttlMillis = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
            Duration remaining = ttlMillis == null || ttlMillis < 0 ? window : Duration.ofMillis(ttlMillis);
            return RateLimitDecision.allowed(limit, result.intValue(), now.plus(remaining));
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Rate limit store unavailable", ex);
        }
    }

    // 放行返回当前计数（>=1），拒绝返回窗口剩余毫秒的相反数（<=-1）
    private static final String WINDOW_LUA = """
            local limit = tonumber(ARGV[1])
            local windowMs = tonumber(ARGV[2])
            local current = tonumber(redis.call('GET', KEYS[1]) or '0')
            local ttl = redis.call('PTTL', KEYS[1])
            if current == 0 or ttl < 0 then
              if limit < 1 then
                return -windowMs
              end
              redis.call('SET', KEYS[1], 1, 'PX', windowMs)
              return 1
            end
            if current >= limit then
              return -math.max(ttl, 1)
            end
            return redis.call('INCR', KEYS[1])
            """;
}
