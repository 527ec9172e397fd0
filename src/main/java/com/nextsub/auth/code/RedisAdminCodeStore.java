package com.nextsub.auth.code;

import com.nextsub.auth.config.AuthProperties;
import com.nextsub.auth.model.ClientInfo;
import com.nextsub.common.exception.StoreUnavailableException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 基于 Redis 的管理员验证码存储。
 * <p>
 * 结构：
 * - `{prefix}code:latest:{principal}` → 最近一条记录 ID；
 * - `{prefix}code:rec:{id}` → Hash，字段 `digest/issuedAt/expiresAt/attempts/maxAttempts/consumed/ip/ua`。
 * 签发、失败计数与消费均由 Lua 脚本完成，保证并发下不丢更新、不出现两条有效记录。
 * Key 的 TTL 只负责回收空间，有效期以 `expiresAt` 为准，在读取时判断。
 */
@Component
@ConditionalOnProperty(prefix = "auth.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisAdminCodeStore implements AdminCodeStore {

    private static final Duration RETENTION_GRACE = Duration.ofMinutes(30);

    private static final String FIELD_ID = "id";
    private static final String FIELD_PRINCIPAL = "principal";
    private static final String FIELD_DIGEST = "digest";
    private static final String FIELD_ISSUED_AT = "issuedAt";
    private static final String FIELD_EXPIRES_AT = "expiresAt";
    private static final String FIELD_ATTEMPTS = "attempts";
    private static final String FIELD_MAX_ATTEMPTS = "maxAttempts";
    private static final String FIELD_CONSUMED = "consumed";
    private static final String FIELD_IP = "ip";
    private static final String FIELD_UA = "ua";

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;
    private final String keyPrefix;
    private final DefaultRedisScript<Long> issueScript;
    private final DefaultRedisScript<Long> failScript;
    private final DefaultRedisScript<Long> consumeScript;

    public RedisAdminCodeStore(StringRedisTemplate redisTemplate, Clock clock, AuthProperties properties) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.keyPrefix = properties.getStore().getKeyPrefix();
        this.issueScript = script(ISSUE_LUA);
        this.failScript = script(FAIL_LUA);
        this.consumeScript = script(CONSUME_LUA);
    }

    @Override
    public AdminCodeRecord issue(String principalId, String codeDigest, Duration ttl, int maxAttempts, ClientInfo client) {
        // 以毫秒精度入库，返回值与读取结果一致
        Instant issuedAt = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
        Instant expiresAt = issuedAt.plus(ttl);
        String id = UUID.randomUUID().toString();
        long retentionMillis = ttl.plus(RETENTION_GRACE).toMillis();
        try {
            redisTemplate.execute(issueScript,
                    List.of(latestKey(principalId), recordKey(id)),
                    id,
                    recordPrefix(),
                    principalId,
                    codeDigest,
                    String.valueOf(issuedAt.toEpochMilli()),
                    String.valueOf(expiresAt.toEpochMilli()),
                    String.valueOf(maxAttempts),
                    client.ip(),
                    client.userAgent(),
                    String.valueOf(retentionMillis));
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Failed to issue admin code", ex);
        }
        return new AdminCodeRecord(id, principalId, codeDigest, issuedAt, expiresAt,
                0, maxAttempts, false, client.ip(), client.userAgent());
    }

    @Override
    public Optional<AdminCodeRecord> loadLive(String principalId) {
        Instant now = Instant.now(clock);
        return loadLatest(principalId).filter(record -> record.isLive(now));
    }

    @Override
    public Optional<AdminCodeRecord> loadLatest(String principalId) {
        try {
            String id = redisTemplate.opsForValue().get(latestKey(principalId));
            if (id == null) {
                return Optional.empty();
            }
            HashOperations<String, String, String> ops = redisTemplate.opsForHash();
            Map<String, String> data = ops.entries(recordKey(id));
            if (data == null || data.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(toRecord(id, principalId, data));
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Failed to load admin code", ex);
        }
    }

    @Override
    public int recordFailedAttempt(String recordId) {
        try {
            Long attempts = redisTemplate.execute(failScript, List.of(recordKey(recordId)));
            return attempts == null ? -1 : attempts.intValue();
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Failed to record admin code attempt", ex);
        }
    }

    @Override
    public boolean consume(String recordId) {
        try {
            Long switched = redisTemplate.execute(consumeScript, List.of(recordKey(recordId)));
            return switched != null && switched == 1L;
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Failed to consume admin code", ex);
        }
    }

    private AdminCodeRecord toRecord(String id, String principalId, Map<String, String> data) {
        return new AdminCodeRecord(
                data.getOrDefault(FIELD_ID, id),
                data.getOrDefault(FIELD_PRINCIPAL, principalId),
                data.get(FIELD_DIGEST),
                Instant.ofEpochMilli(parseLong(data.get(FIELD_ISSUED_AT), 0L)),
                Instant.ofEpochMilli(parseLong(data.get(FIELD_EXPIRES_AT), 0L)),
                (int) parseLong(data.get(FIELD_ATTEMPTS), 0L),
                (int) parseLong(data.get(FIELD_MAX_ATTEMPTS), 0L),
                !"0".equals(data.get(FIELD_CONSUMED)),
                data.get(FIELD_IP),
                data.get(FIELD_UA));
    }

    private String latestKey(String principalId) {
        return keyPrefix + "code:latest:" + principalId;
    }

    private String recordPrefix() {
        return keyPrefix + "code:rec:";
    }

    private String recordKey(String id) {
        return recordPrefix() + id;
    }

    private static DefaultRedisScript<Long> script(String text) {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setResultType(Long.class);
        script.setScriptText(text);
        return script;
    }

    // 缺失或损坏的数值字段按保守值处理：过期时间 0 即已过期，上限 0 即已超限
    private static long parseLong(String value, long defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    // KEYS[1]=latest 指针, KEYS[2]=新记录; 旧记录若仍存在则置为已使用
    private static final String ISSUE_LUA = """
            local previous = redis.call('GET', KEYS[1])
            if previous and redis.call('EXISTS', ARGV[2] .. previous) == 1 then
              redis.call('HSET', ARGV[2] .. previous, 'consumed', '1')
            end
            redis.call('HSET', KEYS[2],
              'id', ARGV[1], 'principal', ARGV[3], 'digest', ARGV[4],
              'issuedAt', ARGV[5], 'expiresAt', ARGV[6],
              'attempts', '0', 'maxAttempts', ARGV[7], 'consumed', '0',
              'ip', ARGV[8], 'ua', ARGV[9])
            redis.call('PEXPIRE', KEYS[2], ARGV[10])
            redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[10])
            return 1
            """;

    private static final String FAIL_LUA = """
            if redis.call('EXISTS', KEYS[1]) == 0 then
              return -1
            end
            local attempts = tonumber(redis.call('HGET', KEYS[1], 'attempts')) or 0
            if redis.call('HGET', KEYS[1], 'consumed') ~= '0' then
              return attempts
            end
            local max = tonumber(redis.call('HGET', KEYS[1], 'maxAttempts'))
            if max == nil then
              redis.call('HSET', KEYS[1], 'consumed', '1')
              return attempts
            end
            if attempts < max then
              attempts = redis.call('HINCRBY', KEYS[1], 'attempts', 1)
            end
            if attempts >= max then
              redis.call('HSET', KEYS[1], 'consumed', '1')
            end
            return attempts
            """;

    private static final String CONSUME_LUA = """
            if redis.call('HGET', KEYS[1], 'consumed') == '0' then
              redis.call('HSET', KEYS[1], 'consumed', '1')
              return 1
            end
            return 0
            """;
}
