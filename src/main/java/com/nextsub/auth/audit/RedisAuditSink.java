package com.nextsub.auth.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nextsub.auth.config.AuthProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * 审计记录以 JSON 追加到 Redis 列表 `{prefix}audit`，只保留最近 N 条，供后续安全审查工具读取。
 */
@Component
@Order(1)
@ConditionalOnProperty(prefix = "auth.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisAuditSink implements AuditSink {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String key;
    private final int maxEntries;

    public RedisAuditSink(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, AuthProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.key = properties.getStore().getKeyPrefix() + "audit";
        this.maxEntries = properties.getAudit().getRedisMaxEntries();
    }

    @Override
    public void append(AdminAuditEntry entry) {
        String json;
        try {
            json = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize audit entry", ex);
        }
        redisTemplate.opsForList().leftPush(key, json);
        redisTemplate.opsForList().trim(key, 0, maxEntries - 1L);
    }
}
