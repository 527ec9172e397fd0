package com.nextsub.common.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * 请求频率超限。
 *
 * <p>携带距离当前计数窗口重置的剩余时间，由异常处理器写入 {@code Retry-After}。</p>
 */
@Getter
public class RateLimitedException extends BusinessException {

    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super(ErrorCode.RATE_LIMITED, message);
        this.retryAfter = retryAfter;
    }

    /**
     * 向上取整到秒，至少为 1。
     */
    public long retryAfterSeconds() {
        long millis = retryAfter == null ? 0 : retryAfter.toMillis();
        return Math.max(1L, (millis + 999) / 1000);
    }
}
