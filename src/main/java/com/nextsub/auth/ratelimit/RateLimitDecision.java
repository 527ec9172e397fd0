package com.nextsub.auth.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * 一次限流判定结果。
 *
 * @param allowed 是否放行
 * @param limit 当前窗口上限
 * @param count 本窗口内已计入的请求数（被拒绝的请求不计入）
 * @param resetAt 当前窗口结束时间
 * @param retryAfter 距离窗口重置的剩余时长，放行时为 {@link Duration#ZERO}
 */
public record RateLimitDecision(boolean allowed, int limit, int count, Instant resetAt, Duration retryAfter) {

    public static RateLimitDecision allowed(int limit, int count, Instant resetAt) {
        return new RateLimitDecision(true, limit, count, resetAt, Duration.ZERO);
    }

    public static RateLimitDecision denied(int limit, int count, Instant resetAt, Duration retryAfter) {
        return new RateLimitDecision(false, limit, count, resetAt, retryAfter);
    }

    public int remaining() {
        return Math.max(0, limit - count);
    }
}
