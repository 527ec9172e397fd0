package com.nextsub.auth.ratelimit;

import java.time.Duration;

/**
 * 固定窗口限流器。
 * <p>
 * 按 `(clientKey, action)` 计数：窗口不存在或已过期时开新窗口并放行；
 * 否则在计数未达上限时原子加一并放行，达到上限则拒绝并返回剩余等待时间。
 * 同一键的并发调用不会出现两个请求同时成为“第 N 个”。
 */
public interface RateLimiter {

    RateLimitDecision checkAndIncrement(String clientKey, RateLimitAction action, int limit, Duration window);
}
