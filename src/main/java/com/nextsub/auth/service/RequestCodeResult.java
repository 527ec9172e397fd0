package com.nextsub.auth.service;

import com.nextsub.auth.ratelimit.RateLimitDecision;

import java.time.Instant;

public record RequestCodeResult(Instant expiresAt, RateLimitDecision rateLimit) {
}
