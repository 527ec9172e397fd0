package com.nextsub.auth.service;

import com.nextsub.auth.ratelimit.RateLimitDecision;
import com.nextsub.auth.token.AdminSessionToken;

public record VerifyCodeResult(AdminSessionToken session, RateLimitDecision rateLimit) {
}
