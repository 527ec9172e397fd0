package com.nextsub.auth.ratelimit;

import lombok.Getter;

@Getter
public enum RateLimitAction {
    REQUEST_CODE("request-code"),
    VERIFY_CODE("verify-code");

    private final String key;

    RateLimitAction(String key) {
        this.key = key;
    }
}
