package com.nextsub.auth.api.dto;

import java.time.Instant;

/**
 * 校验成功响应；令牌同时以 HttpOnly Cookie 下发。
 */
public record VerifyCodeResponse(boolean success, String message, String token, Instant expiresAt) {
}
