package com.nextsub.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 统一错误响应体，`retryAfter`（秒）仅在 429 时出现。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(boolean success, String code, String message, Long retryAfter) {

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(false, code, message, null);
    }

    public static ErrorResponse rateLimited(String code, String message, long retryAfterSeconds) {
        return new ErrorResponse(false, code, message, retryAfterSeconds);
    }
}
