package com.nextsub.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 业务错误码。
 *
 * <p>每个错误码绑定对外的 HTTP 状态与默认文案；对外文案刻意保持笼统，
 * 不区分“验证码错误 / 已过期 / 不存在 / 尝试超限”，避免被用于探测。</p>
 */
@Getter
public enum ErrorCode {

    BAD_REQUEST("BAD_REQUEST", HttpStatus.BAD_REQUEST, "Invalid request"),
    ADMIN_IDENTITY_MISMATCH("ADMIN_IDENTITY_MISMATCH", HttpStatus.FORBIDDEN, "Invalid email or code"),
    INVALID_OR_EXPIRED_CODE("INVALID_OR_EXPIRED_CODE", HttpStatus.BAD_REQUEST, "Invalid or expired code"),
    RATE_LIMITED("RATE_LIMITED", HttpStatus.TOO_MANY_REQUESTS, "Too many requests. Please try again later."),
    NOTIFICATION_FAILED("NOTIFICATION_FAILED", HttpStatus.INTERNAL_SERVER_ERROR, "Failed to send admin code email. Please try again."),
    STORE_UNAVAILABLE("STORE_UNAVAILABLE", HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),
    UNAUTHORIZED("UNAUTHORIZED", HttpStatus.UNAUTHORIZED, "Invalid or expired admin token"),
    FORBIDDEN("FORBIDDEN", HttpStatus.FORBIDDEN, "Forbidden - Admin access required"),
    NOT_FOUND("NOT_FOUND", HttpStatus.NOT_FOUND, "Resource not found"),
    INTERNAL_ERROR("INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");

    private final String code;
    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(String code, HttpStatus status, String defaultMessage) {
        this.code = code;
        this.status = status;
        this.defaultMessage = defaultMessage;
    }
}
