package com.nextsub.auth.token;

import com.nextsub.auth.config.AuthProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 管理员会话 Cookie：HttpOnly，SameSite 与 Secure 取自配置，有效期与令牌一致。
 */
@Component
@RequiredArgsConstructor
public class AdminSessionCookies {

    private final AuthProperties properties;

    public String cookieName() {
        return properties.getCookie().getName();
    }

    public ResponseCookie issue(AdminSessionToken token) {
        Duration maxAge = Duration.between(token.issuedAt(), token.expiresAt());
        return base(token.token()).maxAge(maxAge).build();
    }

    public ResponseCookie clear() {
        return base("").maxAge(Duration.ZERO).build();
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        AuthProperties.Cookie cfg = properties.getCookie();
        return ResponseCookie.from(cfg.getName(), value)
                .httpOnly(true)
                .secure(cfg.isSecure())
                .sameSite(cfg.getSameSite())
                .path(cfg.getPath());
    }
}
