package com.nextsub.auth.security;

import com.nextsub.auth.token.AdminSessionCookies;
import com.nextsub.common.exception.ErrorCode;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Arrays;

/**
 * 未认证或令牌无效时返回 401。
 * <p>
 * 请求携带了会话 Cookie 时一并下发清除 Cookie，避免浏览器反复提交失效令牌。
 */
@Component
@RequiredArgsConstructor
public class AdminAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final AdminSessionCookies sessionCookies;
    private final ErrorResponseWriter writer;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        if (hasSessionCookie(request)) {
            response.addHeader(HttpHeaders.SET_COOKIE, sessionCookies.clear().toString());
        }
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith("Bearer ")) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
        }
        writer.write(response, ErrorCode.UNAUTHORIZED);
    }

    private boolean hasSessionCookie(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        return cookies != null && Arrays.stream(cookies)
                .anyMatch(cookie -> sessionCookies.cookieName().equals(cookie.getName()));
    }
}
