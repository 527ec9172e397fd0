package com.nextsub.auth.token;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.oauth2.server.resource.web.BearerTokenResolver;
import org.springframework.security.oauth2.server.resource.web.DefaultBearerTokenResolver;
import org.springframework.security.web.util.matcher.RequestMatcher;

/**
 * 先取会话 Cookie，再回退到 `Authorization: Bearer`。
 * <p>
 * 公开端点（申请/校验验证码）不解析令牌，残留的过期 Cookie 不会让重新登录变成 401。
 */
public class CookieBearerTokenResolver implements BearerTokenResolver {

    private final String cookieName;
    private final RequestMatcher publicEndpoints;
    private final DefaultBearerTokenResolver headerResolver = new DefaultBearerTokenResolver();

    public CookieBearerTokenResolver(String cookieName, RequestMatcher publicEndpoints) {
        this.cookieName = cookieName;
        this.publicEndpoints = publicEndpoints;
    }

    @Override
    public String resolve(HttpServletRequest request) {
        if (publicEndpoints.matches(request)) {
            return null;
        }
        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (cookieName.equals(cookie.getName()) && cookie.getValue() != null && !cookie.getValue().isBlank()) {
                    return cookie.getValue();
                }
            }
        }
        return headerResolver.resolve(request);
    }
}
