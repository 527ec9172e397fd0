package com.nextsub.auth.model;

import com.nextsub.auth.config.AuthProperties;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 从请求中解析 {@link ClientInfo}。
 * <p>
 * 只有部署在可信反向代理之后（`auth.client.trust-forwarded-headers=true`）才读取
 * `X-Forwarded-For` / `X-Real-IP`，否则客户端可以伪造来源地址绕过限流。
 */
@Component
@RequiredArgsConstructor
public class ClientInfoResolver {

    private final AuthProperties properties;

    public ClientInfo resolve(HttpServletRequest request) {
        return new ClientInfo(extractClientIp(request), request.getHeader("User-Agent"));
    }

    private String extractClientIp(HttpServletRequest request) {
        if (properties.getClient().isTrustForwardedHeaders()) {
            String forwarded = request.getHeader("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
            String realIp = request.getHeader("X-Real-IP");
            if (realIp != null && !realIp.isBlank()) {
                return realIp.trim();
            }
        }
        return request.getRemoteAddr();
    }
}
