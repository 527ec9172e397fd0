package com.nextsub.auth.config;

import com.nextsub.auth.security.AdminAccessDeniedHandler;
import com.nextsub.auth.security.AdminAuthenticationEntryPoint;
import com.nextsub.auth.security.AdminJwtAuthenticationConverter;
import com.nextsub.auth.token.CookieBearerTokenResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;

import java.util.Locale;

import static org.springframework.security.web.util.matcher.AntPathRequestMatcher.antMatcher;

/**
 * Spring Security 安全配置。
 * <p>
 * - 关闭 CSRF（会话 Cookie 为 SameSite=Strict，其余调用走 Bearer）；
 * - 无状态会话；
 * - 公开申请/校验验证码接口与健康检查，`/admin/**` 其余接口需管理员角色；
 * - 资源服务器校验 JWT，令牌取自 `adminToken` Cookie 或 `Authorization` 头；
 * - 401/403 以统一 JSON 返回。
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final AuthProperties properties;
    private final AdminAuthenticationEntryPoint authenticationEntryPoint;
    private final AdminAccessDeniedHandler accessDeniedHandler;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        RequestMatcher publicEndpoints = publicEndpoints();
        String adminRole = properties.getAdmin().getRole().trim().toUpperCase(Locale.ROOT);
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
                        .requestMatchers(publicEndpoints).permitAll()
                        .requestMatchers("/admin/**").hasRole(adminRole)
                        .anyRequest().authenticated()
                )
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint(authenticationEntryPoint)
                        .accessDeniedHandler(accessDeniedHandler)
                )
                .oauth2ResourceServer(oauth -> oauth
                        .bearerTokenResolver(new CookieBearerTokenResolver(properties.getCookie().getName(), publicEndpoints))
                        .authenticationEntryPoint(authenticationEntryPoint)
                        .accessDeniedHandler(accessDeniedHandler)
                        .jwt(jwt -> jwt.jwtAuthenticationConverter(new AdminJwtAuthenticationConverter()))
                );
        return http.build();
    }

    private static RequestMatcher publicEndpoints() {
        return new OrRequestMatcher(
                antMatcher(HttpMethod.POST, "/admin/request-code"),
                antMatcher(HttpMethod.POST, "/admin/verify-code")
        );
    }
}
