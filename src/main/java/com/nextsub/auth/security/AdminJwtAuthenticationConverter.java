package com.nextsub.auth.security;

import com.nextsub.auth.token.JwtService;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * 将 `role` 声明映射为 `ROLE_<ROLE>` 权限；非管理员类型的令牌不授予任何权限。
 */
public class AdminJwtAuthenticationConverter implements Converter<Jwt, AbstractAuthenticationToken> {

    @Override
    public AbstractAuthenticationToken convert(Jwt jwt) {
        return new JwtAuthenticationToken(jwt, authorities(jwt), principalName(jwt));
    }

    private static Collection<GrantedAuthority> authorities(Jwt jwt) {
        if (!JwtService.TOKEN_TYPE_ADMIN.equals(jwt.getClaimAsString(JwtService.CLAIM_TOKEN_TYPE))) {
            return List.of();
        }
        String role = jwt.getClaimAsString(JwtService.CLAIM_ROLE);
        if (role == null || role.isBlank()) {
            return List.of();
        }
        return List.of(new SimpleGrantedAuthority("ROLE_" + role.trim().toUpperCase(Locale.ROOT)));
    }

    private static String principalName(Jwt jwt) {
        String email = jwt.getClaimAsString(JwtService.CLAIM_EMAIL);
        return email != null ? email : jwt.getSubject();
    }
}
