package com.nextsub.auth.token;

import com.nextsub.auth.config.AuthProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * JWT 令牌服务。
 * <p>
 * 功能：验证码校验成功后签发管理员会话令牌（RS256），从已认证的 JWT 中提取邮箱与角色；解码与校验由资源服务器完成。
 * 声明：
 * - `token_type`：固定为 admin；
 * - `email`：管理员邮箱（同时作为 `sub`）；
 * - `role`：管理员角色，资源服务器据此映射为 `ROLE_ADMIN`。
 * 过期时间：来自 `AuthProperties.jwt.sessionTtl`，与验证码有效期无关；无服务端吊销，过期即失效。
 */
@Service
@RequiredArgsConstructor
public class JwtService {

    public static final String CLAIM_TOKEN_TYPE = "token_type";
    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_ROLE = "role";
    public static final String TOKEN_TYPE_ADMIN = "admin";

    private final JwtEncoder jwtEncoder;
    private final AuthProperties properties;
    private final Clock clock;

    public AdminSessionToken issueAdminToken(String principalId, String role) {
        Instant issuedAt = Instant.now(clock);
        Instant expiresAt = issuedAt.plus(properties.getJwt().getSessionTtl());
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(properties.getJwt().getIssuer())
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .subject(principalId)
                .id(UUID.randomUUID().toString())
                .claim(CLAIM_TOKEN_TYPE, TOKEN_TYPE_ADMIN)
                .claim(CLAIM_EMAIL, principalId)
                .claim(CLAIM_ROLE, role)
                .build();
        String token = jwtEncoder.encode(JwtEncoderParameters.from(claims)).getTokenValue();
        return new AdminSessionToken(token, principalId, role, issuedAt, expiresAt);
    }

    public String extractEmail(Jwt jwt) {
        String email = jwt.getClaimAsString(CLAIM_EMAIL);
        return email != null ? email : jwt.getSubject();
    }

    public String extractRole(Jwt jwt) {
        String role = jwt.getClaimAsString(CLAIM_ROLE);
        return role != null ? role : "";
    }
}
