package com.nextsub.auth.api;

import com.nextsub.auth.api.dto.AdminInfoResponse;
import com.nextsub.auth.api.dto.ApiMessageResponse;
import com.nextsub.auth.api.dto.RequestCodeRequest;
import com.nextsub.auth.api.dto.VerifyCodeRequest;
import com.nextsub.auth.api.dto.VerifyCodeResponse;
import com.nextsub.auth.model.ClientInfoResolver;
import com.nextsub.auth.ratelimit.RateLimitDecision;
import com.nextsub.auth.service.AdminAuthService;
import com.nextsub.auth.service.RequestCodeResult;
import com.nextsub.auth.service.VerifyCodeResult;
import com.nextsub.auth.token.AdminSessionCookies;
import com.nextsub.auth.token.AdminSessionToken;
import com.nextsub.auth.token.JwtService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 管理员认证 API。
 * <p>
 * - `POST /admin/request-code`：向管理员邮箱发送一次性验证码；
 * - `POST /admin/verify-code`：校验验证码，成功后返回会话令牌并写入 HttpOnly Cookie；
 * - `GET /admin/me`：返回当前管理员信息（Cookie 或 Bearer）；
 * - `POST /admin/logout`：清除会话 Cookie。
 * 限流端点附带 `X-RateLimit-*` 响应头。
 */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Validated
public class AdminAuthController {

    static final String HEADER_LIMIT = "X-RateLimit-Limit";
    static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    static final String HEADER_RESET = "X-RateLimit-Reset";

    private final AdminAuthService adminAuthService;
    private final ClientInfoResolver clientInfoResolver;
    private final AdminSessionCookies sessionCookies;
    private final JwtService jwtService;

    @PostMapping("/request-code")
    public ResponseEntity<ApiMessageResponse> requestCode(@Valid @RequestBody RequestCodeRequest request,
                                                          HttpServletRequest httpRequest) {
        RequestCodeResult result = adminAuthService.requestCode(request.email(), clientInfoResolver.resolve(httpRequest));
        return ResponseEntity.ok()
                .headers(rateLimitHeaders(result.rateLimit()))
                .body(ApiMessageResponse.ok("Secret code sent to admin email"));
    }

    @PostMapping("/verify-code")
    public ResponseEntity<VerifyCodeResponse> verifyCode(@Valid @RequestBody VerifyCodeRequest request,
                                                         HttpServletRequest httpRequest) {
        VerifyCodeResult result = adminAuthService.verifyCode(request.email(), request.code(),
                clientInfoResolver.resolve(httpRequest));
        AdminSessionToken session = result.session();
        return ResponseEntity.ok()
                .headers(rateLimitHeaders(result.rateLimit()))
                .header(HttpHeaders.SET_COOKIE, sessionCookies.issue(session).toString())
                .body(new VerifyCodeResponse(true, "Admin authenticated", session.token(), session.expiresAt()));
    }

    @GetMapping("/me")
    public AdminInfoResponse me(@AuthenticationPrincipal Jwt jwt) {
        return new AdminInfoResponse(true,
                new AdminInfoResponse.AdminView(jwtService.extractEmail(jwt), jwtService.extractRole(jwt)));
    }

    @PostMapping("/logout")
    public ResponseEntity<ApiMessageResponse> logout(@AuthenticationPrincipal Jwt jwt, HttpServletRequest httpRequest) {
        adminAuthService.logout(jwtService.extractEmail(jwt), clientInfoResolver.resolve(httpRequest));
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookies.clear().toString())
                .body(ApiMessageResponse.ok("Admin logged out successfully"));
    }

    private static HttpHeaders rateLimitHeaders(RateLimitDecision decision) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HEADER_LIMIT, String.valueOf(decision.limit()));
        headers.set(HEADER_REMAINING, String.valueOf(decision.remaining()));
        headers.set(HEADER_RESET, String.valueOf(decision.resetAt().getEpochSecond()));
        return headers;
    }
}
