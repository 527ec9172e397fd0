package com.nextsub.auth.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nextsub.auth.notify.CodeSender;
import com.nextsub.auth.token.JwtService;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AdminAuthControllerTest {

    private static final String ADMIN = "admin@nextsubscription.local";
    private static final AtomicInteger CLIENT_SEQ = new AtomicInteger();

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private CapturingCodeSender codeSender;

    @Autowired
    private JwtService jwtService;

    private String clientIp;

    @BeforeEach
    void setUp() {
        // 限流计数在同一上下文内共享，每个用例使用独立来源地址
        clientIp = "198.51.100." + CLIENT_SEQ.incrementAndGet();
    }

    @Test
    void requestCodeSendsCodeAndReportsRateLimit() throws Exception {
        mockMvc.perform(post("/admin/request-code").with(client())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", ADMIN))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Secret code sent to admin email"))
                .andExpect(header().string("X-RateLimit-Limit", "6"))
                .andExpect(header().string("X-RateLimit-Remaining", "5"))
                .andExpect(header().exists("X-RateLimit-Reset"));

        assertThat(codeSender.lastCode(ADMIN)).hasSizeBetween(20, 30);
    }

    @Test
    void fullLoginFlowIssuesCookieAndToken() throws Exception {
        String code = requestCode();

        MvcResult verified = mockMvc.perform(post("/admin/verify-code").with(client())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", ADMIN, "code", code))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Admin authenticated"))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("adminToken=")))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("HttpOnly")))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("SameSite=Strict")))
                .andReturn();
        String token = body(verified).get("token").asText();

        mockMvc.perform(get("/admin/me").cookie(new Cookie("adminToken", token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.admin.email").value(ADMIN))
                .andExpect(jsonPath("$.admin.role").value("admin"));

        mockMvc.perform(get("/admin/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.admin.email").value(ADMIN));
    }

    @Test
    void replayedCodeIsRejected() throws Exception {
        String code = requestCode();
        String body = json(Map.of("email", ADMIN, "code", code));
        mockMvc.perform(post("/admin/verify-code").with(client())
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk());

        mockMvc.perform(post("/admin/verify-code").with(client())
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("INVALID_OR_EXPIRED_CODE"))
                .andExpect(jsonPath("$.message").value("Invalid or expired code"));
    }

    @Test
    void wrongEmailIsForbidden() throws Exception {
        mockMvc.perform(post("/admin/request-code").with(client())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "someone@example.com"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("ADMIN_IDENTITY_MISMATCH"));

        mockMvc.perform(post("/admin/verify-code").with(client())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "someone@example.com", "code", "Aa1!whatever"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Invalid email or code"));
    }

    @Test
    void malformedRequestIsBadRequest() throws Exception {
        mockMvc.perform(post("/admin/request-code").with(client())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.message").value("Email is required"));

        mockMvc.perform(post("/admin/verify-code").with(client())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", ADMIN))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Email and code are required"));
    }

    @Test
    void seventhRequestIsRateLimited() throws Exception {
        for (int i = 0; i < 6; i++) {
            requestCode();
        }

        mockMvc.perform(post("/admin/request-code").with(client())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", ADMIN))))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists(HttpHeaders.RETRY_AFTER))
                .andExpect(jsonPath("$.code").value("RATE_LIMITED"))
                .andExpect(jsonPath("$.retryAfter").value(greaterThan(0)));
    }

    @Test
    void meWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/admin/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    void invalidCookieIsClearedOnUnauthorized() throws Exception {
        mockMvc.perform(get("/admin/me").cookie(new Cookie("adminToken", "not-a-jwt")))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("adminToken=")))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("Max-Age=0")));
    }

    @Test
    void staleCookieDoesNotBlockLogin() throws Exception {
        mockMvc.perform(post("/admin/request-code").with(client())
                        .cookie(new Cookie("adminToken", "expired-token"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", ADMIN))))
                .andExpect(status().isOk());
    }

    @Test
    void nonAdminRoleIsForbidden() throws Exception {
        String token = jwtService.issueAdminToken(ADMIN, "viewer").token();

        mockMvc.perform(get("/admin/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void meReadsClaimsOfAuthenticatedAdmin() throws Exception {
        mockMvc.perform(get("/admin/me").with(jwt()
                        .jwt(token -> token.claim("email", "ops@nextsubscription.local").claim("role", "admin"))
                        .authorities(new SimpleGrantedAuthority("ROLE_ADMIN"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.admin.email").value("ops@nextsubscription.local"));
    }

    @Test
    void logoutClearsCookie() throws Exception {
        String token = jwtService.issueAdminToken(ADMIN, "admin").token();

        mockMvc.perform(post("/admin/logout").with(client()).cookie(new Cookie("adminToken", token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Admin logged out successfully"))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("Max-Age=0")));
    }

    private String requestCode() throws Exception {
        mockMvc.perform(post("/admin/request-code").with(client())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", ADMIN))))
                .andExpect(status().isOk());
        return codeSender.lastCode(ADMIN);
    }

    private RequestPostProcessor client() {
        String ip = clientIp;
        return request -> {
            request.setRemoteAddr(ip);
            return request;
        };
    }

    private String json(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    static class CapturingCodeSender implements CodeSender {

        private final Map<String, String> lastCodes = new ConcurrentHashMap<>();

        @Override
        public void sendCode(String email, String code, Instant expiresAt) {
            lastCodes.put(email, code);
        }

        String lastCode(String email) {
            return lastCodes.get(email);
        }
    }

    @TestConfiguration
    static class CodeSenderConfig {

        @Bean
        @Primary
        CapturingCodeSender capturingCodeSender() {
            return new CapturingCodeSender();
        }
    }
}
