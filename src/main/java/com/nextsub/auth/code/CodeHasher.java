package com.nextsub.auth.code;

import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * 验证码摘要：加盐 BCrypt，只存摘要不存明文。
 */
@Component
@RequiredArgsConstructor
public class CodeHasher {

    private final PasswordEncoder passwordEncoder;

    public String hash(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    public boolean matches(String candidate, String digest) {
        if (candidate == null || digest == null || digest.isEmpty()) {
            return false;
        }
        return passwordEncoder.matches(candidate, digest);
    }
}
