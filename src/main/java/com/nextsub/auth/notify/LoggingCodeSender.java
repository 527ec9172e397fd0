package com.nextsub.auth.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * 开发/测试用验证码发送器。
 * <p>
 * 不实际发送，仅记录日志，便于本地开发；生产环境必须使用 `auth.notify.channel=mail`。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "auth.notify", name = "channel", havingValue = "log")
public class LoggingCodeSender implements CodeSender {

    @Override
    public void sendCode(String email, String code, Instant expiresAt) {
        log.warn("[dev] Admin code for {} is {} (expiresAt={})", email, code, expiresAt);
    }
}
