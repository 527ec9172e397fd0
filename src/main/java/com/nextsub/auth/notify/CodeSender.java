package com.nextsub.auth.notify;

import java.time.Instant;

/**
 * 验证码发送器接口。
 * <p>
 * 明文验证码只经由这里离开系统。默认实现为邮件，开发环境可替换为日志输出。
 * 发送失败抛出 {@link NotificationException}。
 */
public interface CodeSender {

    void sendCode(String email, String code, Instant expiresAt);
}
