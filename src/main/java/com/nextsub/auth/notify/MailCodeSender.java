package com.nextsub.auth.notify;

import com.nextsub.auth.config.AuthProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;

/**
 * 通过 SMTP 发送验证码邮件，连接参数取自 `spring.mail.*`。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "auth.notify", name = "channel", havingValue = "mail", matchIfMissing = true)
public class MailCodeSender implements CodeSender {

    private final JavaMailSender mailSender;
    private final AdminCodeEmailTemplate template;
    private final AuthProperties properties;
    private final Clock clock;

    @Override
    public void sendCode(String email, String code, Instant expiresAt) {
        AuthProperties.Notify cfg = properties.getNotify();
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, StandardCharsets.UTF_8.name());
            helper.setFrom(cfg.getFrom());
            helper.setTo(email);
            helper.setSubject(cfg.getSubject());
            helper.setText(template.render(code, expiresAt, Instant.now(clock)), true);
            mailSender.send(message);
        } catch (MessagingException | MailException ex) {
            throw new NotificationException("Failed to send admin code email", ex);
        }
        log.info("Admin code email sent, expiresAt={}", expiresAt);
    }
}
