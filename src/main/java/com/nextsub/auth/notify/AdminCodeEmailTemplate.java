package com.nextsub.auth.notify;

import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 管理员验证码邮件模板（HTML）。验证码含符号，写入前做 HTML 转义。
 */
@Component
public class AdminCodeEmailTemplate {

    private static final DateTimeFormatter EXPIRY_FORMAT =
            DateTimeFormatter.ofPattern("MMM d, yyyy, h:mm a", Locale.US).withZone(ZoneOffset.UTC);

    public String render(String code, Instant expiresAt, Instant now) {
        long minutes = Math.max(1, (Duration.between(now, expiresAt).toSeconds() + 59) / 60);
        return """
                <!DOCTYPE html>
                <html lang="en">
                <head><meta charset="UTF-8"><title>Admin Access Code</title></head>
                <body style="margin:0;padding:0;font-family:Arial,sans-serif;background-color:#f5f5f5;">
                  <table role="presentation" style="width:100%%;border-collapse:collapse;">
                    <tr><td style="padding:40px 20px;text-align:center;">
                      <table role="presentation" style="max-width:600px;margin:0 auto;background-color:#ffffff;border-radius:8px;">
                        <tr><td style="padding:40px 30px;text-align:left;">
                          <h1 style="margin:0 0 20px 0;color:#1a1a1a;font-size:24px;">Admin Access Code Request</h1>
                          <p style="color:#4a4a4a;font-size:16px;">A request was received to sign in to the Next Subscription admin portal.</p>
                          <div style="background-color:#f8f9fa;border:2px solid #E43636;border-radius:6px;padding:20px;margin:30px 0;text-align:center;">
                            <p style="margin:0 0 10px 0;color:#6b6b6b;font-size:14px;text-transform:uppercase;">Your One-Time Admin Access Code</p>
                            <p style="margin:0;color:#1a1a1a;font-size:28px;font-weight:700;font-family:'Courier New',monospace;word-break:break-all;">%s</p>
                          </div>
                          <p style="color:#4a4a4a;font-size:14px;"><strong>This code is valid for %d minutes</strong> (until %s UTC) and can be used only once.</p>
                          <p style="color:#8a8a8a;font-size:12px;">If you did not request this code, you can ignore this email.</p>
                        </td></tr>
                      </table>
                    </td></tr>
                  </table>
                </body>
                </html>
                """.formatted(HtmlUtils.htmlEscape(code), minutes, EXPIRY_FORMAT.format(expiresAt));
    }
}
