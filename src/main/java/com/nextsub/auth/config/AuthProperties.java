package com.nextsub.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    private final Admin admin = new Admin();
    private final Jwt jwt = new Jwt();
    private final Code code = new Code();
    private final RateLimit rateLimit = new RateLimit();
    private final Cookie cookie = new Cookie();
    private final Store store = new Store();
    private final Notify notify = new Notify();
    private final Audit audit = new Audit();
    private final Client client = new Client();

    @Data
    public static class Admin {
        private String email = "admin@nextsubscription.local";
        private String role = "admin";
    }

    @Data
    public static class Jwt {
        private String issuer = "next-subscription";
        private Duration sessionTtl = Duration.ofHours(8);
        private String keyId = "next-subscription-admin";
        private Resource privateKey;
        private Resource publicKey;
    }

    @Data
    public static class Code {
        private int minLength = 20;
        private int maxLength = 30;
        private Duration ttl = Duration.ofMinutes(10);
        private int maxAttempts = 5;
        private int bcryptStrength = 12;
        private String symbols = "!@#$%^&*()_+-=[]{}|;:,.<>?";
    }

    @Data
    public static class RateLimit {
        private int requestCodeLimit = 6;
        private int verifyCodeLimit = 20;
        private Duration window = Duration.ofHours(1);
    }

    @Data
    public static class Cookie {
        private String name = "adminToken";
        private boolean secure = true;
        private String sameSite = "Strict";
        private String path = "/";
    }

    @Data
    public static class Store {
        /**
         * redis | memory
         */
        private String type = "redis";
        private String keyPrefix = "admin:";
    }

    @Data
    public static class Notify {
        /**
         * mail | log
         */
        private String channel = "mail";
        private boolean async = false;
        private String from = "no-reply@nextsubscription.local";
        private String subject = "Your Next Subscription Admin Access Code";
    }

    @Data
    public static class Audit {
        private int redisMaxEntries = 10_000;
        private int memoryMaxEntries = 1_000;
    }

    @Data
    public static class Client {
        private boolean trustForwardedHeaders = false;
    }
}
