package com.nextsub.auth.config;

import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * PEM 密钥读取工具。
 * <p>
 * 读取会话令牌签名用的 PKCS#8 私钥与 X.509 公钥（RS256）。
 * 未配置或内容损坏时直接启动失败，不做降级。
 */
public final class PemUtils {

    private static final String PRIVATE_LABEL = "PRIVATE KEY";
    private static final String PUBLIC_LABEL = "PUBLIC KEY";

    private PemUtils() {
    }

    public static RSAPrivateKey readPrivateKey(Resource resource) {
        byte[] der = decode(resource, PRIVATE_LABEL, "auth.jwt.private-key");
        try {
            return (RSAPrivateKey) KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to parse RSA private key from " + resource, ex);
        }
    }

    public static RSAPublicKey readPublicKey(Resource resource) {
        byte[] der = decode(resource, PUBLIC_LABEL, "auth.jwt.public-key");
        try {
            return (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to parse RSA public key from " + resource, ex);
        }
    }

    private static byte[] decode(Resource resource, String label, String property) {
        if (resource == null || !resource.exists()) {
            throw new IllegalStateException(property + " is not configured or does not exist: " + resource);
        }
        String pem;
        try (InputStream is = resource.getInputStream()) {
            pem = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read " + property + " from " + resource, ex);
        }
        String body = pem.replace("-----BEGIN " + label + "-----", "")
                .replace("-----END " + label + "-----", "")
                .replaceAll("\\s", "");
        try {
            return Base64.getDecoder().decode(body);
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException(property + " is not valid PEM (" + label + ")", ex);
        }
    }
}
