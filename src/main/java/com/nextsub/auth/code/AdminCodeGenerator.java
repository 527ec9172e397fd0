package com.nextsub.auth.code;

import com.nextsub.auth.config.AuthProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * 管理员一次性验证码生成器。
 * <p>
 * 长度在 `[minLength, maxLength]` 内均匀随机；保证至少包含大写字母、小写字母、数字与符号各一个：
 * 先从四类字符中各取一个，余下位置从全字符集中抽取，最后用同一安全随机源做 Fisher–Yates 洗牌，
 * 避免固定位置暴露字符类别。
 */
@Component
public class AdminCodeGenerator {

    static final String UPPERCASE = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    static final String LOWERCASE = "abcdefghijklmnopqrstuvwxyz";
    static final String DIGITS = "0123456789";

    private static final int CHARACTER_CLASSES = 4;

    private final SecureRandom random;
    private final int minLength;
    private final int maxLength;
    private final String symbols;
    private final String alphabet;

    @Autowired
    public AdminCodeGenerator(AuthProperties properties) {
        this(properties, new SecureRandom());
    }

    AdminCodeGenerator(AuthProperties properties, SecureRandom random) {
        AuthProperties.Code cfg = properties.getCode();
        if (cfg.getMinLength() < CHARACTER_CLASSES) {
            throw new IllegalStateException("auth.code.min-length must be at least " + CHARACTER_CLASSES);
        }
        if (cfg.getMaxLength() < cfg.getMinLength()) {
            throw new IllegalStateException("auth.code.max-length must not be less than auth.code.min-length");
        }
        if (cfg.getSymbols() == null || cfg.getSymbols().isEmpty()) {
            throw new IllegalStateException("auth.code.symbols must not be empty");
        }
        this.random = random;
        this.minLength = cfg.getMinLength();
        this.maxLength = cfg.getMaxLength();
        this.symbols = cfg.getSymbols();
        this.alphabet = UPPERCASE + LOWERCASE + DIGITS + symbols;
    }

    public String generate() {
        int length = minLength + random.nextInt(maxLength - minLength + 1);
        char[] code = new char[length];
        code[0] = pick(UPPERCASE);
        code[1] = pick(LOWERCASE);
        code[2] = pick(DIGITS);
        code[3] = pick(symbols);
        for (int i = CHARACTER_CLASSES; i < length; i++) {
            code[i] = pick(alphabet);
        }
        for (int i = length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            char tmp = code[i];
            code[i] = code[j];
            code[j] = tmp;
        }
        return new String(code);
    }

    public String symbols() {
        return symbols;
    }

    private char pick(String source) {
        return source.charAt(random.nextInt(source.length()));
    }
}
