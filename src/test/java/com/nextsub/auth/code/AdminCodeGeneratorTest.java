package com.nextsub.auth.code;

import com.nextsub.auth.config.AuthProperties;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdminCodeGeneratorTest {

    private final AuthProperties properties = new AuthProperties();

    @Test
    void generatedCodesRespectLengthBoundsAndCharacterClasses() {
        AdminCodeGenerator generator = new AdminCodeGenerator(properties);
        String symbols = generator.symbols();

        for (int i = 0; i < 500; i++) {
            String code = generator.generate();
            assertThat(code.length()).isBetween(20, 30);
            assertThat(code.chars().anyMatch(c -> AdminCodeGenerator.UPPERCASE.indexOf(c) >= 0)).isTrue();
            assertThat(code.chars().anyMatch(c -> AdminCodeGenerator.LOWERCASE.indexOf(c) >= 0)).isTrue();
            assertThat(code.chars().anyMatch(c -> AdminCodeGenerator.DIGITS.indexOf(c) >= 0)).isTrue();
            assertThat(code.chars().anyMatch(c -> symbols.indexOf(c) >= 0)).isTrue();
        }
    }

    @Test
    void lengthCoversWholeConfiguredRange() {
        properties.getCode().setMinLength(4);
        properties.getCode().setMaxLength(6);
        AdminCodeGenerator generator = new AdminCodeGenerator(properties, new SecureRandom());

        Set<Integer> lengths = new HashSet<>();
        for (int i = 0; i < 300; i++) {
            lengths.add(generator.generate().length());
        }

        assertThat(lengths).containsExactlyInAnyOrder(4, 5, 6);
    }

    @Test
    void codesDoNotRepeat() {
        AdminCodeGenerator generator = new AdminCodeGenerator(properties);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            seen.add(generator.generate());
        }
        assertThat(seen).hasSize(1_000);
    }

    @Test
    void rejectsInvalidLengthConfiguration() {
        properties.getCode().setMinLength(3);
        assertThatThrownBy(() -> new AdminCodeGenerator(properties))
                .isInstanceOf(IllegalStateException.class);

        properties.getCode().setMinLength(10);
        properties.getCode().setMaxLength(8);
        assertThatThrownBy(() -> new AdminCodeGenerator(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("max-length");
    }
}
