package com.nextsub.auth.code;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;

class CodeHasherTest {

    private final CodeHasher hasher = new CodeHasher(new BCryptPasswordEncoder(4));

    @Test
    void digestIsSaltedAndVerifiable() {
        String code = "Ab3$efgh1234ijklMNOP";

        String first = hasher.hash(code);
        String second = hasher.hash(code);

        assertThat(first).isNotEqualTo(code).isNotEqualTo(second);
        assertThat(hasher.matches(code, first)).isTrue();
        assertThat(hasher.matches(code, second)).isTrue();
        assertThat(hasher.matches("Ab3$efgh1234ijklMNOQ", first)).isFalse();
    }

    @Test
    void missingInputNeverMatches() {
        String digest = hasher.hash("Ab3$efgh1234ijklMNOP");

        assertThat(hasher.matches(null, digest)).isFalse();
        assertThat(hasher.matches("Ab3$efgh1234ijklMNOP", null)).isFalse();
        assertThat(hasher.matches("Ab3$efgh1234ijklMNOP", "")).isFalse();
    }
}
