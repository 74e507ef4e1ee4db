package com.eshop.infrastructure.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BCryptPasswordHasher 테스트")
class BCryptPasswordHasherTest {

    private final BCryptPasswordHasher hasher = new BCryptPasswordHasher(new BCryptPasswordEncoder(4));

    @Test
    @DisplayName("해시는 평문과 다르고 같은 평문이라도 매번 다른 salt")
    void testHash() {
        String first = hasher.hash("password1234");
        String second = hasher.hash("password1234");

        assertNotEquals("password1234", first);
        assertTrue(first.startsWith("$2a$04$"));
        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("일치 여부 검증")
    void testMatches() {
        String hash = hasher.hash("password1234");

        assertTrue(hasher.matches("password1234", hash));
        assertFalse(hasher.matches("password12345", hash));
        assertFalse(hasher.matches(null, hash));
        assertFalse(hasher.matches("password1234", null));
    }
}
