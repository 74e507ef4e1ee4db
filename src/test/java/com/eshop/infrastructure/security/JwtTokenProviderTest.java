package com.eshop.infrastructure.security;

import com.eshop.common.exception.ErrorCode;
import com.eshop.common.exception.UnauthorizedException;
import com.eshop.config.EshopProperties;
import com.eshop.domain.user.UserRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JwtTokenProvider 테스트")
class JwtTokenProviderTest {

    private static final String SECRET = "unit-test-secret-key-0123456789-abcdef";
    private static final Duration EXPIRES_IN = Duration.ofMinutes(30);
    private static final Instant ISSUED_AT = Instant.parse("2026-03-01T09:00:00Z");

    private final JwtTokenProvider provider = providerAt(ISSUED_AT);

    @Test
    @DisplayName("발급한 토큰을 검증하면 user_id 복원")
    void testIssueAndVerify() {
        String token = provider.issue(42L, UserRole.CUSTOMER);

        assertEquals(3, token.split("\\.").length);
        assertEquals(42L, provider.verify(token));
    }

    @Test
    @DisplayName("만료 시각이 지난 토큰은 INVALID_TOKEN")
    void testVerify_Expired() {
        String token = provider.issue(42L, UserRole.CUSTOMER);
        JwtTokenProvider later = providerAt(ISSUED_AT.plus(EXPIRES_IN).plusSeconds(60));

        UnauthorizedException exception = assertThrows(UnauthorizedException.class, () -> later.verify(token));

        assertEquals(ErrorCode.INVALID_TOKEN, exception.getErrorCode());
    }

    @Test
    @DisplayName("만료 직전에는 유효")
    void testVerify_BeforeExpiry() {
        String token = provider.issue(42L, UserRole.ADMIN);
        JwtTokenProvider later = providerAt(ISSUED_AT.plus(EXPIRES_IN).minusSeconds(60));

        assertEquals(42L, later.verify(token));
    }

    @Test
    @DisplayName("payload를 바꾼 토큰은 서명 불일치로 거부")
    void testVerify_TamperedPayload() {
        String[] parts = provider.issue(42L, UserRole.CUSTOMER).split("\\.");
        long exp = ISSUED_AT.plus(EXPIRES_IN).getEpochSecond();
        String forgedPayload = Base64.getUrlEncoder().withoutPadding().encodeToString(
                ("{\"sub\":\"1\",\"role\":\"admin\",\"iat\":" + ISSUED_AT.getEpochSecond() + ",\"exp\":" + exp + "}")
                        .getBytes(StandardCharsets.UTF_8));
        String forged = parts[0] + "." + forgedPayload + "." + parts[2];

        assertThrows(UnauthorizedException.class, () -> provider.verify(forged));
    }

    @Test
    @DisplayName("설정 기반 생성자도 주입받은 Clock 기준으로 발급/만료 판단")
    void testPropertiesConstructor_UsesInjectedClock() {
        EshopProperties properties = new EshopProperties();
        properties.getSecurity().setSecretKey(SECRET);
        properties.getSecurity().setAccessTokenExpireMinutes(30);

        JwtTokenProvider issuer = new JwtTokenProvider(properties, Clock.fixed(ISSUED_AT, ZoneOffset.UTC));
        JwtTokenProvider expired = new JwtTokenProvider(properties,
                Clock.fixed(ISSUED_AT.plus(Duration.ofMinutes(31)), ZoneOffset.UTC));
        String token = issuer.issue(7L, UserRole.CUSTOMER);

        assertEquals(7L, issuer.verify(token));
        assertThrows(UnauthorizedException.class, () -> expired.verify(token));
    }

    @Test
    @DisplayName("다른 키로 서명된 토큰은 거부")
    void testVerify_DifferentSecret() {
        JwtTokenProvider other = new JwtTokenProvider("another-secret-key-for-signing-0123456789",
                EXPIRES_IN, Clock.fixed(ISSUED_AT, ZoneOffset.UTC));
        String token = other.issue(42L, UserRole.CUSTOMER);

        assertThrows(UnauthorizedException.class, () -> provider.verify(token));
    }

    @Test
    @DisplayName("형식이 잘못된 토큰은 거부")
    void testVerify_Malformed() {
        assertThrows(UnauthorizedException.class, () -> provider.verify("not-a-jwt"));
        assertThrows(UnauthorizedException.class, () -> provider.verify(""));
        assertThrows(UnauthorizedException.class, () -> provider.verify(null));
    }

    @Test
    @DisplayName("32바이트 미만 서명 키는 기동 실패")
    void testShortSecret() {
        assertThrows(IllegalStateException.class,
                () -> new JwtTokenProvider("too-short", EXPIRES_IN, Clock.systemUTC()));
    }

    private static JwtTokenProvider providerAt(Instant now) {
        return new JwtTokenProvider(SECRET, EXPIRES_IN, Clock.fixed(now, ZoneOffset.UTC));
    }
}
