package com.eshop.infrastructure.security;

import com.eshop.application.auth.TokenProvider;
import com.eshop.common.exception.ErrorCode;
import com.eshop.common.exception.UnauthorizedException;
import com.eshop.config.EshopProperties;
import com.eshop.domain.user.UserRole;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * JWT(HS256) 액세스 토큰 발급/검증
 *
 * 토큰 구성:
 * - sub: user_id
 * - role: 발급 시점의 역할 (참고용, 권한 판단은 DB의 현재 역할 기준)
 * - iat, exp: 발급 시각, 만료 시각 (eshop.security.access-token-expire-minutes)
 */
@Slf4j
@Component
public class JwtTokenProvider implements TokenProvider {

    private static final int MIN_SECRET_BYTES = 32;
    private static final String ROLE_CLAIM = "role";

    private final SecretKey secretKey;
    private final Duration expiresIn;
    private final Clock clock;

    @Autowired
    public JwtTokenProvider(EshopProperties properties, Clock clock) {
        this(properties.getSecurity().getSecretKey(),
                Duration.ofMinutes(properties.getSecurity().getAccessTokenExpireMinutes()),
                clock);
    }

    JwtTokenProvider(String secret, Duration expiresIn, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("eshop.security.secret-key는 " + MIN_SECRET_BYTES + "바이트 이상이어야 합니다");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiresIn = expiresIn;
        this.clock = clock;
    }

    @Override
    public String issue(Long userId, UserRole role) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(String.valueOf(userId))
                .claim(ROLE_CLAIM, role.getValue())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(expiresIn)))
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();
    }

    @Override
    public Long verify(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException(ErrorCode.INVALID_TOKEN);
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            return Long.valueOf(claims.getSubject());
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("[JwtTokenProvider] 토큰 검증 실패 - reason={}", e.getClass().getSimpleName());
            throw new UnauthorizedException(ErrorCode.INVALID_TOKEN, e);
        }
    }
}
