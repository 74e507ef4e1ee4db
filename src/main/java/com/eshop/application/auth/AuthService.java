package com.eshop.application.auth;

import com.eshop.application.auth.dto.TokenResult;
import com.eshop.common.exception.ErrorCode;
import com.eshop.common.exception.UnauthorizedException;
import com.eshop.common.exception.ValidationException;
import com.eshop.domain.user.PasswordHasher;
import com.eshop.domain.user.User;
import com.eshop.domain.user.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;

/**
 * AuthService - 로그인 및 토큰 인증 (Application 계층)
 *
 * 책임:
 * - 이메일/비밀번호 검증 후 액세스 토큰 발급
 * - 요청 토큰을 검증하여 AuthUser 복원
 *
 * 비즈니스 규칙:
 * - 이메일 미존재와 비밀번호 불일치는 같은 응답(401)으로 처리
 * - 토큰의 사용자가 삭제/미존재하면 401
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final TokenProvider tokenProvider;

    @Transactional(readOnly = true)
    public TokenResult login(String email, String password) {
        if (email == null || password == null) {
            throw new ValidationException("email과 password는 필수입니다");
        }
        Optional<User> user = userRepository.findByEmail(normalizeEmail(email));
        if (user.isEmpty() || !passwordHasher.matches(password, user.get().getPasswordHash())) {
            log.warn("[AuthService] 로그인 실패 - email={}", email);
            throw new UnauthorizedException(ErrorCode.INVALID_CREDENTIALS);
        }

        User found = user.get();
        log.info("[AuthService] 로그인 성공 - userId={}", found.getId());
        return TokenResult.builder()
                .accessToken(tokenProvider.issue(found.getId(), found.getRole()))
                .tokenType(TokenResult.BEARER)
                .build();
    }

    /**
     * Bearer 토큰 인증
     *
     * @throws UnauthorizedException 토큰 오류 또는 사용자 미존재
     */
    @Transactional(readOnly = true)
    public AuthUser authenticate(String token) {
        Long userId = tokenProvider.verify(token);
        return userRepository.findById(userId)
                .map(AuthUser::from)
                .orElseThrow(() -> new UnauthorizedException(ErrorCode.INVALID_TOKEN));
    }

    private String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
