package com.eshop.application.auth;

import com.eshop.domain.user.UserRole;

/**
 * 액세스 토큰 발급/검증 포트
 */
public interface TokenProvider {

    /**
     * user_id를 담은 서명된 토큰 발급 (만료 시간은 설정값)
     */
    String issue(Long userId, UserRole role);

    /**
     * 토큰 서명과 만료를 검증하고 user_id를 복원
     *
     * @throws com.eshop.common.exception.UnauthorizedException 위조/만료/형식 오류
     */
    Long verify(String token);
}
