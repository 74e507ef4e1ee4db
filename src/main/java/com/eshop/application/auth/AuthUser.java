package com.eshop.application.auth;

import com.eshop.common.exception.ForbiddenException;
import com.eshop.domain.user.User;
import com.eshop.domain.user.UserRole;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 인증된 요청 주체 (토큰 검증 후 DB의 현재 역할로 구성)
 */
@Getter
@ToString
@AllArgsConstructor
public class AuthUser {

    private final Long userId;
    private final UserRole role;

    public static AuthUser from(User user) {
        return new AuthUser(user.getId(), user.getRole());
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    /**
     * 본인 리소스이거나 관리자인지 확인
     */
    public void ensureSelfOrAdmin(Long ownerId) {
        if (!isAdmin() && !userId.equals(ownerId)) {
            throw new ForbiddenException("본인 리소스만 접근할 수 있습니다");
        }
    }
}
