package com.eshop.presentation.user.request;

import com.eshop.domain.user.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * 회원 정보 부분 수정 요청 DTO
 *
 * 필드가 없으면 null, 명시적 null이면 Optional.empty()
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserUpdateRequest {
    private Optional<String> email;
    private Optional<String> name;
    private Optional<String> password;
    private Optional<UserRole> role;
}
