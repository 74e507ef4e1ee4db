package com.eshop.application.user.dto;

import com.eshop.domain.user.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * 회원 정보 부분 수정 커맨드
 *
 * 필드 규칙:
 * - null: 요청에 없음 (변경하지 않음)
 * - Optional.empty(): 명시적 null (모든 필드가 필수이므로 검증 오류)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateUserCommand {
    private Optional<String> email;
    private Optional<String> name;
    private Optional<String> password;
    private Optional<UserRole> role;
}
