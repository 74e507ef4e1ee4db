package com.eshop.application.user.dto;

import com.eshop.domain.user.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 회원 가입 커맨드 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateUserCommand {
    private String email;
    private String name;
    private String password;
    /** null이면 customer */
    private UserRole role;
}
