package com.eshop.application.user.dto;

import com.eshop.domain.user.User;
import com.eshop.domain.user.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 사용자 조회 결과 (password_hash는 포함하지 않음)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResult {
    private Long id;
    private String email;
    private String name;
    private UserRole role;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static UserResult from(User user) {
        return UserResult.builder()
                .id(user.getId())
                .email(user.getEmail())
                .name(user.getName())
                .role(user.getRole())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}
