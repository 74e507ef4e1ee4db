package com.eshop.domain.user;

import com.eshop.common.exception.ValidationException;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * User 도메인 엔티티
 *
 * 책임:
 * - 사용자 계정 정보 관리 (이메일, 이름, 역할)
 * - 비밀번호는 해시 값만 보관
 *
 * 비즈니스 규칙:
 * - 이메일은 소문자로 정규화되어 저장되며 유일해야 함 (유일성은 서비스 계층 + DB 제약으로 보장)
 * - 이름은 2~100자
 * - 역할 기본값은 customer
 */
@Entity
@Table(name = "users", uniqueConstraints = @UniqueConstraint(name = "uk_users_email", columnNames = "email"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "email", nullable = false, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Convert(converter = UserRoleConverter.class)
    @Column(name = "role", nullable = false, length = 20)
    private UserRole role;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * 사용자 생성 팩토리 메서드
     *
     * @param passwordHash 이미 해시된 비밀번호
     * @param role null이면 CUSTOMER
     */
    public static User create(String email, String passwordHash, String name, UserRole role) {
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new ValidationException("비밀번호는 필수입니다");
        }
        return User.builder()
                .email(normalizeEmail(email))
                .passwordHash(passwordHash)
                .name(normalizeName(name))
                .role(role != null ? role : UserRole.CUSTOMER)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public void changeEmail(String email) {
        this.email = normalizeEmail(email);
        touch();
    }

    public void changeName(String name) {
        this.name = normalizeName(name);
        touch();
    }

    public void changePasswordHash(String passwordHash) {
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new ValidationException("비밀번호는 필수입니다");
        }
        this.passwordHash = passwordHash;
        touch();
    }

    public void changeRole(UserRole role) {
        if (role == null) {
            throw new ValidationException("역할은 null일 수 없습니다");
        }
        this.role = role;
        touch();
    }

    public boolean isAdmin() {
        return this.role == UserRole.ADMIN;
    }

    /**
     * 이메일 정규화 및 검증 (trim + 소문자)
     */
    public static String normalizeEmail(String email) {
        if (email == null) {
            throw new ValidationException("이메일은 필수입니다");
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() > UserConstants.MAX_EMAIL_LENGTH
                || !UserConstants.EMAIL_PATTERN.matcher(normalized).matches()) {
            throw new ValidationException(UserConstants.MSG_INVALID_EMAIL);
        }
        return normalized;
    }

    private static String normalizeName(String name) {
        if (name == null) {
            throw new ValidationException(UserConstants.MSG_INVALID_NAME);
        }
        String trimmed = name.trim();
        if (trimmed.length() < UserConstants.MIN_NAME_LENGTH || trimmed.length() > UserConstants.MAX_NAME_LENGTH) {
            throw new ValidationException(UserConstants.MSG_INVALID_NAME);
        }
        return trimmed;
    }

    private void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
