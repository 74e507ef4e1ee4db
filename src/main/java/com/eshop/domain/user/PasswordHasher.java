package com.eshop.domain.user;

/**
 * 단방향 비밀번호 해시 포트
 */
public interface PasswordHasher {

    String hash(String rawPassword);

    boolean matches(String rawPassword, String passwordHash);
}
