package com.eshop.domain.user;

import java.util.regex.Pattern;

/**
 * UserConstants - 사용자 도메인 상수
 */
public class UserConstants {

    // ========== Name ==========

    public static final int MIN_NAME_LENGTH = 2;
    public static final int MAX_NAME_LENGTH = 100;

    // ========== Email ==========

    public static final int MAX_EMAIL_LENGTH = 255;
    public static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    // ========== Password ==========

    public static final int MIN_PASSWORD_LENGTH = 8;
    public static final int MAX_PASSWORD_LENGTH = 128;

    // ========== Validation Messages ==========

    public static final String MSG_INVALID_NAME = String.format("이름은 %d자 이상 %d자 이하여야 합니다", MIN_NAME_LENGTH, MAX_NAME_LENGTH);
    public static final String MSG_INVALID_EMAIL = "이메일 형식이 올바르지 않습니다";
    public static final String MSG_INVALID_PASSWORD = String.format("비밀번호는 %d자 이상 %d자 이하여야 합니다", MIN_PASSWORD_LENGTH, MAX_PASSWORD_LENGTH);

    private UserConstants() {
        throw new AssertionError("UserConstants는 인스턴스화할 수 없습니다");
    }
}
