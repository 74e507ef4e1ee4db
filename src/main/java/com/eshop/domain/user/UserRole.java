package com.eshop.domain.user;

import com.eshop.common.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

/**
 * UserRole - 사용자 역할
 *
 * DB와 JSON 모두 소문자 문자열 태그("customer", "admin")로 표현됩니다.
 */
@Getter
public enum UserRole {
    CUSTOMER("customer"),
    ADMIN("admin");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 문자열 태그에서 UserRole로 변환
     *
     * @throws ValidationException 알 수 없는 역할인 경우
     */
    @JsonCreator
    public static UserRole fromValue(String value) {
        return Arrays.stream(values())
                .filter(role -> role.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new ValidationException("유효하지 않은 역할입니다: " + value));
    }
}
