package com.eshop.application.auth.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 로그인 결과 토큰 (Application layer DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResult {
    public static final String BEARER = "bearer";

    private String accessToken;
    private String tokenType;
}
