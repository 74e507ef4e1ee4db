package com.eshop.infrastructure.security;

import com.eshop.common.exception.BizException;
import com.eshop.common.exception.ErrorCode;
import com.eshop.presentation.common.response.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 인증 실패 응답 (401)
 *
 * 토큰 검증 단계에서 발생한 BizException이 원인이면 그 에러 코드를 그대로 내려주고,
 * 토큰 없이 보호된 경로에 접근한 경우는 APP_AUTH_UNAUTHORIZED로 응답합니다.
 */
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String BEARER_CHALLENGE = "Bearer";

    private final ObjectMapper objectMapper;

    public JwtAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        ErrorResponse body;
        if (authException.getCause() instanceof BizException) {
            BizException cause = (BizException) authException.getCause();
            body = ErrorResponse.of(cause.getErrorCodeValue(), cause.getMessage());
        } else {
            body = ErrorResponse.of(ErrorCode.UNAUTHORIZED.getCode(), ErrorCode.UNAUTHORIZED.getMessage());
        }

        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
