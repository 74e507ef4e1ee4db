package com.eshop.presentation.auth;

import com.eshop.application.auth.AuthService;
import com.eshop.application.auth.dto.TokenResult;
import com.eshop.common.exception.ValidationException;
import com.eshop.presentation.auth.request.LoginRequest;
import com.eshop.presentation.auth.response.TokenResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * AuthController - 로그인 API
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    /**
     * POST /auth/login - 이메일/비밀번호로 액세스 토큰 발급
     */
    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@RequestBody(required = false) LoginRequest request) {
        if (request == null) {
            throw new ValidationException("요청 본문은 필수입니다");
        }
        TokenResult result = authService.login(request.getEmail(), request.getPassword());
        return ResponseEntity.ok(TokenResponse.builder()
                .accessToken(result.getAccessToken())
                .tokenType(result.getTokenType())
                .build());
    }
}
