package com.eshop.presentation.user;

import com.eshop.application.auth.AuthUser;
import com.eshop.application.user.UserService;
import com.eshop.common.exception.ValidationException;
import com.eshop.presentation.user.mapper.UserMapper;
import com.eshop.presentation.user.request.UserCreateRequest;
import com.eshop.presentation.user.request.UserUpdateRequest;
import com.eshop.presentation.user.response.UserResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * UserController - 회원 API
 */
@RestController
@RequestMapping("/users")
public class UserController {

    private final UserService userService;
    private final UserMapper userMapper;

    public UserController(UserService userService, UserMapper userMapper) {
        this.userService = userService;
        this.userMapper = userMapper;
    }

    /**
     * POST /users - 회원 가입 (admin 역할은 관리자만 부여 가능)
     * 비로그인 요청이면 actor는 null
     */
    @PostMapping
    public ResponseEntity<UserResponse> register(
            @AuthenticationPrincipal AuthUser actor,
            @RequestBody(required = false) UserCreateRequest request) {
        if (request == null) {
            throw new ValidationException("요청 본문은 필수입니다");
        }
        var result = userService.register(userMapper.toCreateUserCommand(request), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(userMapper.toUserResponse(result));
    }

    /**
     * GET /users/me - 내 정보
     */
    @GetMapping("/me")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<UserResponse> getMe(@AuthenticationPrincipal AuthUser actor) {
        return ResponseEntity.ok(userMapper.toUserResponse(userService.getUser(actor, actor.getUserId())));
    }

    /**
     * GET /users - 전체 회원 (관리자)
     */
    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<UserResponse>> getUsers() {
        return ResponseEntity.ok(userMapper.toUserResponses(userService.getUsers()));
    }

    /**
     * GET /users/{user_id} - 본인 또는 관리자
     */
    @GetMapping("/{user_id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<UserResponse> getUser(
            @AuthenticationPrincipal AuthUser actor,
            @PathVariable("user_id") Long userId) {
        return ResponseEntity.ok(userMapper.toUserResponse(userService.getUser(actor, userId)));
    }

    /**
     * PATCH /users/{user_id} - 부분 수정 (역할 변경은 관리자)
     */
    @PatchMapping("/{user_id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<UserResponse> updateUser(
            @AuthenticationPrincipal AuthUser actor,
            @PathVariable("user_id") Long userId,
            @RequestBody UserUpdateRequest request) {
        var result = userService.updateUser(actor, userId, userMapper.toUpdateUserCommand(request));
        return ResponseEntity.ok(userMapper.toUserResponse(result));
    }
}
