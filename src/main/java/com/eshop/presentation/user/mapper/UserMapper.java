package com.eshop.presentation.user.mapper;

import com.eshop.application.user.dto.CreateUserCommand;
import com.eshop.application.user.dto.UpdateUserCommand;
import com.eshop.application.user.dto.UserResult;
import com.eshop.presentation.user.request.UserCreateRequest;
import com.eshop.presentation.user.request.UserUpdateRequest;
import com.eshop.presentation.user.response.UserResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * UserMapper - Presentation layer와 Application layer 간의 DTO 변환
 */
@Component
public class UserMapper {

    public CreateUserCommand toCreateUserCommand(UserCreateRequest request) {
        return CreateUserCommand.builder()
                .email(request.getEmail())
                .name(request.getName())
                .password(request.getPassword())
                .role(request.getRole())
                .build();
    }

    public UpdateUserCommand toUpdateUserCommand(UserUpdateRequest request) {
        return UpdateUserCommand.builder()
                .email(request.getEmail())
                .name(request.getName())
                .password(request.getPassword())
                .role(request.getRole())
                .build();
    }

    public UserResponse toUserResponse(UserResult result) {
        return UserResponse.builder()
                .id(result.getId())
                .email(result.getEmail())
                .name(result.getName())
                .role(result.getRole())
                .createdAt(result.getCreatedAt())
                .updatedAt(result.getUpdatedAt())
                .build();
    }

    public List<UserResponse> toUserResponses(List<UserResult> results) {
        return results.stream()
                .map(this::toUserResponse)
                .collect(Collectors.toList());
    }
}
