package com.eshop.presentation.user;

import com.eshop.application.auth.AuthService;
import com.eshop.application.auth.AuthUser;
import com.eshop.application.user.UserService;
import com.eshop.application.user.dto.CreateUserCommand;
import com.eshop.application.user.dto.UserResult;
import com.eshop.domain.user.DuplicateEmailException;
import com.eshop.domain.user.UserRole;
import com.eshop.presentation.BaseControllerTest;
import com.eshop.presentation.user.mapper.UserMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@DisplayName("UserController 단위 테스트")
class UserControllerTest extends BaseControllerTest {

    @Mock
    private UserService userService;

    @Mock
    private AuthService authService;

    private MockMvc mockMvc;

    @BeforeEach
    void setup() {
        mockMvc = buildMockMvc(new UserController(userService, new UserMapper()), authService);
    }

    @Test
    @DisplayName("회원 가입 - 비로그인 상태로 성공 (201, password_hash 미노출)")
    void testRegister_Anonymous() throws Exception {
        when(userService.register(any(CreateUserCommand.class), isNull())).thenReturn(userResult(UserRole.CUSTOMER));

        mockMvc.perform(post("/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"kim@example.com\",\"name\":\"김철수\",\"password\":\"password1234\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.email").value("kim@example.com"))
                .andExpect(jsonPath("$.role").value("customer"))
                .andExpect(jsonPath("$.created_at").exists())
                .andExpect(jsonPath("$.password").doesNotExist())
                .andExpect(jsonPath("$.password_hash").doesNotExist());

        ArgumentCaptor<CreateUserCommand> captor = ArgumentCaptor.forClass(CreateUserCommand.class);
        verify(userService).register(captor.capture(), isNull());
        assertEquals("password1234", captor.getValue().getPassword());
        assertNull(captor.getValue().getRole());
    }

    @Test
    @DisplayName("회원 가입 - 관리자 토큰이 있으면 호출자로 전달")
    void testRegister_ByAdmin() throws Exception {
        AuthUser admin = givenAdmin(authService, 9L);
        when(userService.register(any(CreateUserCommand.class), eq(admin))).thenReturn(userResult(UserRole.ADMIN));

        mockMvc.perform(post("/users")
                        .header(HttpHeaders.AUTHORIZATION, bearer(ADMIN_TOKEN))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ops@example.com\",\"name\":\"운영자\",\"password\":\"password1234\",\"role\":\"admin\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.role").value("admin"));
    }

    @Test
    @DisplayName("회원 가입 - 실패 (이메일 중복, 409)")
    void testRegister_Failed_DuplicateEmail() throws Exception {
        when(userService.register(any(CreateUserCommand.class), isNull()))
                .thenThrow(new DuplicateEmailException("kim@example.com"));

        mockMvc.perform(post("/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"kim@example.com\",\"name\":\"김철수\",\"password\":\"password1234\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_USER_DUPLICATE_EMAIL"));
    }

    @Test
    @DisplayName("내 정보 - 토큰의 사용자로 조회")
    void testGetMe() throws Exception {
        AuthUser customer = givenCustomer(authService, 1L);
        when(userService.getUser(customer, 1L)).thenReturn(userResult(UserRole.CUSTOMER));

        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, bearer(CUSTOMER_TOKEN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("김철수"));
    }

    @Test
    @DisplayName("내 정보 - 실패 (토큰 없음, 401)")
    void testGetMe_Failed_NoToken() throws Exception {
        mockMvc.perform(get("/users/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value("APP_AUTH_UNAUTHORIZED"));
    }

    @Test
    @DisplayName("회원 목록 - 관리자 조회 성공")
    void testGetUsers_ByAdmin() throws Exception {
        givenAdmin(authService, 9L);
        when(userService.getUsers()).thenReturn(List.of(userResult(UserRole.CUSTOMER)));

        mockMvc.perform(get("/users").header(HttpHeaders.AUTHORIZATION, bearer(ADMIN_TOKEN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].email").value("kim@example.com"));
    }

    @Test
    @DisplayName("회원 목록 - 실패 (고객 권한, 403)")
    void testGetUsers_Failed_Forbidden() throws Exception {
        givenCustomer(authService, 1L);

        mockMvc.perform(get("/users").header(HttpHeaders.AUTHORIZATION, bearer(CUSTOMER_TOKEN)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error_code").value("APP_AUTH_FORBIDDEN"));

        verifyNoInteractions(userService);
    }

    private UserResult userResult(UserRole role) {
        return UserResult.builder()
                .id(1L)
                .email("kim@example.com")
                .name("김철수")
                .role(role)
                .createdAt(LocalDateTime.of(2026, 1, 1, 9, 0))
                .build();
    }
}
