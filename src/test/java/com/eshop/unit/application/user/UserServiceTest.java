package com.eshop.unit.application.user;

import com.eshop.application.user.UserService;
import com.eshop.application.user.dto.CreateUserCommand;
import com.eshop.application.user.dto.UpdateUserCommand;
import com.eshop.application.user.dto.UserResult;
import com.eshop.common.exception.ErrorCode;
import com.eshop.common.exception.ForbiddenException;
import com.eshop.common.exception.ValidationException;
import com.eshop.domain.user.DuplicateEmailException;
import com.eshop.domain.user.PasswordHasher;
import com.eshop.domain.user.User;
import com.eshop.domain.user.UserNotFoundException;
import com.eshop.domain.user.UserRepository;
import com.eshop.domain.user.UserRole;
import com.eshop.unit.BaseUnitTest;
import com.eshop.unit.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * UserServiceTest - Application 계층 단위 테스트
 *
 * 테스트 대상: UserService
 * - 회원 가입 (이메일 중복, 비밀번호 해시, admin 역할 권한)
 * - 부분 수정
 */
@DisplayName("UserService 단위 테스트")
class UserServiceTest extends BaseUnitTest {

    private static final String PASSWORD = "password1234";

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordHasher passwordHasher;

    @InjectMocks
    private UserService userService;

    // ========== 회원 가입 ==========

    @Test
    @DisplayName("회원 가입 - 성공 (비밀번호는 해시로 저장)")
    void testRegister_Success() {
        // Given
        when(userRepository.existsByEmail("kim@example.com")).thenReturn(false);
        when(passwordHasher.hash(PASSWORD)).thenReturn("$2a$10$hashed");
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        UserResult result = userService.register(createCommand("Kim@Example.com", null), null);

        // Then
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        assertNotEquals(PASSWORD, captor.getValue().getPasswordHash());
        assertEquals("$2a$10$hashed", captor.getValue().getPasswordHash());
        assertEquals("kim@example.com", result.getEmail());
        assertEquals(UserRole.CUSTOMER, result.getRole());
    }

    @Test
    @DisplayName("회원 가입 - 실패 (이메일 중복)")
    void testRegister_Failed_DuplicateEmail() {
        when(userRepository.existsByEmail("kim@example.com")).thenReturn(true);

        DuplicateEmailException exception = assertThrows(DuplicateEmailException.class,
                () -> userService.register(createCommand("kim@example.com", null), null));

        assertEquals(ErrorCode.DUPLICATE_EMAIL, exception.getErrorCode());
        assertEquals(409, exception.getStatusCode());
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("회원 가입 - 실패 (동시 가입으로 유니크 제약 위반)")
    void testRegister_Failed_UniqueConstraintRace() {
        when(userRepository.existsByEmail("kim@example.com")).thenReturn(false);
        when(passwordHasher.hash(PASSWORD)).thenReturn("$2a$10$hashed");
        when(userRepository.save(any(User.class))).thenThrow(new DataIntegrityViolationException("uk_users_email"));

        assertThrows(DuplicateEmailException.class,
                () -> userService.register(createCommand("kim@example.com", null), null));
    }

    @Test
    @DisplayName("회원 가입 - 실패 (비로그인 사용자가 admin 역할 요청)")
    void testRegister_Failed_AdminRoleWithoutAdmin() {
        assertThrows(ForbiddenException.class,
                () -> userService.register(createCommand("kim@example.com", UserRole.ADMIN), null));
        assertThrows(ForbiddenException.class,
                () -> userService.register(createCommand("kim@example.com", UserRole.ADMIN), TestFixtures.customer(1L)));
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("회원 가입 - 관리자는 admin 계정 생성 가능")
    void testRegister_Success_AdminByAdmin() {
        when(userRepository.existsByEmail("ops@example.com")).thenReturn(false);
        when(passwordHasher.hash(PASSWORD)).thenReturn("$2a$10$hashed");
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));

        UserResult result = userService.register(createCommand("ops@example.com", UserRole.ADMIN), TestFixtures.admin(1L));

        assertEquals(UserRole.ADMIN, result.getRole());
    }

    @Test
    @DisplayName("회원 가입 - 실패 (비밀번호 8자 미만)")
    void testRegister_Failed_ShortPassword() {
        CreateUserCommand command = CreateUserCommand.builder()
                .email("kim@example.com").name("김철수").password("short").build();

        assertThrows(ValidationException.class, () -> userService.register(command, null));
        verifyNoInteractions(passwordHasher);
    }

    // ========== 조회/수정 ==========

    @Test
    @DisplayName("사용자 조회 - 실패 (다른 사용자)")
    void testGetUser_Failed_OtherUser() {
        assertThrows(ForbiddenException.class, () -> userService.getUser(TestFixtures.customer(1L), 2L));
    }

    @Test
    @DisplayName("사용자 조회 - 실패 (존재하지 않음)")
    void testGetUser_Failed_NotFound() {
        when(userRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(UserNotFoundException.class, () -> userService.getUser(TestFixtures.admin(1L), 99L));
    }

    @Test
    @DisplayName("부분 수정 - 이름만 변경하면 이메일은 그대로")
    void testUpdateUser_PartialName() {
        // Given
        User user = User.create("kim@example.com", "$2a$10$hash", "김철수", UserRole.CUSTOMER);
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(userRepository.save(user)).thenReturn(user);

        UpdateUserCommand command = UpdateUserCommand.builder()
                .name(Optional.of("김영희"))
                .build();

        // When
        UserResult result = userService.updateUser(TestFixtures.customer(1L), 1L, command);

        // Then
        assertEquals("김영희", result.getName());
        assertEquals("kim@example.com", result.getEmail());
        verifyNoInteractions(passwordHasher);
    }

    @Test
    @DisplayName("부분 수정 - 실패 (고객이 역할 변경)")
    void testUpdateUser_Failed_RoleChangeByCustomer() {
        User user = User.create("kim@example.com", "$2a$10$hash", "김철수", UserRole.CUSTOMER);
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));

        UpdateUserCommand command = UpdateUserCommand.builder()
                .role(Optional.of(UserRole.ADMIN))
                .build();

        assertThrows(ForbiddenException.class, () -> userService.updateUser(TestFixtures.customer(1L), 1L, command));
        assertEquals(UserRole.CUSTOMER, user.getRole());
    }

    @Test
    @DisplayName("부분 수정 - 실패 (이름 명시적 null)")
    void testUpdateUser_Failed_ExplicitNullName() {
        User user = User.create("kim@example.com", "$2a$10$hash", "김철수", UserRole.CUSTOMER);
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));

        UpdateUserCommand command = UpdateUserCommand.builder()
                .name(Optional.empty())
                .build();

        assertThrows(ValidationException.class, () -> userService.updateUser(TestFixtures.customer(1L), 1L, command));
    }

    private CreateUserCommand createCommand(String email, UserRole role) {
        return CreateUserCommand.builder()
                .email(email)
                .name("김철수")
                .password(PASSWORD)
                .role(role)
                .build();
    }
}
