package com.eshop.application.user;

import com.eshop.application.auth.AuthUser;
import com.eshop.application.user.dto.CreateUserCommand;
import com.eshop.application.user.dto.UpdateUserCommand;
import com.eshop.application.user.dto.UserResult;
import com.eshop.common.exception.ForbiddenException;
import com.eshop.common.exception.ValidationException;
import com.eshop.domain.user.DuplicateEmailException;
import com.eshop.domain.user.PasswordHasher;
import com.eshop.domain.user.User;
import com.eshop.domain.user.UserConstants;
import com.eshop.domain.user.UserNotFoundException;
import com.eshop.domain.user.UserRepository;
import com.eshop.domain.user.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * UserService - 사용자 관리 (Application 계층)
 *
 * 책임:
 * - 회원 가입 (비밀번호 해시 후 저장)
 * - 사용자 조회/목록
 * - 부분 수정 (이메일 중복 재검사, 비밀번호 재해시, 역할 변경은 관리자만)
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;

    public UserService(UserRepository userRepository, PasswordHasher passwordHasher) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
    }

    /**
     * 회원 가입
     *
     * @param actor 호출자 (비로그인이면 null). admin 역할 지정은 관리자만 가능
     * @throws DuplicateEmailException 이미 사용 중인 이메일
     */
    @Transactional
    public UserResult register(CreateUserCommand command, AuthUser actor) {
        if (command.getRole() == UserRole.ADMIN && (actor == null || !actor.isAdmin())) {
            throw new ForbiddenException("관리자 계정은 관리자만 생성할 수 있습니다");
        }
        validatePassword(command.getPassword());
        String email = User.normalizeEmail(command.getEmail());
        if (userRepository.existsByEmail(email)) {
            throw new DuplicateEmailException(email);
        }

        User user = User.create(email, passwordHasher.hash(command.getPassword()), command.getName(), command.getRole());
        User saved = saveUnique(user);
        log.info("[UserService] 회원 가입 완료 - userId={}, role={}", saved.getId(), saved.getRole().getValue());
        return UserResult.from(saved);
    }

    @Transactional(readOnly = true)
    public UserResult getUser(AuthUser actor, Long userId) {
        actor.ensureSelfOrAdmin(userId);
        return UserResult.from(findUser(userId));
    }

    @Transactional(readOnly = true)
    public List<UserResult> getUsers() {
        return userRepository.findAll().stream()
                .map(UserResult::from)
                .collect(Collectors.toList());
    }

    /**
     * 부분 수정 - 요청에 포함된 필드만 변경
     */
    @Transactional
    public UserResult updateUser(AuthUser actor, Long userId, UpdateUserCommand command) {
        actor.ensureSelfOrAdmin(userId);
        User user = findUser(userId);

        if (command.getRole() != null) {
            if (!actor.isAdmin()) {
                throw new ForbiddenException("역할 변경은 관리자만 가능합니다");
            }
            user.changeRole(command.getRole().orElse(null));
        }
        if (command.getEmail() != null) {
            String email = User.normalizeEmail(command.getEmail().orElse(null));
            if (!email.equals(user.getEmail()) && userRepository.existsByEmail(email)) {
                throw new DuplicateEmailException(email);
            }
            user.changeEmail(email);
        }
        if (command.getName() != null) {
            user.changeName(command.getName().orElse(null));
        }
        if (command.getPassword() != null) {
            String password = command.getPassword().orElse(null);
            validatePassword(password);
            user.changePasswordHash(passwordHasher.hash(password));
        }

        User saved = saveUnique(user);
        log.info("[UserService] 사용자 정보 수정 - userId={}", userId);
        return UserResult.from(saved);
    }

    private User findUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }

    /**
     * 동시 가입 등으로 사전 검사를 통과한 중복 이메일은 DB 유니크 제약에서 걸러짐
     */
    private User saveUnique(User user) {
        try {
            return userRepository.save(user);
        } catch (DataIntegrityViolationException e) {
            log.warn("[UserService] 이메일 유니크 제약 위반 - email={}", user.getEmail());
            throw new DuplicateEmailException(user.getEmail(), e);
        }
    }

    private void validatePassword(String password) {
        if (password == null
                || password.length() < UserConstants.MIN_PASSWORD_LENGTH
                || password.length() > UserConstants.MAX_PASSWORD_LENGTH) {
            throw new ValidationException(UserConstants.MSG_INVALID_PASSWORD);
        }
    }
}
