package com.eshop.domain.user;

import java.util.List;
import java.util.Optional;

/**
 * UserRepository - 사용자 저장소 포트
 */
public interface UserRepository {

    Optional<User> findById(Long userId);

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsById(Long userId);

    List<User> findAll();

    User save(User user);
}
