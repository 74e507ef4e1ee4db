package com.eshop.infrastructure.persistence.product;

import com.eshop.domain.product.Product;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Product JPA Repository
 */
public interface ProductJpaRepository extends JpaRepository<Product, Long> {

    /**
     * 비관적 락 (SELECT ... FOR UPDATE)
     * 락 대기 시간은 MySQL 세션의 innodb_lock_wait_timeout을 따릅니다 (hikari connection-init-sql로 3초).
     * 초과 시 PessimisticLockingFailureException → OrderTransactionService에서 재시도
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Product p WHERE p.id = :productId")
    Optional<Product> findByIdForUpdate(@Param("productId") Long productId);
}
