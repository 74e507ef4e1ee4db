package com.eshop.domain.cart;

import java.time.Duration;
import java.util.Optional;

/**
 * CartRepository - 장바구니 저장소 포트 (TTL 지원 키-값 저장소)
 */
public interface CartRepository {

    /**
     * @return 저장된 장바구니. 없거나 만료되었으면 empty
     */
    Optional<Cart> findByUserId(Long userId);

    /**
     * 장바구니 저장 (키 TTL을 ttl로 재설정)
     */
    void save(Cart cart, Duration ttl);

    void deleteByUserId(Long userId);
}
