package com.eshop.infrastructure.lock;

import com.eshop.infrastructure.config.RedisKeyType;

/**
 * 분산락 키 생성 유틸리티
 *
 * 패턴: lock:resource_type:resource_id
 */
public class LockKeyGenerator {

    /**
     * 장바구니 수정용 락 키 템플릿 (첫 번째 파라미터가 userId)
     * 예: addItem(userId=10, ...) → "lock:cart:10"
     */
    public static final String CART_KEY_TEMPLATE = "'lock:cart:' + #p0";

    public static String cart(Long userId) {
        return RedisKeyType.LOCK_CART.buildKey(userId);
    }

    private LockKeyGenerator() {
        throw new AssertionError("LockKeyGenerator는 인스턴스화할 수 없습니다");
    }
}
