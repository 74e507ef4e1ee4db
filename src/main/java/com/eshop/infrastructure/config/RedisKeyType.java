package com.eshop.infrastructure.config;

import java.time.Duration;

/**
 * Redis 키 타입 관리 Enum
 *
 * 목표:
 * 1. 모든 Redis 키를 한 곳에서 관리
 * 2. TTL을 포함한 메타데이터 관리
 *
 * 사용법:
 * - 파라미터: RedisKeyType.CART.buildKey(userId)
 * - TTL: RedisKeyType.CACHE_CATEGORY_LIST.getTtl()
 */
public enum RedisKeyType {

    // ===== 캐시 (Cache) =====

    CACHE_CATEGORY_LIST(
        "categories",
        Duration.ofMinutes(30),
        "카테고리 목록 (parent_id 필터별)"
    ),

    CACHE_CATEGORY_DETAIL(
        "category",
        Duration.ofMinutes(30),
        "카테고리 상세"
    ),

    // ===== 상태 (State) =====

    /** TTL은 eshop.cart.ttl 설정값을 사용 */
    CART(
        "cart:{userId}",
        null,
        "사용자 장바구니 JSON"
    ),

    // ===== 분산 락 (Distributed Lock) =====

    LOCK_CART(
        "lock:cart:{userId}",
        null,
        "장바구니 수정 직렬화 락"
    );

    private final String pattern;
    private final Duration ttl;
    private final String description;

    RedisKeyType(String pattern, Duration ttl, String description) {
        this.pattern = pattern;
        this.ttl = ttl;
        this.description = description;
    }

    /**
     * 실제 키 생성 (플레이스홀더 치환)
     *
     * 예: CART.buildKey(123L) → "cart:123"
     */
    public String buildKey(Object... values) {
        String key = this.pattern;
        for (Object value : values) {
            key = key.replaceFirst("\\{[^}]*\\}", String.valueOf(value));
        }
        return key;
    }

    public String getPattern() {
        return pattern;
    }

    public Duration getTtl() {
        return ttl;
    }

    public String getDescription() {
        return description;
    }
}
