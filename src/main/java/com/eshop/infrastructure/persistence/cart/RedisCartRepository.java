package com.eshop.infrastructure.persistence.cart;

import com.eshop.common.exception.ErrorCode;
import com.eshop.common.exception.SystemException;
import com.eshop.domain.cart.Cart;
import com.eshop.domain.cart.CartRepository;
import com.eshop.infrastructure.config.RedisKeyType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis 기반 장바구니 저장소
 *
 * 저장 구조:
 * - Key: cart:{userId}
 * - Value: Cart JSON ({"user_id", "items", "expires_at"})
 * - TTL: 쓰기마다 재설정, 만료 시 Redis가 키를 삭제
 *
 * 동시 수정은 CartService의 분산락으로 직렬화됩니다.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisCartRepository implements CartRepository {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<Cart> findByUserId(Long userId) {
        String key = buildKey(userId);
        try {
            String json = stringRedisTemplate.opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, Cart.class));
        } catch (JsonProcessingException e) {
            log.error("[RedisCartRepository] 장바구니 역직렬화 실패 - key={}", key, e);
            throw new SystemException(ErrorCode.CART_STORE_ERROR, "key=" + key, e);
        } catch (DataAccessException e) {
            log.error("[RedisCartRepository] 장바구니 조회 실패 - key={}", key, e);
            throw new SystemException(ErrorCode.CART_STORE_ERROR, "key=" + key, e);
        }
    }

    @Override
    public void save(Cart cart, Duration ttl) {
        String key = buildKey(cart.getUserId());
        try {
            String json = objectMapper.writeValueAsString(cart);
            stringRedisTemplate.opsForValue().set(key, json, ttl);
            log.debug("[RedisCartRepository] 장바구니 저장 - key={}, items={}, ttl={}", key, cart.getItems().size(), ttl);
        } catch (JsonProcessingException e) {
            log.error("[RedisCartRepository] 장바구니 직렬화 실패 - key={}", key, e);
            throw new SystemException(ErrorCode.CART_STORE_ERROR, "key=" + key, e);
        } catch (DataAccessException e) {
            log.error("[RedisCartRepository] 장바구니 저장 실패 - key={}", key, e);
            throw new SystemException(ErrorCode.CART_STORE_ERROR, "key=" + key, e);
        }
    }

    @Override
    public void deleteByUserId(Long userId) {
        String key = buildKey(userId);
        try {
            stringRedisTemplate.delete(key);
        } catch (DataAccessException e) {
            log.error("[RedisCartRepository] 장바구니 삭제 실패 - key={}", key, e);
            throw new SystemException(ErrorCode.CART_STORE_ERROR, "key=" + key, e);
        }
    }

    static String buildKey(Long userId) {
        return RedisKeyType.CART.buildKey(userId);
    }
}
