package com.eshop.domain.cart;

import com.eshop.common.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Cart - 사용자별 장바구니 (Redis에 TTL과 함께 저장되는 휘발성 데이터)
 *
 * 비즈니스 규칙:
 * - 항목 수량은 1~1000 (같은 상품을 다시 담으면 수량이 누적되며 누적값도 범위 내여야 함)
 * - 서로 다른 상품은 최대 100개
 * - 항목은 담은 순서를 유지
 * - 쓰기마다 expires_at이 갱신되며 만료는 저장소(Redis TTL)가 처리
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Cart {

    @JsonProperty("user_id")
    private Long userId;

    @JsonProperty("items")
    private List<CartItem> items = new ArrayList<>();

    @JsonProperty("expires_at")
    private LocalDateTime expiresAt;

    private Cart(Long userId) {
        this.userId = userId;
    }

    public static Cart empty(Long userId) {
        return new Cart(userId);
    }

    public List<CartItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public Optional<CartItem> findItem(Long productId) {
        return items.stream()
                .filter(item -> item.getProductId().equals(productId))
                .findFirst();
    }

    /**
     * 상품 추가 (이미 담긴 상품이면 수량 누적)
     */
    public CartItem addItem(Long productId, int quantity, LocalDateTime now) {
        validateQuantity(quantity);
        Optional<CartItem> existing = findItem(productId);
        if (existing.isPresent()) {
            CartItem item = existing.get();
            int merged = item.getQuantity() + quantity;
            validateQuantity(merged);
            item.changeQuantity(merged);
            return item;
        }
        if (items.size() >= CartConstants.MAX_CART_LINES) {
            throw new ValidationException(CartConstants.MSG_CART_FULL);
        }
        CartItem item = new CartItem(productId, quantity, now);
        items.add(item);
        return item;
    }

    /**
     * 수량 변경 (누적이 아닌 대체)
     *
     * @throws CartItemNotFoundException 담기지 않은 상품
     */
    public CartItem updateQuantity(Long productId, int quantity) {
        validateQuantity(quantity);
        CartItem item = findItem(productId)
                .orElseThrow(() -> new CartItemNotFoundException(userId, productId));
        item.changeQuantity(quantity);
        return item;
    }

    public void removeItem(Long productId) {
        CartItem item = findItem(productId)
                .orElseThrow(() -> new CartItemNotFoundException(userId, productId));
        items.remove(item);
    }

    public void refreshExpiry(LocalDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    @JsonIgnore
    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return items.isEmpty();
    }

    private static void validateQuantity(int quantity) {
        if (quantity < CartConstants.MIN_CART_QUANTITY || quantity > CartConstants.MAX_CART_QUANTITY) {
            throw new ValidationException(CartConstants.MSG_INVALID_CART_QUANTITY);
        }
    }
}
