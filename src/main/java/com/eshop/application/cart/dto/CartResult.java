package com.eshop.application.cart.dto;

import com.eshop.domain.cart.Cart;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 장바구니 조회 결과 (항목은 담은 순서)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResult {
    private Long userId;
    private List<CartItemResult> items;
    private LocalDateTime expiresAt;

    public static CartResult from(Cart cart) {
        return CartResult.builder()
                .userId(cart.getUserId())
                .items(cart.getItems().stream()
                        .map(CartItemResult::from)
                        .collect(Collectors.toList()))
                .expiresAt(cart.getExpiresAt())
                .build();
    }
}
