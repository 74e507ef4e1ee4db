package com.eshop.application.cart.dto;

import com.eshop.domain.cart.CartItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemResult {
    private Long productId;
    private Integer quantity;
    private LocalDateTime addedAt;

    public static CartItemResult from(CartItem item) {
        return CartItemResult.builder()
                .productId(item.getProductId())
                .quantity(item.getQuantity())
                .addedAt(item.getAddedAt())
                .build();
    }
}
