package com.eshop.domain.cart;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * CartItem - 장바구니 항목 (값 객체)
 * 상품은 ID로만 참조합니다.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class CartItem {

    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("quantity")
    private int quantity;

    @JsonProperty("added_at")
    private LocalDateTime addedAt;

    void changeQuantity(int quantity) {
        this.quantity = quantity;
    }
}
