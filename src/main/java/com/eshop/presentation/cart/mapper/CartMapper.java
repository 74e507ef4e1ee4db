package com.eshop.presentation.cart.mapper;

import com.eshop.application.cart.dto.CartResult;
import com.eshop.presentation.cart.response.CartItemResponse;
import com.eshop.presentation.cart.response.CartResponse;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * CartMapper - Application CartResult → Presentation CartResponse 변환
 */
@Component
public class CartMapper {

    public CartResponse toCartResponse(CartResult result) {
        return CartResponse.builder()
                .userId(result.getUserId())
                .items(result.getItems().stream()
                        .map(item -> CartItemResponse.builder()
                                .productId(item.getProductId())
                                .quantity(item.getQuantity())
                                .addedAt(item.getAddedAt())
                                .build())
                        .collect(Collectors.toList()))
                .expiresAt(result.getExpiresAt())
                .build();
    }
}
