package com.eshop.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 상품 목록 항목 DTO (설명, 재고, 카테고리 제외)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductListResponse {
    private Long id;

    private String name;

    private BigDecimal price;

    @JsonProperty("image_url")
    private String imageUrl;

    @JsonProperty("is_active")
    private boolean active;
}
