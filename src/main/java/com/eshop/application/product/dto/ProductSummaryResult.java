package com.eshop.application.product.dto;

import com.eshop.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 상품 목록용 요약 (설명, 재고, 카테고리 제외)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductSummaryResult {
    private Long id;
    private String name;
    private BigDecimal price;
    private String imageUrl;
    private boolean active;

    public static ProductSummaryResult from(Product product) {
        return ProductSummaryResult.builder()
                .id(product.getId())
                .name(product.getName())
                .price(product.getPrice())
                .imageUrl(product.getImageUrl())
                .active(product.isActive())
                .build();
    }
}
