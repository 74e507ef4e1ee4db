package com.eshop.presentation.product.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 상품 부분 수정 요청 DTO
 *
 * 필드 규칙:
 * - 필드 없음(null): 변경하지 않음
 * - 명시적 null(Optional.empty()): description, image_url은 비우고 나머지는 검증 오류
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductUpdateRequest {
    private Optional<String> name;

    private Optional<String> description;

    private Optional<BigDecimal> price;

    @JsonProperty("stock_quantity")
    private Optional<Integer> stockQuantity;

    @JsonProperty("category_id")
    private Optional<Long> categoryId;

    @JsonProperty("image_url")
    private Optional<String> imageUrl;

    @JsonProperty("is_active")
    private Optional<Boolean> isActive;
}
