package com.eshop.application.product.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 상품 부분 수정 커맨드
 *
 * 필드 규칙:
 * - null: 변경하지 않음
 * - Optional.empty(): 명시적 null. description, image_url은 값 제거, 나머지는 검증 오류
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProductCommand {
    private Optional<String> name;
    private Optional<String> description;
    private Optional<BigDecimal> price;
    private Optional<Integer> stockQuantity;
    private Optional<Long> categoryId;
    private Optional<String> imageUrl;
    private Optional<Boolean> isActive;
}
