package com.eshop.application.category.dto;

import com.eshop.domain.category.Category;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 카테고리 조회 결과 (Redis 캐시에 저장되므로 기본 생성자 필요)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryResult {
    private Long id;
    private String name;
    private String description;
    private Long parentId;

    public static CategoryResult from(Category category) {
        return CategoryResult.builder()
                .id(category.getId())
                .name(category.getName())
                .description(category.getDescription())
                .parentId(category.getParentId())
                .build();
    }
}
