package com.eshop.presentation.category.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * 카테고리 부분 수정 요청 DTO
 * description, parent_id는 명시적 null로 비울 수 있음
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryUpdateRequest {
    private Optional<String> name;

    private Optional<String> description;

    @JsonProperty("parent_id")
    private Optional<Long> parentId;
}
