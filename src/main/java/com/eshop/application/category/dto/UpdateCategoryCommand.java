package com.eshop.application.category.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * 카테고리 부분 수정 커맨드
 *
 * 필드 규칙:
 * - null: 변경하지 않음
 * - Optional.empty(): 값 제거 (description, parent_id만 허용, name은 검증 오류)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateCategoryCommand {
    private Optional<String> name;
    private Optional<String> description;
    private Optional<Long> parentId;
}
