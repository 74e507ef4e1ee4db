package com.eshop.presentation.category.mapper;

import com.eshop.application.category.dto.CategoryResult;
import com.eshop.application.category.dto.CreateCategoryCommand;
import com.eshop.application.category.dto.UpdateCategoryCommand;
import com.eshop.presentation.category.request.CategoryCreateRequest;
import com.eshop.presentation.category.request.CategoryUpdateRequest;
import com.eshop.presentation.category.response.CategoryResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * CategoryMapper - Presentation layer와 Application layer 간의 DTO 변환
 */
@Component
public class CategoryMapper {

    public CreateCategoryCommand toCreateCategoryCommand(CategoryCreateRequest request) {
        return CreateCategoryCommand.builder()
                .name(request.getName())
                .description(request.getDescription())
                .parentId(request.getParentId())
                .build();
    }

    public UpdateCategoryCommand toUpdateCategoryCommand(CategoryUpdateRequest request) {
        return UpdateCategoryCommand.builder()
                .name(request.getName())
                .description(request.getDescription())
                .parentId(request.getParentId())
                .build();
    }

    public CategoryResponse toCategoryResponse(CategoryResult result) {
        return CategoryResponse.builder()
                .id(result.getId())
                .name(result.getName())
                .description(result.getDescription())
                .parentId(result.getParentId())
                .build();
    }

    public List<CategoryResponse> toCategoryResponses(List<CategoryResult> results) {
        return results.stream()
                .map(this::toCategoryResponse)
                .collect(Collectors.toList());
    }
}
