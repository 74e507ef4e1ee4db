package com.eshop.presentation.category;

import com.eshop.application.category.CategoryService;
import com.eshop.common.exception.ValidationException;
import com.eshop.presentation.category.mapper.CategoryMapper;
import com.eshop.presentation.category.request.CategoryCreateRequest;
import com.eshop.presentation.category.request.CategoryUpdateRequest;
import com.eshop.presentation.category.response.CategoryResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * CategoryController - 카테고리 API
 * 조회는 인증 없이, 생성/수정은 관리자만 가능
 */
@RestController
@RequestMapping("/categories")
public class CategoryController {

    private final CategoryService categoryService;
    private final CategoryMapper categoryMapper;

    public CategoryController(CategoryService categoryService, CategoryMapper categoryMapper) {
        this.categoryService = categoryService;
        this.categoryMapper = categoryMapper;
    }

    /**
     * GET /categories?parent_id= - 전체 또는 특정 부모의 하위 카테고리
     */
    @GetMapping
    public ResponseEntity<List<CategoryResponse>> getCategories(
            @RequestParam(value = "parent_id", required = false) Long parentId) {
        return ResponseEntity.ok(categoryMapper.toCategoryResponses(categoryService.getCategories(parentId)));
    }

    @GetMapping("/{category_id}")
    public ResponseEntity<CategoryResponse> getCategory(@PathVariable("category_id") Long categoryId) {
        return ResponseEntity.ok(categoryMapper.toCategoryResponse(categoryService.getCategory(categoryId)));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<CategoryResponse> createCategory(
            @RequestBody(required = false) CategoryCreateRequest request) {
        if (request == null) {
            throw new ValidationException("요청 본문은 필수입니다");
        }
        var result = categoryService.createCategory(categoryMapper.toCreateCategoryCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(categoryMapper.toCategoryResponse(result));
    }

    @PatchMapping("/{category_id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<CategoryResponse> updateCategory(
            @PathVariable("category_id") Long categoryId,
            @RequestBody CategoryUpdateRequest request) {
        var result = categoryService.updateCategory(categoryId, categoryMapper.toUpdateCategoryCommand(request));
        return ResponseEntity.ok(categoryMapper.toCategoryResponse(result));
    }
}
