package com.eshop.domain.category;

import java.util.List;
import java.util.Optional;

/**
 * CategoryRepository - 카테고리 저장소 포트
 */
public interface CategoryRepository {

    Optional<Category> findById(Long categoryId);

    boolean existsById(Long categoryId);

    List<Category> findAll();

    List<Category> findByParentId(Long parentId);

    Category save(Category category);
}
