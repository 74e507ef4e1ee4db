package com.eshop.infrastructure.persistence.category;

import com.eshop.domain.category.Category;
import com.eshop.domain.category.CategoryRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Category Repository 구현
 */
@Repository
@Primary
public class MySQLCategoryRepository implements CategoryRepository {

    private final CategoryJpaRepository categoryJpaRepository;

    public MySQLCategoryRepository(CategoryJpaRepository categoryJpaRepository) {
        this.categoryJpaRepository = categoryJpaRepository;
    }

    @Override
    public Optional<Category> findById(Long categoryId) {
        return categoryJpaRepository.findById(categoryId);
    }

    @Override
    public boolean existsById(Long categoryId) {
        return categoryJpaRepository.existsById(categoryId);
    }

    @Override
    public List<Category> findAll() {
        return categoryJpaRepository.findAllByOrderByIdAsc();
    }

    @Override
    public List<Category> findByParentId(Long parentId) {
        return categoryJpaRepository.findByParentIdOrderByIdAsc(parentId);
    }

    @Override
    public Category save(Category category) {
        return categoryJpaRepository.save(category);
    }
}
