package com.eshop.infrastructure.persistence.category;

import com.eshop.domain.category.Category;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Category JPA Repository
 */
public interface CategoryJpaRepository extends JpaRepository<Category, Long> {

    List<Category> findByParentIdOrderByIdAsc(Long parentId);

    List<Category> findAllByOrderByIdAsc();
}
