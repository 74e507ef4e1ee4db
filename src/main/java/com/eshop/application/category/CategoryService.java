package com.eshop.application.category;

import com.eshop.application.category.dto.CategoryResult;
import com.eshop.application.category.dto.CreateCategoryCommand;
import com.eshop.application.category.dto.UpdateCategoryCommand;
import com.eshop.common.exception.InvalidReferenceException;
import com.eshop.common.exception.ValidationException;
import com.eshop.domain.category.Category;
import com.eshop.domain.category.CategoryNotFoundException;
import com.eshop.domain.category.CategoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.cache.annotation.Caching;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * CategoryService - 카테고리 관리 (Application 계층)
 *
 * 비즈니스 규칙:
 * - parent_id는 존재하는 카테고리여야 함 (없으면 ReferenceError)
 * - 상위 체인에 순환이 생기는 변경은 거부 (자기 자신 또는 자손을 상위로 지정)
 * - 생성/수정은 관리자만 가능
 *
 * 캐시:
 * - categories: 목록 (parent_id별), 생성/수정 시 전체 무효화
 * - category: 상세, 수정 시 해당 키 무효화
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryService {

    private final CategoryRepository categoryRepository;

    @Transactional(readOnly = true)
    @Cacheable(value = "categories", key = "#p0 == null ? 'all' : #p0")
    public List<CategoryResult> getCategories(Long parentId) {
        List<Category> categories = parentId == null
                ? categoryRepository.findAll()
                : categoryRepository.findByParentId(parentId);
        return categories.stream()
                .map(CategoryResult::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    @Cacheable(value = "category", key = "#p0")
    public CategoryResult getCategory(Long categoryId) {
        return CategoryResult.from(findCategory(categoryId));
    }

    @Transactional
    @CacheEvict(value = "categories", allEntries = true)
    public CategoryResult createCategory(CreateCategoryCommand command) {
        if (command.getParentId() != null) {
            ensureParentExists(command.getParentId());
        }
        Category saved = categoryRepository.save(
                Category.create(command.getName(), command.getDescription(), command.getParentId()));
        log.info("[CategoryService] 카테고리 생성 - categoryId={}, parentId={}", saved.getId(), saved.getParentId());
        return CategoryResult.from(saved);
    }

    @Transactional
    @Caching(evict = {
            @CacheEvict(value = "categories", allEntries = true),
            @CacheEvict(value = "category", key = "#p0")
    })
    public CategoryResult updateCategory(Long categoryId, UpdateCategoryCommand command) {
        Category category = findCategory(categoryId);

        if (command.getName() != null) {
            category.rename(command.getName().orElse(null));
        }
        if (command.getDescription() != null) {
            category.changeDescription(command.getDescription().orElse(null));
        }
        if (command.getParentId() != null) {
            Long parentId = command.getParentId().orElse(null);
            if (parentId != null) {
                ensureParentExists(parentId);
                ensureNoCycle(categoryId, parentId);
            }
            category.changeParent(parentId);
        }

        Category saved = categoryRepository.save(category);
        log.info("[CategoryService] 카테고리 수정 - categoryId={}", categoryId);
        return CategoryResult.from(saved);
    }

    private Category findCategory(Long categoryId) {
        return categoryRepository.findById(categoryId)
                .orElseThrow(() -> new CategoryNotFoundException(categoryId));
    }

    private void ensureParentExists(Long parentId) {
        if (!categoryRepository.existsById(parentId)) {
            throw new InvalidReferenceException("parent_id", parentId);
        }
    }

    /**
     * 새 상위 카테고리에서 루트까지 올라가며 자기 자신이 나오면 순환
     */
    private void ensureNoCycle(Long categoryId, Long newParentId) {
        Set<Long> visited = new HashSet<>();
        Long current = newParentId;
        while (current != null) {
            if (current.equals(categoryId)) {
                throw new ValidationException("하위 카테고리를 상위 카테고리로 지정할 수 없습니다 (순환 참조)");
            }
            if (!visited.add(current)) {
                log.error("[CategoryService] 기존 데이터에 순환 참조 존재 - categoryId={}", current);
                throw new ValidationException("카테고리 계층에 순환 참조가 있습니다");
            }
            current = categoryRepository.findById(current)
                    .map(Category::getParentId)
                    .orElse(null);
        }
    }
}
