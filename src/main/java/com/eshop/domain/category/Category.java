package com.eshop.domain.category;

import com.eshop.common.exception.ValidationException;
import jakarta.persistence.*;
import lombok.*;

import java.util.Objects;

/**
 * Category 도메인 엔티티
 *
 * 책임:
 * - 카테고리 이름/설명 관리
 * - 상위 카테고리 참조 (parent_id, 자기 참조 FK)
 *
 * 비즈니스 규칙:
 * - 이름은 1~100자
 * - 자기 자신을 상위로 지정할 수 없음
 * - 상위 카테고리 존재 여부와 순환 참조는 CategoryService에서 검증
 */
@Entity
@Table(name = "categories", indexes = @Index(name = "idx_categories_parent_id", columnList = "parent_id"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Category {

    public static final int MAX_NAME_LENGTH = 100;
    public static final int MAX_DESCRIPTION_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "name", nullable = false, length = MAX_NAME_LENGTH)
    private String name;

    @Column(name = "description", length = MAX_DESCRIPTION_LENGTH)
    private String description;

    @Column(name = "parent_id")
    private Long parentId;

    public static Category create(String name, String description, Long parentId) {
        return Category.builder()
                .name(validateName(name))
                .description(validateDescription(description))
                .parentId(parentId)
                .build();
    }

    public void rename(String name) {
        this.name = validateName(name);
    }

    public void changeDescription(String description) {
        this.description = validateDescription(description);
    }

    /**
     * 상위 카테고리 변경 (null이면 최상위로 이동)
     */
    public void changeParent(Long parentId) {
        if (parentId != null && Objects.equals(parentId, this.id)) {
            throw new ValidationException("카테고리는 자기 자신을 상위 카테고리로 가질 수 없습니다");
        }
        this.parentId = parentId;
    }

    private static String validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("카테고리 이름은 필수입니다");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("카테고리 이름은 " + MAX_NAME_LENGTH + "자 이하여야 합니다");
        }
        return trimmed;
    }

    private static String validateDescription(String description) {
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("설명은 " + MAX_DESCRIPTION_LENGTH + "자 이하여야 합니다");
        }
        return description;
    }
}
