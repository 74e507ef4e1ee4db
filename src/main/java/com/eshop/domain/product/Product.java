package com.eshop.domain.product;

import com.eshop.common.exception.ValidationException;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Product 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 상품 정보 관리 (이름, 설명, 가격, 이미지)
 * - 재고 차감/복구
 * - 판매 상태 관리 (is_active, 소프트 삭제)
 *
 * 핵심 비즈니스 규칙:
 * - 가격은 0 이상, 소수점 둘째 자리 고정 소수
 * - 재고는 음수가 될 수 없음
 * - 비활성 상품은 주문/장바구니에 담을 수 없음
 * - 카테고리는 category_id 값으로만 참조 (존재 여부는 서비스에서 검증)
 */
@Entity
@Table(name = "products", indexes = @Index(name = "idx_products_category_id", columnList = "category_id"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "name", nullable = false, length = ProductConstants.MAX_NAME_LENGTH)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "stock_quantity", nullable = false)
    private Integer stockQuantity;

    @Column(name = "category_id", nullable = false)
    private Long categoryId;

    @Column(name = "image_url", length = ProductConstants.MAX_IMAGE_URL_LENGTH)
    private String imageUrl;

    @Column(name = "is_active", nullable = false)
    private Boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * 상품 생성 팩토리 메서드
     *
     * @param stockQuantity null이면 0
     * @param active null이면 true
     */
    public static Product createProduct(String name, String description, BigDecimal price, Integer stockQuantity,
                                        Long categoryId, String imageUrl, Boolean active) {
        if (categoryId == null) {
            throw new ValidationException("category_id는 필수입니다");
        }
        return Product.builder()
                .name(validateName(name))
                .description(validateDescription(description))
                .price(normalizePrice(price))
                .stockQuantity(validateStock(stockQuantity == null ? 0 : stockQuantity))
                .categoryId(categoryId)
                .imageUrl(validateImageUrl(imageUrl))
                .active(active == null ? Boolean.TRUE : active)
                .createdAt(LocalDateTime.now())
                .build();
    }

    // ========== 재고 ==========

    public boolean hasStock(int quantity) {
        return this.stockQuantity >= quantity;
    }

    /**
     * 재고 차감 (주문 생성 시, 비관적 락을 획득한 상태에서 호출)
     *
     * @throws InactiveProductException 비활성 상품
     * @throws InsufficientStockException 재고 부족
     */
    public void deductStock(int quantity) {
        if (quantity <= 0) {
            throw new ValidationException("차감 수량은 0보다 커야 합니다");
        }
        ensureActive();
        if (!hasStock(quantity)) {
            throw new InsufficientStockException(this.id, quantity, this.stockQuantity);
        }
        this.stockQuantity -= quantity;
        touch();
    }

    /**
     * 재고 복구 (주문 취소 시)
     */
    public void restoreStock(int quantity) {
        if (quantity <= 0) {
            throw new ValidationException("복구 수량은 0보다 커야 합니다");
        }
        this.stockQuantity += quantity;
        touch();
    }

    public void ensureActive() {
        if (!isActive()) {
            throw new InactiveProductException(this.id);
        }
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(this.active);
    }

    // ========== 정보 수정 (부분 수정 시 제공된 필드만 호출됨) ==========

    public void rename(String name) {
        this.name = validateName(name);
        touch();
    }

    public void changeDescription(String description) {
        this.description = validateDescription(description);
        touch();
    }

    public void changePrice(BigDecimal price) {
        this.price = normalizePrice(price);
        touch();
    }

    public void changeStockQuantity(Integer stockQuantity) {
        if (stockQuantity == null) {
            throw new ValidationException(ProductConstants.MSG_INVALID_STOCK);
        }
        this.stockQuantity = validateStock(stockQuantity);
        touch();
    }

    public void changeCategory(Long categoryId) {
        if (categoryId == null) {
            throw new ValidationException("category_id는 null일 수 없습니다");
        }
        this.categoryId = categoryId;
        touch();
    }

    public void changeImageUrl(String imageUrl) {
        this.imageUrl = validateImageUrl(imageUrl);
        touch();
    }

    public void changeActive(Boolean active) {
        if (active == null) {
            throw new ValidationException("is_active는 null일 수 없습니다");
        }
        this.active = active;
        touch();
    }

    /**
     * 소프트 삭제
     */
    public void deactivate() {
        this.active = Boolean.FALSE;
        touch();
    }

    // ========== 검증 ==========

    /**
     * 가격 검증 및 scale 2 정규화
     * - 0 이상, 1억 미만
     * - 소수점 셋째 자리 이하에 0이 아닌 값이 있으면 거부
     */
    public static BigDecimal normalizePrice(BigDecimal price) {
        if (price == null || price.signum() < 0 || price.compareTo(ProductConstants.MAX_PRICE_EXCLUSIVE) >= 0) {
            throw new ValidationException(ProductConstants.MSG_INVALID_PRICE);
        }
        if (price.stripTrailingZeros().scale() > ProductConstants.PRICE_SCALE) {
            throw new ValidationException(ProductConstants.MSG_INVALID_PRICE);
        }
        return price.setScale(ProductConstants.PRICE_SCALE, RoundingMode.UNNECESSARY);
    }

    private static String validateName(String name) {
        if (name == null) {
            throw new ValidationException(ProductConstants.MSG_INVALID_NAME);
        }
        String trimmed = name.trim();
        if (trimmed.length() < ProductConstants.MIN_NAME_LENGTH || trimmed.length() > ProductConstants.MAX_NAME_LENGTH) {
            throw new ValidationException(ProductConstants.MSG_INVALID_NAME);
        }
        return trimmed;
    }

    private static String validateDescription(String description) {
        if (description != null && description.length() > ProductConstants.MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("설명은 " + ProductConstants.MAX_DESCRIPTION_LENGTH + "자 이하여야 합니다");
        }
        return description;
    }

    private static String validateImageUrl(String imageUrl) {
        if (imageUrl != null && imageUrl.length() > ProductConstants.MAX_IMAGE_URL_LENGTH) {
            throw new ValidationException("image_url은 " + ProductConstants.MAX_IMAGE_URL_LENGTH + "자 이하여야 합니다");
        }
        return imageUrl;
    }

    private static int validateStock(int stockQuantity) {
        if (stockQuantity < 0) {
            throw new ValidationException(ProductConstants.MSG_INVALID_STOCK);
        }
        return stockQuantity;
    }

    private void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
