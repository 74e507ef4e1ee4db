package com.eshop.application.product;

import com.eshop.application.product.dto.CreateProductCommand;
import com.eshop.application.product.dto.ProductResult;
import com.eshop.application.product.dto.ProductSummaryResult;
import com.eshop.application.product.dto.UpdateProductCommand;
import com.eshop.common.exception.InvalidReferenceException;
import com.eshop.common.exception.ValidationException;
import com.eshop.domain.category.CategoryRepository;
import com.eshop.domain.product.Product;
import com.eshop.domain.product.ProductConstants;
import com.eshop.domain.product.ProductNotFoundException;
import com.eshop.domain.product.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ProductService - 상품 관리 (Application 계층)
 *
 * 책임:
 * - 상품 목록/상세 조회
 * - 상품 등록, 부분 수정, 소프트 삭제 (관리자)
 *
 * 비즈니스 규칙:
 * - category_id는 존재하는 카테고리여야 함 (없으면 ReferenceError)
 * - 삭제는 is_active=false 처리이며 행은 유지됨 (기존 주문 항목이 참조)
 */
@Service
public class ProductService {

    private static final Logger log = LoggerFactory.getLogger(ProductService.class);

    private final ProductRepository productRepository;
    private final CategoryRepository categoryRepository;

    public ProductService(ProductRepository productRepository, CategoryRepository categoryRepository) {
        this.productRepository = productRepository;
        this.categoryRepository = categoryRepository;
    }

    /**
     * 상품 목록 조회
     *
     * @param categoryId null이면 전체
     * @param activeOnly true면 판매 중인 상품만
     * @param skip 0 이상
     * @param limit 1 ~ 1000
     */
    @Transactional(readOnly = true)
    public List<ProductSummaryResult> getProducts(Long categoryId, boolean activeOnly, int skip, int limit) {
        if (skip < 0) {
            throw new ValidationException("skip은 0 이상이어야 합니다");
        }
        if (limit < 1 || limit > ProductConstants.MAX_LIST_LIMIT) {
            throw new ValidationException("limit은 1 이상 " + ProductConstants.MAX_LIST_LIMIT + " 이하여야 합니다");
        }
        return productRepository.search(categoryId, activeOnly, skip, limit).stream()
                .map(ProductSummaryResult::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ProductResult getProduct(Long productId) {
        return ProductResult.from(findProduct(productId));
    }

    @Transactional
    public ProductResult createProduct(CreateProductCommand command) {
        ensureCategoryExists(command.getCategoryId());

        Product product = Product.createProduct(
                command.getName(),
                command.getDescription(),
                command.getPrice(),
                command.getStockQuantity(),
                command.getCategoryId(),
                command.getImageUrl(),
                command.getIsActive()
        );
        Product saved = productRepository.save(product);
        log.info("[ProductService] 상품 등록 - productId={}, categoryId={}, price={}",
                saved.getId(), saved.getCategoryId(), saved.getPrice());
        return ProductResult.from(saved);
    }

    /**
     * 부분 수정 - 요청에 포함된 필드만 변경
     * 주문의 재고 차감과 같은 행을 갱신하므로 비관적 락으로 조회
     */
    @Transactional
    public ProductResult updateProduct(Long productId, UpdateProductCommand command) {
        Product product = findProductForUpdate(productId);

        if (command.getName() != null) {
            product.rename(command.getName().orElse(null));
        }
        if (command.getDescription() != null) {
            product.changeDescription(command.getDescription().orElse(null));
        }
        if (command.getPrice() != null) {
            product.changePrice(command.getPrice().orElse(null));
        }
        if (command.getStockQuantity() != null) {
            product.changeStockQuantity(command.getStockQuantity().orElse(null));
        }
        if (command.getCategoryId() != null) {
            Long categoryId = command.getCategoryId().orElse(null);
            ensureCategoryExists(categoryId);
            product.changeCategory(categoryId);
        }
        if (command.getImageUrl() != null) {
            product.changeImageUrl(command.getImageUrl().orElse(null));
        }
        if (command.getIsActive() != null) {
            product.changeActive(command.getIsActive().orElse(null));
        }

        Product saved = productRepository.save(product);
        log.info("[ProductService] 상품 수정 - productId={}", productId);
        return ProductResult.from(saved);
    }

    /**
     * 소프트 삭제 (is_active=false)
     */
    @Transactional
    public void deleteProduct(Long productId) {
        Product product = findProductForUpdate(productId);
        product.deactivate();
        productRepository.save(product);
        log.info("[ProductService] 상품 판매 중지 - productId={}", productId);
    }

    private Product findProduct(Long productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    /**
     * UPDATE는 모든 컬럼을 쓰므로 락 없이 읽은 재고로 덮어쓰지 않도록 SELECT ... FOR UPDATE
     */
    private Product findProductForUpdate(Long productId) {
        return productRepository.findByIdForUpdate(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    private void ensureCategoryExists(Long categoryId) {
        if (categoryId == null) {
            throw new ValidationException("category_id는 필수입니다");
        }
        if (!categoryRepository.existsById(categoryId)) {
            throw new InvalidReferenceException("category_id", categoryId);
        }
    }
}
