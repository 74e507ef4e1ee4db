package com.eshop.domain.product;

import java.util.List;
import java.util.Optional;

/**
 * ProductRepository - 상품 저장소 포트
 */
public interface ProductRepository {

    Optional<Product> findById(Long productId);

    /**
     * 비관적 쓰기 락(SELECT ... FOR UPDATE)으로 조회
     * 재고 차감/복구는 반드시 이 메서드로 조회한 엔티티에 대해 수행합니다.
     */
    Optional<Product> findByIdForUpdate(Long productId);

    /**
     * 상품 목록 조회
     *
     * @param categoryId null이면 전체 카테고리
     * @param activeOnly true면 is_active=true인 상품만
     * @param offset 건너뛸 행 수
     * @param limit 최대 행 수
     */
    List<Product> search(Long categoryId, boolean activeOnly, int offset, int limit);

    Product save(Product product);
}
