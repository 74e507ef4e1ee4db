package com.eshop.infrastructure.persistence.product;

import com.eshop.domain.product.Product;
import com.eshop.domain.product.ProductRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Product Repository 구현
 *
 * Port(ProductRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공.
 * 목록 조회는 skip/limit(offset 기반) 페이징이 필요해 EntityManager로 직접 쿼리합니다.
 */
@Repository
@Primary
public class MySQLProductRepository implements ProductRepository {

    private final ProductJpaRepository productJpaRepository;

    @PersistenceContext
    private EntityManager entityManager;

    public MySQLProductRepository(ProductJpaRepository productJpaRepository) {
        this.productJpaRepository = productJpaRepository;
    }

    @Override
    public Optional<Product> findById(Long productId) {
        return productJpaRepository.findById(productId);
    }

    /**
     * 비관적 락을 사용하여 Product 조회
     *
     * 용도: 주문 생성 시 재고 차감, 주문 취소 시 재고 복구
     * - 같은 상품에 대한 동시 주문은 순서대로 처리됨
     * - 초과 판매 방지
     */
    @Override
    public Optional<Product> findByIdForUpdate(Long productId) {
        return productJpaRepository.findByIdForUpdate(productId);
    }

    @Override
    public List<Product> search(Long categoryId, boolean activeOnly, int offset, int limit) {
        StringBuilder jpql = new StringBuilder("SELECT p FROM Product p WHERE 1 = 1");
        if (categoryId != null) {
            jpql.append(" AND p.categoryId = :categoryId");
        }
        if (activeOnly) {
            jpql.append(" AND p.active = true");
        }
        jpql.append(" ORDER BY p.id ASC");

        TypedQuery<Product> query = entityManager.createQuery(jpql.toString(), Product.class);
        if (categoryId != null) {
            query.setParameter("categoryId", categoryId);
        }
        return query.setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    public Product save(Product product) {
        return productJpaRepository.save(product);
    }
}
