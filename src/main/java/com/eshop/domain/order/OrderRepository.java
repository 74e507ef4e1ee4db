package com.eshop.domain.order;

import java.util.List;
import java.util.Optional;

/**
 * OrderRepository - 주문 저장소 포트
 */
public interface OrderRepository {

    /**
     * 주문 항목을 함께 로드하여 조회
     */
    Optional<Order> findById(Long orderId);

    /**
     * 비관적 쓰기 락으로 조회 (상태 변경 시 동시 변경 방지)
     */
    Optional<Order> findByIdForUpdate(Long orderId);

    List<Order> findByUserId(Long userId);

    List<Order> findAll();

    Order save(Order order);
}
