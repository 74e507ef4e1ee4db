package com.eshop.infrastructure.persistence.order;

import com.eshop.domain.order.Order;
import com.eshop.domain.order.OrderRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 */
@Repository
@Primary
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findByIdWithItems(orderId);
    }

    @Override
    public Optional<Order> findByIdForUpdate(Long orderId) {
        return orderJpaRepository.findByIdForUpdate(orderId);
    }

    @Override
    public List<Order> findByUserId(Long userId) {
        return orderJpaRepository.findByUserIdOrderByIdDesc(userId);
    }

    @Override
    public List<Order> findAll() {
        return orderJpaRepository.findAllByOrderByIdDesc();
    }

    @Override
    public Order save(Order order) {
        return orderJpaRepository.save(order);
    }
}
