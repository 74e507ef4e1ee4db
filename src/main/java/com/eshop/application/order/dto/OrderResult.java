package com.eshop.application.order.dto;

import com.eshop.domain.order.Order;
import com.eshop.domain.order.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 상세 결과 (주문 항목 포함)
 * 주문 항목이 LAZY이므로 트랜잭션 안에서 변환해야 합니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResult {
    private Long id;
    private Long userId;
    private BigDecimal totalAmount;
    private OrderStatus status;
    private String shippingAddress;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private List<OrderItemResult> orderItems;

    public static OrderResult from(Order order) {
        return OrderResult.builder()
                .id(order.getId())
                .userId(order.getUserId())
                .totalAmount(order.getTotalAmount())
                .status(order.getStatus())
                .shippingAddress(order.getShippingAddress())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .orderItems(order.getOrderItems().stream()
                        .map(item -> OrderItemResult.from(order.getId(), item))
                        .collect(Collectors.toList()))
                .build();
    }
}
