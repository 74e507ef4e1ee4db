package com.eshop.presentation.order.response;

import com.eshop.domain.order.OrderStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 목록 항목 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderListResponse {
    private Long id;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    private OrderStatus status;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;
}
