package com.eshop.presentation.order.request;

import com.eshop.domain.order.OrderStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * 주문 수정 요청 DTO (status, shipping_address)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateOrderRequest {
    private Optional<OrderStatus> status;

    @JsonProperty("shipping_address")
    private Optional<String> shippingAddress;
}
