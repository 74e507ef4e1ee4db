package com.eshop.application.order.dto;

import com.eshop.domain.order.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * 주문 수정 커맨드 (status, shipping_address만 변경 가능)
 *
 * 필드 규칙:
 * - null: 변경하지 않음
 * - Optional.empty(): 명시적 null (검증 오류)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateOrderCommand {
    private Optional<OrderStatus> status;
    private Optional<String> shippingAddress;
}
