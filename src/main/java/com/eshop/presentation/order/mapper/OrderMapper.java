package com.eshop.presentation.order.mapper;

import com.eshop.application.order.dto.CreateOrderCommand;
import com.eshop.application.order.dto.OrderItemCommand;
import com.eshop.application.order.dto.OrderItemResult;
import com.eshop.application.order.dto.OrderResult;
import com.eshop.application.order.dto.OrderSummaryResult;
import com.eshop.application.order.dto.UpdateOrderCommand;
import com.eshop.presentation.order.request.CreateOrderRequest;
import com.eshop.presentation.order.request.OrderItemRequest;
import com.eshop.presentation.order.request.UpdateOrderRequest;
import com.eshop.presentation.order.response.OrderItemResponse;
import com.eshop.presentation.order.response.OrderListResponse;
import com.eshop.presentation.order.response.OrderResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderMapper - Presentation layer와 Application layer 간의 DTO 변환
 *
 * 책임:
 * - Presentation Request DTO → Application Command 변환
 * - Application Result → Presentation Response DTO 변환
 *
 * 아키텍처 원칙:
 * - Application layer는 Presentation layer DTO에 독립적 (자체 DTO 사용)
 * - Presentation layer의 @JsonProperty 같은 직렬화 로직은 이곳에서만 처리
 */
@Component
public class OrderMapper {

    public CreateOrderCommand toCreateOrderCommand(CreateOrderRequest request) {
        List<OrderItemCommand> items = request.getItems() == null ? null : request.getItems().stream()
                .map(this::toOrderItemCommand)
                .collect(Collectors.toList());
        return CreateOrderCommand.builder()
                .shippingAddress(request.getShippingAddress())
                .items(items)
                .build();
    }

    private OrderItemCommand toOrderItemCommand(OrderItemRequest request) {
        if (request == null) {
            return null;
        }
        return OrderItemCommand.builder()
                .productId(request.getProductId())
                .quantity(request.getQuantity())
                .build();
    }

    public UpdateOrderCommand toUpdateOrderCommand(UpdateOrderRequest request) {
        return UpdateOrderCommand.builder()
                .status(request.getStatus())
                .shippingAddress(request.getShippingAddress())
                .build();
    }

    public OrderResponse toOrderResponse(OrderResult result) {
        return OrderResponse.builder()
                .id(result.getId())
                .userId(result.getUserId())
                .totalAmount(result.getTotalAmount())
                .status(result.getStatus())
                .shippingAddress(result.getShippingAddress())
                .createdAt(result.getCreatedAt())
                .updatedAt(result.getUpdatedAt())
                .orderItems(result.getOrderItems().stream()
                        .map(this::toOrderItemResponse)
                        .collect(Collectors.toList()))
                .build();
    }

    private OrderItemResponse toOrderItemResponse(OrderItemResult item) {
        return OrderItemResponse.builder()
                .id(item.getId())
                .orderId(item.getOrderId())
                .productId(item.getProductId())
                .quantity(item.getQuantity())
                .unitPrice(item.getUnitPrice())
                .subtotal(item.getSubtotal())
                .build();
    }

    public List<OrderListResponse> toOrderListResponses(List<OrderSummaryResult> results) {
        return results.stream()
                .map(result -> OrderListResponse.builder()
                        .id(result.getId())
                        .totalAmount(result.getTotalAmount())
                        .status(result.getStatus())
                        .createdAt(result.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }
}
