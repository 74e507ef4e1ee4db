package com.eshop.presentation.order;

import com.eshop.application.auth.AuthUser;
import com.eshop.application.order.OrderService;
import com.eshop.common.exception.ValidationException;
import com.eshop.presentation.order.mapper.OrderMapper;
import com.eshop.presentation.order.request.CreateOrderRequest;
import com.eshop.presentation.order.request.UpdateOrderRequest;
import com.eshop.presentation.order.response.OrderListResponse;
import com.eshop.presentation.order.response.OrderResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * OrderController - 주문 API 엔드포인트
 * 인증된 사용자만 접근, 본인 주문 여부와 상태 변경 권한은 OrderService에서 검사
 */
@RestController
@RequestMapping("/orders")
@PreAuthorize("isAuthenticated()")
public class OrderController {

    private final OrderService orderService;
    private final OrderMapper orderMapper;

    public OrderController(OrderService orderService, OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderMapper = orderMapper;
    }

    /**
     * POST /orders - 주문 생성 (재고 차감, 가격 스냅샷)
     */
    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(
            @AuthenticationPrincipal AuthUser actor,
            @RequestBody(required = false) CreateOrderRequest request) {
        if (request == null) {
            throw new ValidationException("요청 본문은 필수입니다");
        }
        // Presentation Request → Application Command로 변환
        var command = orderMapper.toCreateOrderCommand(request);

        var result = orderService.createOrder(actor, command);
        return ResponseEntity.status(HttpStatus.CREATED).body(orderMapper.toOrderResponse(result));
    }

    /**
     * GET /orders - 내 주문 목록 (관리자는 전체, user_id로 필터 가능)
     */
    @GetMapping
    public ResponseEntity<List<OrderListResponse>> getOrders(
            @AuthenticationPrincipal AuthUser actor,
            @RequestParam(value = "user_id", required = false) Long userId) {
        return ResponseEntity.ok(orderMapper.toOrderListResponses(orderService.getOrders(actor, userId)));
    }

    @GetMapping("/{order_id}")
    public ResponseEntity<OrderResponse> getOrder(
            @AuthenticationPrincipal AuthUser actor,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderMapper.toOrderResponse(orderService.getOrder(actor, orderId)));
    }

    /**
     * PATCH /orders/{order_id} - 상태 변경 및 배송지 수정
     */
    @PatchMapping("/{order_id}")
    public ResponseEntity<OrderResponse> updateOrder(
            @AuthenticationPrincipal AuthUser actor,
            @PathVariable("order_id") Long orderId,
            @RequestBody UpdateOrderRequest request) {
        var result = orderService.updateOrder(actor, orderId, orderMapper.toUpdateOrderCommand(request));
        return ResponseEntity.ok(orderMapper.toOrderResponse(result));
    }
}
