package com.eshop.application.order;

import com.eshop.application.auth.AuthUser;
import com.eshop.application.order.dto.CreateOrderCommand;
import com.eshop.application.order.dto.OrderResult;
import com.eshop.application.order.dto.OrderSummaryResult;
import com.eshop.application.order.dto.UpdateOrderCommand;
import com.eshop.common.exception.ErrorCode;
import com.eshop.common.exception.SystemException;
import com.eshop.domain.order.Order;
import com.eshop.domain.order.OrderNotFoundException;
import com.eshop.domain.order.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.SortedMap;
import java.util.stream.Collectors;

/**
 * OrderService - 주문 유스케이스 (Application 계층)
 *
 * 흐름:
 * 1. OrderValidator: 요청 검증, 중복 상품 병합
 * 2. OrderTransactionService: 재고 차감 + 주문 저장 (단일 트랜잭션)
 * 3. 락 재시도 소진 시 SystemException(LOCK_ACQUISITION_FAILED, 503)으로 변환
 *
 * 조회 권한:
 * - 고객은 본인 주문만, 관리자는 전체 (user_id 필터 가능)
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;
    private final OrderValidator orderValidator;
    private final OrderTransactionService orderTransactionService;

    public OrderService(OrderRepository orderRepository,
                        OrderValidator orderValidator,
                        OrderTransactionService orderTransactionService) {
        this.orderRepository = orderRepository;
        this.orderValidator = orderValidator;
        this.orderTransactionService = orderTransactionService;
    }

    public OrderResult createOrder(AuthUser actor, CreateOrderCommand command) {
        SortedMap<Long, Integer> lines = orderValidator.validateAndMerge(command);
        log.debug("[OrderService] 주문 요청 - userId={}, products={}", actor.getUserId(), lines.keySet());
        try {
            return orderTransactionService.createOrder(actor.getUserId(), command.getShippingAddress(), lines);
        } catch (PessimisticLockingFailureException e) {
            log.error("[OrderService] 주문 생성 락 재시도 소진 - userId={}, products={}", actor.getUserId(), lines.keySet(), e);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, e);
        }
    }

    @Transactional(readOnly = true)
    public OrderResult getOrder(AuthUser actor, Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        actor.ensureSelfOrAdmin(order.getUserId());
        return OrderResult.from(order);
    }

    /**
     * @param userIdFilter 관리자만 사용 가능. null이면 전체 주문
     */
    @Transactional(readOnly = true)
    public List<OrderSummaryResult> getOrders(AuthUser actor, Long userIdFilter) {
        List<Order> orders;
        if (actor.isAdmin()) {
            orders = userIdFilter == null ? orderRepository.findAll() : orderRepository.findByUserId(userIdFilter);
        } else {
            actor.ensureSelfOrAdmin(userIdFilter == null ? actor.getUserId() : userIdFilter);
            orders = orderRepository.findByUserId(actor.getUserId());
        }
        return orders.stream()
                .map(OrderSummaryResult::from)
                .collect(Collectors.toList());
    }

    public OrderResult updateOrder(AuthUser actor, Long orderId, UpdateOrderCommand command) {
        try {
            return orderTransactionService.updateOrder(actor, orderId, command);
        } catch (PessimisticLockingFailureException e) {
            log.error("[OrderService] 주문 변경 락 재시도 소진 - orderId={}", orderId, e);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, e);
        }
    }
}
