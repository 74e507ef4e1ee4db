package com.eshop.application.order;

import com.eshop.application.auth.AuthUser;
import com.eshop.application.order.dto.OrderResult;
import com.eshop.application.order.dto.UpdateOrderCommand;
import com.eshop.common.exception.ForbiddenException;
import com.eshop.common.exception.InvalidReferenceException;
import com.eshop.common.exception.ValidationException;
import com.eshop.domain.order.Order;
import com.eshop.domain.order.OrderItem;
import com.eshop.domain.order.OrderNotFoundException;
import com.eshop.domain.order.OrderRepository;
import com.eshop.domain.order.OrderStatus;
import com.eshop.domain.product.Product;
import com.eshop.domain.product.ProductNotFoundException;
import com.eshop.domain.product.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * OrderTransactionService - 주문 트랜잭션 처리 서비스 (Application 계층)
 *
 * 역할:
 * - 재고 차감 + 주문 저장, 상태 변경 + 재고 복구를 각각 하나의 트랜잭션으로 처리
 * - OrderService에서 분리되어 @Transactional, @Retryable 프록시가 정상 작동
 *
 * 동시성 제어:
 * - 상품 행에 비관적 락(SELECT ... FOR UPDATE), 상품 ID 오름차순으로 획득
 * - 락 대기 초과/데드락(PessimisticLockingFailureException) 시 새 트랜잭션으로 재시도
 *   - maxAttempts=3, backoff 50ms → 100ms (jitter)
 *   - 재시도 소진 시 마지막 예외가 그대로 전파됨 (OrderService에서 변환)
 *
 * 재고 정책:
 * - 주문 생성 시점에 차감
 * - 한 항목이라도 실패하면 전체 롤백 (주문/항목/재고 변경 모두 취소)
 * - 주문 취소 시 전 항목 재고 복구
 */
@Service
public class OrderTransactionService {

    private static final Logger log = LoggerFactory.getLogger(OrderTransactionService.class);

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;

    public OrderTransactionService(OrderRepository orderRepository, ProductRepository productRepository) {
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
    }

    /**
     * 원자적 주문 생성
     *
     * 하나의 트랜잭션에서:
     * 1. 상품별 비관적 락 획득
     * 2. 판매 상태/재고 확인 후 차감
     * 3. 단가 스냅샷으로 주문 항목 생성
     * 4. 총액 계산 후 주문 저장
     *
     * @param lines productId → 수량 (productId 오름차순, OrderValidator에서 병합됨)
     * @throws InvalidReferenceException 존재하지 않는 상품
     * @throws com.eshop.domain.product.InactiveProductException 판매 중지 상품
     * @throws com.eshop.domain.product.InsufficientStockException 재고 부족
     */
    @Transactional(rollbackFor = Exception.class)
    @Retryable(
            retryFor = PessimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 500, random = true)
    )
    public OrderResult createOrder(Long userId, String shippingAddress, SortedMap<Long, Integer> lines) {
        List<OrderItem> items = new ArrayList<>();
        for (Map.Entry<Long, Integer> line : lines.entrySet()) {
            Long productId = line.getKey();
            int quantity = line.getValue();

            Product product = productRepository.findByIdForUpdate(productId)
                    .orElseThrow(() -> new InvalidReferenceException("product_id", productId));
            product.deductStock(quantity);
            items.add(OrderItem.createOrderItem(productId, quantity, product.getPrice()));
        }

        Order saved = orderRepository.save(Order.createOrder(userId, shippingAddress, items));
        log.info("[OrderTransactionService] 주문 생성 - orderId={}, userId={}, totalAmount={}, lines={}",
                saved.getId(), userId, saved.getTotalAmount(), items.size());
        return OrderResult.from(saved);
    }

    /**
     * 주문 상태/배송지 변경
     *
     * 권한 규칙:
     * - 본인 주문 또는 관리자만 접근
     * - 고객은 본인 주문 취소만 가능, 그 외 상태 변경은 관리자
     *
     * CANCELLED로 전환되면 같은 트랜잭션에서 재고를 복구합니다.
     */
    @Transactional(rollbackFor = Exception.class)
    @Retryable(
            retryFor = PessimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 500, random = true)
    )
    public OrderResult updateOrder(AuthUser actor, Long orderId, UpdateOrderCommand command) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        actor.ensureSelfOrAdmin(order.getUserId());

        if (command.getStatus() != null) {
            OrderStatus target = command.getStatus()
                    .orElseThrow(() -> new ValidationException("status는 null일 수 없습니다"));
            changeStatus(actor, order, target);
        }
        if (command.getShippingAddress() != null) {
            order.changeShippingAddress(command.getShippingAddress().orElse(null));
        }

        return OrderResult.from(orderRepository.save(order));
    }

    private void changeStatus(AuthUser actor, Order order, OrderStatus target) {
        OrderStatus before = order.getStatus();
        if (before == target) {
            return;
        }
        if (!actor.isAdmin() && target != OrderStatus.CANCELLED) {
            throw new ForbiddenException("고객은 주문 취소만 요청할 수 있습니다");
        }

        order.changeStatus(target);
        if (target == OrderStatus.CANCELLED) {
            restoreStock(order);
        }
        log.info("[OrderTransactionService] 주문 상태 변경 - orderId={}, {} -> {}, by userId={}",
                order.getId(), before.getValue(), target.getValue(), actor.getUserId());
    }

    private void restoreStock(Order order) {
        order.getOrderItems().stream()
                .sorted(Comparator.comparing(OrderItem::getProductId))
                .forEach(item -> {
                    Product product = productRepository.findByIdForUpdate(item.getProductId())
                            .orElseThrow(() -> new ProductNotFoundException(item.getProductId()));
                    product.restoreStock(item.getQuantity());
                });
    }
}
