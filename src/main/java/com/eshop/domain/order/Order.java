package com.eshop.domain.order;

import com.eshop.common.exception.ValidationException;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 주문 항목 소유 (삭제 시 항목도 함께 삭제)
 * - 총액 계산 (total_amount = Σ subtotal)
 * - 상태 전환 규칙 적용
 *
 * 핵심 비즈니스 규칙:
 * - 생성 시 상태는 항상 PENDING
 * - 주문 항목은 생성 후 변경 불가
 * - 변경 가능한 값은 status, shipping_address 뿐
 * - 배송지는 출고 전(PENDING, CONFIRMED)에만 변경 가능
 */
@Entity
@Table(name = "orders", indexes = @Index(name = "idx_orders_user_id", columnList = "user_id"))
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Convert(converter = OrderStatusConverter.class)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Column(name = "shipping_address", nullable = false, length = OrderConstants.MAX_SHIPPING_ADDRESS_LENGTH)
    private String shippingAddress;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    @OrderBy("id ASC")
    @Builder.Default
    private List<OrderItem> orderItems = new ArrayList<>();

    /**
     * 주문 생성 팩토리 메서드
     *
     * @param items 재고 차감과 가격 스냅샷이 끝난 주문 항목
     */
    public static Order createOrder(Long userId, String shippingAddress, List<OrderItem> items) {
        if (userId == null) {
            throw new ValidationException("user_id는 필수입니다");
        }
        if (items == null || items.isEmpty()) {
            throw new ValidationException(OrderConstants.MSG_EMPTY_ITEMS);
        }
        Order order = Order.builder()
                .userId(userId)
                .shippingAddress(validateShippingAddress(shippingAddress))
                .status(OrderStatus.PENDING)
                .createdAt(LocalDateTime.now())
                .build();
        order.orderItems.addAll(items);
        order.totalAmount = calculateTotal(items);
        return order;
    }

    public List<OrderItem> getOrderItems() {
        return Collections.unmodifiableList(orderItems);
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId != null && this.userId.equals(userId);
    }

    /**
     * 상태 변경
     *
     * @return 실제로 상태가 바뀌었으면 true, 현재 상태와 같아 변화가 없으면 false
     * @throws InvalidOrderStatusException 전환 규칙에 없는 변경
     */
    public boolean changeStatus(OrderStatus target) {
        if (target == null) {
            throw new ValidationException("status는 null일 수 없습니다");
        }
        if (this.status == target) {
            return false;
        }
        if (!this.status.canTransitionTo(target)) {
            throw new InvalidOrderStatusException(this.id, this.status, target);
        }
        this.status = target;
        touch();
        return true;
    }

    public void changeShippingAddress(String shippingAddress) {
        String validated = validateShippingAddress(shippingAddress);
        if (!this.status.isShippingAddressEditable()) {
            throw new InvalidOrderStatusException(this.id, this.status, "배송지 변경 불가");
        }
        this.shippingAddress = validated;
        touch();
    }

    private static BigDecimal calculateTotal(List<OrderItem> items) {
        BigDecimal total = items.stream()
                .map(OrderItem::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        if (total.compareTo(OrderConstants.MAX_AMOUNT) > 0) {
            throw new ValidationException(OrderConstants.MSG_AMOUNT_OUT_OF_RANGE);
        }
        return total;
    }

    private static String validateShippingAddress(String shippingAddress) {
        if (shippingAddress == null) {
            throw new ValidationException(OrderConstants.MSG_INVALID_SHIPPING_ADDRESS);
        }
        String trimmed = shippingAddress.trim();
        if (trimmed.length() < OrderConstants.MIN_SHIPPING_ADDRESS_LENGTH
                || trimmed.length() > OrderConstants.MAX_SHIPPING_ADDRESS_LENGTH) {
            throw new ValidationException(OrderConstants.MSG_INVALID_SHIPPING_ADDRESS);
        }
        return trimmed;
    }

    private void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
