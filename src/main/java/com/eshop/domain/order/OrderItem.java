package com.eshop.domain.order;

import com.eshop.common.exception.ValidationException;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * OrderItem 도메인 엔티티
 *
 * 비즈니스 규칙:
 * - unit_price는 주문 시점 상품 가격의 스냅샷 (이후 상품 가격 변경과 무관)
 * - subtotal = unit_price × quantity
 * - 주문 생성 후에는 변경 불가
 */
@Entity
@Table(name = "order_items")
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "subtotal", nullable = false, precision = 10, scale = 2)
    private BigDecimal subtotal;

    /**
     * 주문 항목 생성 팩토리 메서드
     */
    public static OrderItem createOrderItem(Long productId, int quantity, BigDecimal unitPrice) {
        if (productId == null) {
            throw new ValidationException("product_id는 필수입니다");
        }
        if (quantity < OrderConstants.MIN_ITEM_QUANTITY || quantity > OrderConstants.MAX_ITEM_QUANTITY) {
            throw new ValidationException(OrderConstants.MSG_INVALID_QUANTITY);
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new ValidationException("단가는 0 이상이어야 합니다");
        }
        BigDecimal normalizedPrice = unitPrice.setScale(2, RoundingMode.HALF_UP);
        BigDecimal subtotal = normalizedPrice.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP);
        if (subtotal.compareTo(OrderConstants.MAX_AMOUNT) > 0) {
            throw new ValidationException(OrderConstants.MSG_AMOUNT_OUT_OF_RANGE);
        }
        return OrderItem.builder()
                .productId(productId)
                .quantity(quantity)
                .unitPrice(normalizedPrice)
                .subtotal(subtotal)
                .build();
    }
}
