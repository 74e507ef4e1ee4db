package com.eshop.domain.order;

import java.math.BigDecimal;

/**
 * OrderConstants - 주문 도메인 상수
 */
public class OrderConstants {

    // ========== Shipping Address ==========

    public static final int MIN_SHIPPING_ADDRESS_LENGTH = 10;
    public static final int MAX_SHIPPING_ADDRESS_LENGTH = 500;

    // ========== Order Item ==========

    public static final int MIN_ITEM_QUANTITY = 1;
    public static final int MAX_ITEM_QUANTITY = 1000;

    // ========== Amount ==========

    /** unit_price, subtotal, total_amount 컬럼(DECIMAL(10,2))의 최대값 */
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("99999999.99");

    // ========== Validation Messages ==========

    public static final String MSG_INVALID_SHIPPING_ADDRESS = String.format("배송지는 %d자 이상 %d자 이하여야 합니다",
            MIN_SHIPPING_ADDRESS_LENGTH, MAX_SHIPPING_ADDRESS_LENGTH);
    public static final String MSG_INVALID_QUANTITY = String.format("주문 수량은 %d 이상 %d 이하여야 합니다",
            MIN_ITEM_QUANTITY, MAX_ITEM_QUANTITY);
    public static final String MSG_EMPTY_ITEMS = "주문 항목은 1개 이상이어야 합니다";
    public static final String MSG_AMOUNT_OUT_OF_RANGE = "주문 금액은 " + MAX_AMOUNT.toPlainString() + " 이하여야 합니다";

    private OrderConstants() {
        throw new AssertionError("OrderConstants는 인스턴스화할 수 없습니다");
    }
}
