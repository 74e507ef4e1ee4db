package com.eshop.domain.cart;

/**
 * CartConstants - 장바구니 도메인 상수
 *
 * 역할:
 * - 장바구니 항목 수량 검증 규칙
 */
public class CartConstants {

    // ========== Cart Item Quantity Constants ==========

    /** 장바구니 항목 최소 수량 */
    public static final int MIN_CART_QUANTITY = 1;

    /** 장바구니 항목 최대 수량 (누적 포함) */
    public static final int MAX_CART_QUANTITY = 1000;

    /** 장바구니에 담을 수 있는 서로 다른 상품 수 */
    public static final int MAX_CART_LINES = 100;

    // ========== Cart Validation Messages ==========

    public static final String MSG_INVALID_CART_QUANTITY = String.format("장바구니 수량은 %d~%d 범위여야 합니다", MIN_CART_QUANTITY, MAX_CART_QUANTITY);
    public static final String MSG_CART_FULL = String.format("장바구니에는 최대 %d종류의 상품만 담을 수 있습니다", MAX_CART_LINES);

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
