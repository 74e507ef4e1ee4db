package com.eshop.domain.product;

import java.math.BigDecimal;

/**
 * ProductConstants - 상품 도메인 상수
 */
public class ProductConstants {

    // ========== Name / Text ==========

    public static final int MIN_NAME_LENGTH = 1;
    public static final int MAX_NAME_LENGTH = 200;
    public static final int MAX_DESCRIPTION_LENGTH = 5000;
    public static final int MAX_IMAGE_URL_LENGTH = 500;

    // ========== Price (DECIMAL(10,2)) ==========

    public static final int PRICE_SCALE = 2;
    public static final BigDecimal MAX_PRICE_EXCLUSIVE = new BigDecimal("100000000");

    // ========== Listing ==========

    public static final int DEFAULT_LIST_LIMIT = 100;
    public static final int MAX_LIST_LIMIT = 1000;

    // ========== Validation Messages ==========

    public static final String MSG_INVALID_NAME = String.format("상품명은 %d자 이상 %d자 이하여야 합니다", MIN_NAME_LENGTH, MAX_NAME_LENGTH);
    public static final String MSG_INVALID_PRICE = "가격은 0 이상 100,000,000 미만이며 소수점 둘째 자리까지만 허용됩니다";
    public static final String MSG_INVALID_STOCK = "재고 수량은 0 이상이어야 합니다";

    private ProductConstants() {
        throw new AssertionError("ProductConstants는 인스턴스화할 수 없습니다");
    }
}
