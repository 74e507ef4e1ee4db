package com.eshop.domain.product;

import com.eshop.common.exception.DomainException;
import com.eshop.common.exception.ErrorCode;

/**
 * 판매 중지(is_active=false)된 상품을 주문하거나 장바구니에 담으려는 경우 (409)
 */
public class InactiveProductException extends DomainException {

    public InactiveProductException(Long productId) {
        super(ErrorCode.PRODUCT_INACTIVE, "productId=" + productId);
    }
}
