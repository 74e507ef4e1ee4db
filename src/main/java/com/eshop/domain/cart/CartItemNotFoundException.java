package com.eshop.domain.cart;

import com.eshop.common.exception.DomainException;
import com.eshop.common.exception.ErrorCode;

/**
 * 장바구니에 담기지 않은 상품을 수정/삭제하려는 경우 (404)
 */
public class CartItemNotFoundException extends DomainException {

    public CartItemNotFoundException(Long userId, Long productId) {
        super(ErrorCode.CART_ITEM_NOT_FOUND, "userId=" + userId + ", productId=" + productId);
    }
}
