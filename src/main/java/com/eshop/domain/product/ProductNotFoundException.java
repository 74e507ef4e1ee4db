package com.eshop.domain.product;

import com.eshop.common.exception.DomainException;
import com.eshop.common.exception.ErrorCode;

/**
 * ProductNotFoundException - 상품을 찾을 수 없을 때 발생하는 예외 (Domain 계층)
 *
 * 역할:
 * - 상품 ID로 조회했을 때 존재하지 않는 경우 발생
 * - HTTP 404 Not Found 응답으로 변환됨
 *
 * 요청 본문에서 참조한 상품이 없는 경우(주문 항목, 장바구니 추가)는
 * InvalidReferenceException(422)을 사용합니다.
 */
public class ProductNotFoundException extends DomainException {

    public ProductNotFoundException(Long productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "productId=" + productId);
    }
}
