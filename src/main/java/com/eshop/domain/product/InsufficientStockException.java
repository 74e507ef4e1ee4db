package com.eshop.domain.product;

import com.eshop.common.exception.DomainException;
import com.eshop.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 주문 수량이 가용 재고를 초과한 경우 (409)
 */
@Getter
public class InsufficientStockException extends DomainException {

    private final Long productId;
    private final int requested;
    private final int available;

    public InsufficientStockException(Long productId, int requested, int available) {
        super(ErrorCode.INSUFFICIENT_STOCK,
                "productId=" + productId + " (요청: " + requested + ", 보유: " + available + ")");
        this.productId = productId;
        this.requested = requested;
        this.available = available;
    }
}
