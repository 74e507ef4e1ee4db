package com.eshop.domain.order;

import com.eshop.common.exception.DomainException;
import com.eshop.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 전환 규칙에 없는 주문 상태 변경 요청 (409)
 * 예: delivered → pending, cancelled → confirmed, 출고 후 배송지 변경
 */
@Getter
public class InvalidOrderStatusException extends DomainException {

    private final OrderStatus currentStatus;

    public InvalidOrderStatusException(Long orderId, OrderStatus currentStatus, OrderStatus targetStatus) {
        super(ErrorCode.INVALID_ORDER_STATUS_TRANSITION,
                "orderId=" + orderId + ", " + currentStatus.getValue() + " -> " + targetStatus.getValue());
        this.currentStatus = currentStatus;
    }

    public InvalidOrderStatusException(Long orderId, OrderStatus currentStatus, String reason) {
        super(ErrorCode.INVALID_ORDER_STATUS_TRANSITION,
                "orderId=" + orderId + ", status=" + currentStatus.getValue() + " (" + reason + ")");
        this.currentStatus = currentStatus;
    }
}
