package com.eshop.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 비즈니스 도메인의 규칙 위반 시 발생
 * - 유효성 검증, 참조 무결성, 상태 전이 오류 등
 * - 일반적으로 클라이언트 오류(4XX)로 응답
 *
 * 사용 예:
 * - ProductNotFoundException: 상품 조회 실패
 * - InsufficientStockException: 재고 부족
 * - InvalidOrderStatusException: 허용되지 않는 주문 상태 변경
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public DomainException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
