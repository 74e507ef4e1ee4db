package com.eshop.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_USER_NOT_FOUND, SYSTEM_CART_STORE_ERROR
 */
public enum ErrorCode {

    // ========== Common (4XX) ==========

    VALIDATION_ERROR("VALIDATION_ERROR", "요청 값이 유효하지 않습니다", 400),
    INVALID_REFERENCE("REFERENCE_ERROR", "참조하는 리소스가 존재하지 않습니다", 422),
    CONFLICT("CONFLICT", "데이터 충돌이 발생했습니다", 409),

    // ========== Domain Layer Errors (4XX) ==========

    // User Domain
    USER_NOT_FOUND("DOMAIN_USER_NOT_FOUND", "사용자를 찾을 수 없습니다", 404),
    DUPLICATE_EMAIL("DOMAIN_USER_DUPLICATE_EMAIL", "이미 사용 중인 이메일입니다", 409),

    // Category Domain
    CATEGORY_NOT_FOUND("DOMAIN_CATEGORY_NOT_FOUND", "카테고리를 찾을 수 없습니다", 404),

    // Product Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    PRODUCT_INACTIVE("DOMAIN_PRODUCT_INACTIVE", "판매 중지된 상품입니다", 409),
    INSUFFICIENT_STOCK("DOMAIN_PRODUCT_INSUFFICIENT_STOCK", "재고가 부족합니다", 409),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    INVALID_ORDER_STATUS_TRANSITION("DOMAIN_ORDER_INVALID_TRANSITION", "허용되지 않는 주문 상태 변경입니다", 409),

    // Cart Domain
    CART_ITEM_NOT_FOUND("DOMAIN_CART_ITEM_NOT_FOUND", "장바구니 항목을 찾을 수 없습니다", 404),

    // ========== Application Layer Errors ==========

    UNAUTHORIZED("APP_AUTH_UNAUTHORIZED", "인증이 필요합니다", 401),
    INVALID_TOKEN("APP_AUTH_INVALID_TOKEN", "유효하지 않거나 만료된 토큰입니다", 401),
    INVALID_CREDENTIALS("APP_AUTH_INVALID_CREDENTIALS", "이메일 또는 비밀번호가 올바르지 않습니다", 401),
    FORBIDDEN("APP_AUTH_FORBIDDEN", "권한이 없습니다", 403),

    // ========== System Errors (5XX) ==========

    DATABASE_ERROR("SYSTEM_DATABASE_ERROR", "데이터베이스 오류가 발생했습니다", 500),
    CART_STORE_ERROR("SYSTEM_CART_STORE_ERROR", "장바구니 저장소 오류가 발생했습니다", 500),
    LOCK_ACQUISITION_FAILED("SYSTEM_LOCK_ACQUISITION_FAILED", "요청이 몰려 처리하지 못했습니다. 잠시 후 다시 시도해주세요", 503),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
