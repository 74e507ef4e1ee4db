package com.eshop.common.exception;

/**
 * 입력 필드가 누락되었거나 형식/범위가 잘못된 경우 (400)
 */
public class ValidationException extends DomainException {

    public ValidationException(String detailMessage) {
        super(ErrorCode.VALIDATION_ERROR, detailMessage);
    }
}
