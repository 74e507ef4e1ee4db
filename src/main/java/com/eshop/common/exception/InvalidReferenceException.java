package com.eshop.common.exception;

/**
 * 외래 키(category_id, parent_id, product_id 등)가 존재하지 않는 행을 가리키는 경우 (422)
 *
 * 경로 변수로 직접 조회한 리소스가 없으면 *NotFoundException(404)을,
 * 요청 본문이 참조하는 리소스가 없으면 이 예외를 사용합니다.
 */
public class InvalidReferenceException extends DomainException {

    public InvalidReferenceException(String field, Long id) {
        super(ErrorCode.INVALID_REFERENCE, field + "=" + id);
    }
}
