package com.eshop.common.exception;

/**
 * 인증은 되었지만 요청한 작업에 대한 권한이 없는 경우 (403)
 */
public class ForbiddenException extends ApplicationException {

    public ForbiddenException() {
        super(ErrorCode.FORBIDDEN);
    }

    public ForbiddenException(String detailMessage) {
        super(ErrorCode.FORBIDDEN, detailMessage);
    }
}
