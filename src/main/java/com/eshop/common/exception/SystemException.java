package com.eshop.common.exception;

/**
 * SystemException - 시스템 오류 (DB, Redis, 분산락 등)
 *
 * 클라이언트에는 내부 상세 정보 없이 ErrorCode의 메시지만 노출됩니다.
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
