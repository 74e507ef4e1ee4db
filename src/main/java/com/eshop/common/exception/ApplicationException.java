package com.eshop.common.exception;

/**
 * ApplicationException - 유스케이스 수준의 실패
 *
 * 사용 예:
 * - UnauthorizedException: 토큰 누락/만료, 로그인 실패
 * - ForbiddenException: 권한 없는 리소스 접근
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ApplicationException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
