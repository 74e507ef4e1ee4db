package com.eshop.presentation.common;

import com.eshop.common.exception.BizException;
import com.eshop.common.exception.ErrorCode;
import com.eshop.common.exception.SystemException;
import com.eshop.presentation.common.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AuthenticationTrustResolver;
import org.springframework.security.authentication.AuthenticationTrustResolverImpl;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 에러 응답 형식:
 * {
 *   "error_code": "DOMAIN_PRODUCT_NOT_FOUND",
 *   "error_message": "상품을 찾을 수 없습니다 | productId=1",
 *   "timestamp": "2025-11-07T12:34:56.000Z",
 *   "request_id": "req-abc123def456"
 * }
 *
 * HTTP 상태 코드 매핑:
 * - BizException: ErrorCode의 상태 코드 (400/401/403/404/409/422/5xx)
 * - @PreAuthorize 거부: 미인증이면 401, 인증되었으면 403
 * - 요청 본문/파라미터 형식 오류: 400 VALIDATION_ERROR
 * - 유니크 제약 위반: 409 CONFLICT
 * - 그 외: 500 (내부 상세는 응답에 노출하지 않음)
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String BEARER_CHALLENGE = "Bearer";

    private final AuthenticationTrustResolver trustResolver = new AuthenticationTrustResolverImpl();

    @ExceptionHandler(SystemException.class)
    public ResponseEntity<ErrorResponse> handleSystemException(SystemException e) {
        logger.error("[GlobalExceptionHandler] 시스템 오류 - code={}", e.getErrorCodeValue(), e);
        ErrorCode errorCode = e.getErrorCode();
        return ResponseEntity.status(errorCode.getStatusCode())
                .body(ErrorResponse.of(errorCode.getCode(), errorCode.getMessage()));
    }

    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e) {
        logger.debug("[GlobalExceptionHandler] 비즈니스 예외 - code={}, message={}", e.getErrorCodeValue(), e.getMessage());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(e.getStatusCode());
        if (e.getStatusCode() == HttpStatus.UNAUTHORIZED.value()) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE);
        }
        return builder.body(ErrorResponse.of(e.getErrorCodeValue(), e.getMessage()));
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthenticationException(AuthenticationException e) {
        return unauthorized();
    }

    /**
     * 메서드 보안(@PreAuthorize) 거부
     * 컨트롤러 안에서 발생하므로 필터 체인의 AccessDeniedHandler까지 전달되지 않습니다.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException e) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || trustResolver.isAnonymous(authentication)) {
            return unauthorized();
        }
        logger.debug("[GlobalExceptionHandler] 권한 없음 - principal={}", authentication.getPrincipal());
        ErrorCode errorCode = ErrorCode.FORBIDDEN;
        return ResponseEntity.status(errorCode.getStatusCode())
                .body(ErrorResponse.of(errorCode.getCode(), errorCode.getMessage()));
    }

    /**
     * JSON 파싱 실패, 타입 불일치, 알 수 없는 enum 값 (400)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleNotReadable(HttpMessageNotReadableException e) {
        logger.debug("[GlobalExceptionHandler] 요청 본문 해석 실패", e);
        return validationError("요청 본문을 해석할 수 없습니다");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return validationError(e.getName() + " 값의 형식이 올바르지 않습니다");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        return validationError(e.getParameterName() + "는 필수입니다");
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        return validationError(e.getHeaderName() + " 헤더는 필수입니다");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(ErrorResponse.of("METHOD_NOT_ALLOWED", "지원하지 않는 메서드입니다: " + e.getMethod()));
    }

    /**
     * 서비스 사전 검사를 통과한 뒤 동시 요청으로 제약 위반이 난 경우 (409)
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolation(DataIntegrityViolationException e) {
        logger.warn("[GlobalExceptionHandler] 제약 조건 위반", e);
        ErrorCode errorCode = ErrorCode.CONFLICT;
        return ResponseEntity.status(errorCode.getStatusCode())
                .body(ErrorResponse.of(errorCode.getCode(), errorCode.getMessage()));
    }

    /**
     * 행 락 대기 시간 초과, 데드락 (503)
     */
    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handlePessimisticLockingFailure(PessimisticLockingFailureException e) {
        logger.warn("[GlobalExceptionHandler] 행 락 획득 실패", e);
        ErrorCode errorCode = ErrorCode.LOCK_ACQUISITION_FAILED;
        return ResponseEntity.status(errorCode.getStatusCode())
                .body(ErrorResponse.of(errorCode.getCode(), errorCode.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException e) {
        logger.error("[GlobalExceptionHandler] 데이터베이스 오류", e);
        ErrorCode errorCode = ErrorCode.DATABASE_ERROR;
        return ResponseEntity.status(errorCode.getStatusCode())
                .body(ErrorResponse.of(errorCode.getCode(), errorCode.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logger.error("Unhandled exception occurred: ", e);
        ErrorCode errorCode = ErrorCode.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(errorCode.getStatusCode())
                .body(ErrorResponse.of(errorCode.getCode(), errorCode.getMessage()));
    }

    private static ResponseEntity<ErrorResponse> unauthorized() {
        ErrorCode errorCode = ErrorCode.UNAUTHORIZED;
        return ResponseEntity.status(errorCode.getStatusCode())
                .header(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE)
                .body(ErrorResponse.of(errorCode.getCode(), errorCode.getMessage()));
    }

    private static ResponseEntity<ErrorResponse> validationError(String detail) {
        ErrorCode errorCode = ErrorCode.VALIDATION_ERROR;
        return ResponseEntity.status(errorCode.getStatusCode())
                .body(ErrorResponse.of(errorCode.getCode(), errorCode.getMessage() + " | " + detail));
    }
}
