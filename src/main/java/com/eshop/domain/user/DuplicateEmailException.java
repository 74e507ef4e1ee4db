package com.eshop.domain.user;

import com.eshop.common.exception.DomainException;
import com.eshop.common.exception.ErrorCode;

/**
 * 이미 사용 중인 이메일로 가입/변경을 시도한 경우 (409)
 */
public class DuplicateEmailException extends DomainException {

    public DuplicateEmailException(String email) {
        super(ErrorCode.DUPLICATE_EMAIL, "email=" + email);
    }

    public DuplicateEmailException(String email, Throwable cause) {
        super(ErrorCode.DUPLICATE_EMAIL, "email=" + email, cause);
    }
}
