package com.eshop.domain.user;

import com.eshop.common.exception.DomainException;
import com.eshop.common.exception.ErrorCode;

/**
 * 사용자를 찾을 수 없을 때 발생하는 예외 (404)
 */
public class UserNotFoundException extends DomainException {

    public UserNotFoundException(Long userId) {
        super(ErrorCode.USER_NOT_FOUND, "userId=" + userId);
    }
}
