package com.eshop.domain.category;

import com.eshop.common.exception.DomainException;
import com.eshop.common.exception.ErrorCode;

/**
 * 카테고리를 찾을 수 없을 때 발생하는 예외 (404)
 */
public class CategoryNotFoundException extends DomainException {

    public CategoryNotFoundException(Long categoryId) {
        super(ErrorCode.CATEGORY_NOT_FOUND, "categoryId=" + categoryId);
    }
}
