package com.eshop.infrastructure.lock;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * Redisson 분산락 어노테이션
 *
 * 사용 예:
 * <pre>
 * &#64;DistributedLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
 * public CartResult addItem(Long userId, ...) { ... }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLock {

    /**
     * 락 키 (Spring EL, 파라미터는 #p0, #p1 ...)
     */
    String key();

    /**
     * 락 획득 대기 시간
     */
    long waitTime() default 5;

    /**
     * 락 점유 시간 (초과 시 자동 해제)
     */
    long leaseTime() default 3;

    TimeUnit timeUnit() default TimeUnit.SECONDS;
}
