package com.eshop.infrastructure.lock;

import com.eshop.common.exception.ErrorCode;
import com.eshop.common.exception.SystemException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.core.Ordered;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 분산락 AOP 처리
 *
 * 실행 순서:
 * 1. 락 획득 (@Transactional보다 먼저 실행)
 * 2. 메서드 실행
 * 3. 트랜잭션이 있으면 완료(커밋/롤백) 후 해제, 없으면 finally에서 해제
 *
 * 락 획득 실패(대기 시간 초과) 시 SystemException(LOCK_ACQUISITION_FAILED)
 */
@Aspect
@Component
@Slf4j
@RequiredArgsConstructor
public class DistributedLockAop implements Ordered {

    private final RedissonClient redissonClient;
    private final ExpressionParser expressionParser = new SpelExpressionParser();

    @Around("@annotation(distributedLock)")
    public Object around(ProceedingJoinPoint joinPoint, DistributedLock distributedLock) throws Throwable {
        String lockKey = generateKey(joinPoint, distributedLock.key());
        RLock rLock = redissonClient.getLock(lockKey);

        boolean lockAcquired = false;
        boolean releaseOnCompletion = false;
        try {
            lockAcquired = rLock.tryLock(distributedLock.waitTime(), distributedLock.leaseTime(), distributedLock.timeUnit());
            if (!lockAcquired) {
                log.warn("[DistributedLock] 락 획득 실패 - key={}", lockKey);
                throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED);
            }
            log.debug("[DistributedLock] 락 획득 - key={}", lockKey);

            if (TransactionSynchronizationManager.isSynchronizationActive()) {
                TransactionSynchronizationManager.registerSynchronization(new LockReleaseSynchronization(rLock, lockKey));
                releaseOnCompletion = true;
            }
            return joinPoint.proceed();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[DistributedLock] 락 대기 중 인터럽트 - key={}", lockKey, e);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, e);

        } finally {
            if (lockAcquired && !releaseOnCompletion) {
                unlock(rLock, lockKey);
            }
        }
    }

    private static void unlock(RLock rLock, String lockKey) {
        try {
            if (rLock.isHeldByCurrentThread()) {
                rLock.unlock();
                log.debug("[DistributedLock] 락 해제 - key={}", lockKey);
            }
        } catch (IllegalMonitorStateException e) {
            // leaseTime 초과로 이미 만료된 경우
            log.warn("[DistributedLock] 락 해제 실패 (이미 만료됨) - key={}", lockKey, e);
        }
    }

    /**
     * 트랜잭션 완료 후 락 해제 (커밋/롤백 모두)
     */
    private static class LockReleaseSynchronization implements TransactionSynchronization {
        private final RLock rLock;
        private final String lockKey;

        LockReleaseSynchronization(RLock rLock, String lockKey) {
            this.rLock = rLock;
            this.lockKey = lockKey;
        }

        @Override
        public void afterCompletion(int status) {
            unlock(rLock, lockKey);
        }
    }

    /**
     * Spring EL로 동적 키 생성
     * 예: "'lock:cart:' + #p0" → "lock:cart:5"
     */
    private String generateKey(ProceedingJoinPoint joinPoint, String keyPattern) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Object[] args = joinPoint.getArgs();

        EvaluationContext context = new StandardEvaluationContext();
        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
        }

        String key = expressionParser.parseExpression(keyPattern).getValue(context, String.class);
        if (key == null) {
            throw new IllegalStateException("락 키를 생성할 수 없습니다: " + signature.toShortString());
        }
        return key;
    }

    /**
     * @Transactional(기본 LOWEST_PRECEDENCE)보다 먼저 실행
     */
    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE - 1000;
    }
}
