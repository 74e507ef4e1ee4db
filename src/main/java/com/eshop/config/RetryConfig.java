package com.eshop.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * RetryConfig - Spring Retry 설정 클래스
 *
 * 역할:
 * - @Retryable 어노테이션 활성화
 *
 * 사용처:
 * - OrderTransactionService: 비관적 락 대기 시간 초과, 데드락 발생 시 주문 생성/상태 변경 재시도
 */
@Configuration
@EnableRetry
public class RetryConfig {
}
