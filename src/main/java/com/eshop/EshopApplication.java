package com.eshop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * ESHOP API 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAspectJAutoProxy: 분산락 Aspect 자동 프록시 생성
 * - @ConfigurationPropertiesScan: eshop.* 설정 바인딩
 *
 * 사용자 인증은 JWT 필터가 담당하므로 기본 인메모리 사용자(UserDetailsService)는 만들지 않습니다.
 *
 * 재시도(@EnableRetry)는 RetryConfig에서 활성화합니다.
 */
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class EshopApplication {

    public static void main(String[] args) {
        SpringApplication.run(EshopApplication.class, args);
    }

}
