package com.eshop.infrastructure.config.web;

import com.eshop.config.EshopProperties;
import com.eshop.presentation.health.HealthController;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.config.annotation.PathMatchConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * AppConfig - API 전역 설정
 *
 * - 리소스 컨트롤러에 eshop.api.prefix(/api/v1) 추가 (헬스 체크 제외)
 *
 * CORS와 인증은 SecurityConfig에서 설정합니다.
 */
@Configuration
public class AppConfig implements WebMvcConfigurer {

    private final EshopProperties properties;

    public AppConfig(EshopProperties properties) {
        this.properties = properties;
    }

    @Override
    public void configurePathMatch(PathMatchConfigurer configurer) {
        configurer.addPathPrefix(properties.getApi().getPrefix(),
                c -> c.isAnnotationPresent(RestController.class) && !HealthController.class.equals(c));
    }
}
