package com.eshop.infrastructure.config.database;

import com.p6spy.engine.spy.P6SpyOptions;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;

/**
 * P6Spy SQL 로그 포맷 설정
 *
 * eshop.sql-log.pretty=true 일 때 바인딩 값이 채워진 SQL을 Hibernate 포매터로 줄바꿈하여 출력합니다.
 * (local 프로필 기본값 true)
 */
@Configuration
@ConditionalOnProperty(name = "eshop.sql-log.pretty", havingValue = "true")
public class P6SpyConfig {

    @PostConstruct
    public void setLogMessageFormat() {
        P6SpyOptions.getActiveInstance().setLogMessageFormat(P6SpyPrettySqlFormatter.class.getName());
    }
}
