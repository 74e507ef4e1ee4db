package com.eshop.infrastructure.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 설정 (분산 락)
 *
 * Redisson은 spring.data.redis 설정을 자동으로 사용하지 않으므로,
 * application.yml의 spring.data.redis 값을 읽어 RedissonClient Bean을 직접 구성합니다.
 *
 * 용도:
 * - 장바구니 수정 직렬화 (lock:cart:{userId})
 */
@Configuration
public class RedissonConfig {

    @Value("${spring.data.redis.host}")
    private String host;

    @Value("${spring.data.redis.port}")
    private int port;

    @Value("${spring.data.redis.database:0}")
    private int database;

    @Value("${spring.data.redis.timeout:3000ms}")
    private String timeout;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();
        config.useSingleServer()
                .setAddress("redis://" + host + ":" + port)
                .setDatabase(database)
                .setTimeout(parseTimeout(timeout))
                .setConnectionPoolSize(16)
                .setConnectionMinimumIdleSize(4);

        return Redisson.create(config);
    }

    /**
     * timeout 문자열 파싱 (2000ms → 2000, 3s → 3000)
     */
    static int parseTimeout(String timeout) {
        String value = timeout.trim();
        if (value.endsWith("ms")) {
            return Integer.parseInt(value.substring(0, value.length() - 2));
        }
        if (value.endsWith("s")) {
            return Integer.parseInt(value.substring(0, value.length() - 1)) * 1000;
        }
        return Integer.parseInt(value);
    }
}
