package com.eshop.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * application.yml의 eshop.* 설정 바인딩
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "eshop")
public class EshopProperties {

    private String projectName = "ESHOP API";

    private Api api = new Api();

    private Cors cors = new Cors();

    private Cart cart = new Cart();

    private Security security = new Security();

    @Getter
    @Setter
    public static class Api {
        private String prefix = "/api/v1";
    }

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000", "http://localhost"));
    }

    @Getter
    @Setter
    public static class Cart {
        /** 장바구니 만료 시간 (쓰기마다 갱신) */
        private Duration ttl = Duration.ofDays(7);
    }

    @Getter
    @Setter
    public static class Security {
        /** HS256 서명 키. 32바이트 이상 */
        private String secretKey;
        private long accessTokenExpireMinutes = 30;
        private int bcryptStrength = 10;
    }
}
