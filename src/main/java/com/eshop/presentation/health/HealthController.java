package com.eshop.presentation.health;

import com.eshop.config.EshopProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * HealthController - 루트/헬스 체크 (API prefix 미적용)
 */
@RestController
public class HealthController {

    private final EshopProperties properties;

    public HealthController(EshopProperties properties) {
        this.properties = properties;
    }

    /**
     * GET / - 서비스 이름
     */
    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of("message", properties.getProjectName()));
    }

    /**
     * GET /health - 고정 상태 응답
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }
}
