package com.syrup.shared.controller;

import com.syrup.shared.config.AppConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 探活端點：純回應、無業務邏輯、無副作用
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final AppConfig appConfig;

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of(
                "name", appConfig.getName(),
                "version", appConfig.getVersion(),
                "status", "running"));
    }

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
