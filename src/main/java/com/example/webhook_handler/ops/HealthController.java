package com.example.webhook_handler.ops;

import java.time.Instant;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.webhook_handler.config.WebhookProperties;

/**
 * Liveness probe. Reports whether deliveries can be handled without exposing any values.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private final WebhookProperties properties;

    public HealthController(WebhookProperties properties) {
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "secretConfigured", properties.isSecretConfigured(),
                "scriptConfigured", properties.isScriptConfigured(),
                "timestamp", Instant.now().toString()));
    }
}
