package com.example.teambalancer.common;

import com.example.teambalancer.config.GenerationSettings;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final GenerationSettings settings;

    public HealthController(GenerationSettings settings) {
        this.settings = settings;
    }

    @GetMapping("/api/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        return ResponseEntity.ok(ApiResponse.success("OK", Map.of(
                "status", "UP",
                "maxAttempts", settings.getMaxAttempts(),
                "teamCountRange", settings.getMinTeams() + "-" + settings.getMaxTeams())));
    }
}
