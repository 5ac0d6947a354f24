package com.decoadmin.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness check for the deployment platform. Readiness (DB) is served by
 * {@code /actuator/health}.
 */
@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        String status;
        try {
            HealthComponent component = healthEndpoint.health();
            status = component.getStatus().getCode();
        } catch (RuntimeException ex) {
            status = "DOWN";
        }
        return new HealthResponse(status, Instant.now(clock).toString());
    }

    public record HealthResponse(
            String status,   // "UP" | "DOWN"
            String timestamp // ISO-8601
    ) {
    }
}
