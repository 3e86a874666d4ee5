package com.flagship.practice_analytics.health;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated liveness and readiness check for load balancers.
 *
 * Only the read model decides the status. The result cache is optional and is
 * reported by the Actuator health endpoint instead.
 */
@RestController
public class HealthController {

    private final ReadModelHealthIndicator readModelHealth;
    private final Clock clock;

    public HealthController(ReadModelHealthIndicator readModelHealth, Clock clock) {
        this.readModelHealth = readModelHealth;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Health readModel = readModelHealth.health();
        boolean up = Status.UP.equals(readModel.getStatus());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", up ? "UP" : "DOWN");
        response.put("timestamp", Instant.now(clock).toString());
        response.put("database", readModel.getStatus().getCode());
        response.putAll(readModel.getDetails());

        return up
                ? ResponseEntity.ok(response)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }
}
