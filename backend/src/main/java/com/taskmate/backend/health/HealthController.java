package com.taskmate.backend.health;

import java.time.Clock;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private static final String DB_COMPONENT = "db";

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    /**
     * Process is up; the database is not consulted.
     */
    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse(Status.UP.getCode(), null, Instant.now(clock).toString());
    }

    /**
     * Ready only when the datasource health indicator reports UP.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String database = databaseStatus();
        boolean ready = Status.UP.getCode().equals(database);
        HealthResponse body = new HealthResponse(
                ready ? Status.UP.getCode() : Status.DOWN.getCode(),
                ready ? "connected" : "disconnected",
                Instant.now(clock).toString()
        );
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @GetMapping("/health")
    public HealthResponse health() {
        String database = databaseStatus();
        return new HealthResponse(
                Status.UP.getCode(),
                Status.UP.getCode().equals(database) ? "connected" : "disconnected",
                Instant.now(clock).toString()
        );
    }

    private String databaseStatus() {
        try {
            HealthComponent health = healthEndpoint.health();
            if (health instanceof CompositeHealth composite) {
                HealthComponent db = composite.getComponents().get(DB_COMPONENT);
                if (db != null) {
                    return db.getStatus().getCode();
                }
            }
            return health.getStatus().getCode();
        } catch (RuntimeException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return Status.DOWN.getCode();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record HealthResponse(
            String status,
            String database,
            String timestamp
    ) {
    }
}
