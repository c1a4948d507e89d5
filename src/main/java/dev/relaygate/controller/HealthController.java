package dev.relaygate.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probe endpoints for load balancers and orchestrators. Liveness never touches
 * dependencies; readiness fails with 503 when the datastore is unreachable.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final Clock clock;

    public HealthController(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @GetMapping
    public Map<String, Object> health() {
        return Map.of("status", "healthy", "timestamp", clock.instant());
    }

    @GetMapping("/live")
    public Map<String, Object> live() {
        return Map.of("status", "alive", "timestamp", clock.instant());
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        boolean database = databaseReachable();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", database ? "ready" : "not_ready");
        body.put("checks", Map.of("database", database ? "up" : "down"));
        body.put("timestamp", clock.instant());
        return ResponseEntity.status(database ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Readiness check failed: {}", e.getMessage());
            return false;
        }
    }
}
