package com.flagship.gate_ledger.health;

import com.flagship.gate_ledger.observability.LedgerMetrics;
import com.flagship.gate_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health endpoint polled by the gate terminals.
 *
 * DOWN with 503 when the ledger database cannot be reached, since no scan can
 * be recorded then. The ledger figures come from the last metrics refresh, so
 * polling this endpoint costs one connection check.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final LedgerMetrics ledgerMetrics;
    private final OutboxMetrics outboxMetrics;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = isDatabaseReachable();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", databaseUp ? "UP" : "DOWN");
        body.put("database", databaseUp ? "UP" : "DOWN");
        body.put("openEntries", ledgerMetrics.getOpenEntries());
        body.put("unresolvedEntries", ledgerMetrics.getUnresolvedEntries());
        body.put("pendingEvents", outboxMetrics.getBacklogSize());
        body.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean isDatabaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Ledger database unreachable: {}", e.getMessage());
            return false;
        }
    }
}
