package com.flagship.invoice_followup.health;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import com.flagship.invoice_followup.outbox.OutboxService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated liveness/readiness probe. Reports the database and, informationally,
 * the outbox backlog and whether the follow-up scheduler runs on this instance.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final OutboxService outboxService;
    private final Clock clock;
    private final boolean schedulerEnabled;

    public HealthController(DataSource dataSource,
                            OutboxService outboxService,
                            Clock clock,
                            @Value("${followup.scheduler.enabled:true}") boolean schedulerEnabled) {
        this.dataSource = dataSource;
        this.outboxService = outboxService;
        this.clock = clock;
        this.schedulerEnabled = schedulerEnabled;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("scheduler", schedulerEnabled ? "ENABLED" : "DISABLED");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        response.put("outboxBacklog", outboxService.countUnpublished());
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
