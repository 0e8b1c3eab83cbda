package com.sitecheck.api.controller;

import com.sitecheck.common.constants.QueueStatus;
import com.sitecheck.data.repository.AuditQueueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public health checks for the hosting platform and uptime monitors.
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final String SERVICE_NAME = "sitecheck-api";
    private static final Instant START_TIME = Instant.now();

    private final DataSource dataSource;
    private final AuditQueueRepository queueRepository;

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("service", SERVICE_NAME);
        return ResponseEntity.ok(response);
    }

    /**
     * Database connectivity plus queue counts. Reports DEGRADED rather than failing.
     */
    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("service", SERVICE_NAME);
        response.put("uptimeSeconds", Instant.now().getEpochSecond() - START_TIME.getEpochSecond());

        Map<String, Object> dbHealth = checkDatabaseHealth();
        response.put("database", dbHealth);

        if ("UP".equals(dbHealth.get("status"))) {
            response.put("queue", queueCounts());
        } else {
            response.put("status", "DEGRADED");
        }
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> checkDatabaseHealth() {
        Map<String, Object> dbHealth = new HashMap<>();
        long startTime = System.currentTimeMillis();

        try (Connection connection = dataSource.getConnection()) {
            boolean valid = connection.isValid(5);
            dbHealth.put("status", valid ? "UP" : "DOWN");
            dbHealth.put("responseTimeMs", System.currentTimeMillis() - startTime);
            dbHealth.put("database", connection.getMetaData().getDatabaseProductName());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            dbHealth.put("status", "DOWN");
            dbHealth.put("error", e.getMessage());
            dbHealth.put("responseTimeMs", System.currentTimeMillis() - startTime);
        }
        return dbHealth;
    }

    private Map<String, Long> queueCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (QueueStatus status : QueueStatus.values()) {
            counts.put(status.getValue(), queueRepository.countByStatus(status));
        }
        return counts;
    }
}
