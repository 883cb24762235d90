package com.xbleey.marketreport.controller;

import com.xbleey.marketreport.config.MarkerStoreProperties;
import com.xbleey.marketreport.enums.MarkerStoreType;
import com.xbleey.marketreport.schedule.ReportSchedulerLoop;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/health")
public class HealthController {

    private static final int CONNECTION_TIMEOUT_SECONDS = 2;

    private final Clock clock;
    private final ReportSchedulerLoop schedulerLoop;
    private final MarkerStoreProperties markerProperties;
    @Nullable
    private final DataSource dataSource;
    @Nullable
    private final RedisConnectionFactory redisConnectionFactory;

    public HealthController(
            Clock clock,
            ReportSchedulerLoop schedulerLoop,
            MarkerStoreProperties markerProperties,
            @Nullable DataSource dataSource,
            @Nullable RedisConnectionFactory redisConnectionFactory
    ) {
        this.clock = clock;
        this.schedulerLoop = schedulerLoop;
        this.markerProperties = markerProperties;
        this.dataSource = dataSource;
        this.redisConnectionFactory = redisConnectionFactory;
    }

    @GetMapping("/live")
    public Map<String, Object> liveness() {
        return Map.of(
                "status", "UP",
                "timestamp", Instant.now(clock).toString()
        );
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        return readiness();
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> readiness() {
        Map<String, Map<String, Object>> checks = new LinkedHashMap<>();
        boolean ready = checkScheduler(checks);
        ready &= checkMarkerStore(checks);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", ready ? "UP" : "DOWN");
        body.put("timestamp", Instant.now(clock).toString());
        body.put("checks", checks);

        if (ready) {
            return ResponseEntity.ok(body);
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean checkScheduler(Map<String, Map<String, Object>> checks) {
        Map<String, Object> check = new LinkedHashMap<>();
        Instant lastTickAt = schedulerLoop.getLastTickAt();
        String lastTickError = schedulerLoop.getLastTickError();
        check.put("running", schedulerLoop.isRunning());
        check.put("lastTickAt", lastTickAt == null ? "-" : lastTickAt.toString());
        if (lastTickError != null) {
            check.put("status", "DOWN");
            check.put("message", lastTickError);
            checks.put("scheduler", check);
            return false;
        }
        check.put("status", schedulerLoop.isRunning() ? "UP" : "STOPPED");
        checks.put("scheduler", check);
        return true;
    }

    private boolean checkMarkerStore(Map<String, Map<String, Object>> checks) {
        MarkerStoreType store = markerProperties.getStore();
        return switch (store) {
            case FILE -> checkMarkerDirectory(checks);
            case DATABASE -> checkDatabase(checks);
            case REDIS -> checkRedis(checks);
        };
    }

    private boolean checkMarkerDirectory(Map<String, Map<String, Object>> checks) {
        Path directory = markerProperties.getDirectory();
        if (!Files.exists(directory)) {
            // created on first write
            checks.put("markerStore", Map.of("status", "UP", "store", "file", "message", "not created yet"));
            return true;
        }
        if (Files.isDirectory(directory) && Files.isWritable(directory)) {
            checks.put("markerStore", Map.of("status", "UP", "store", "file"));
            return true;
        }
        checks.put("markerStore", Map.of(
                "status", "DOWN",
                "store", "file",
                "message", "Not a writable directory: " + directory
        ));
        return false;
    }

    private boolean checkDatabase(Map<String, Map<String, Object>> checks) {
        if (dataSource == null) {
            checks.put("database", Map.of("status", "DOWN", "message", "No DataSource configured"));
            return false;
        }
        try (Connection connection = dataSource.getConnection()) {
            if (connection.isValid(CONNECTION_TIMEOUT_SECONDS)) {
                checks.put("database", Map.of("status", "UP"));
                return true;
            }
            checks.put("database", Map.of(
                    "status", "DOWN",
                    "message", "Connection validation returned false"
            ));
            return false;
        } catch (Exception ex) {
            checks.put("database", Map.of(
                    "status", "DOWN",
                    "message", ex.getClass().getSimpleName() + ": " + messageOrDefault(ex.getMessage())
            ));
            return false;
        }
    }

    private boolean checkRedis(Map<String, Map<String, Object>> checks) {
        if (redisConnectionFactory == null) {
            checks.put("redis", Map.of("status", "DOWN", "message", "No Redis connection factory"));
            return false;
        }
        try (RedisConnection connection = redisConnectionFactory.getConnection()) {
            String ping = connection.ping();
            if ("PONG".equalsIgnoreCase(ping)) {
                checks.put("redis", Map.of("status", "UP"));
                return true;
            }
            checks.put("redis", Map.of(
                    "status", "DOWN",
                    "message", "Unexpected ping response: " + messageOrDefault(ping)
            ));
            return false;
        } catch (Exception ex) {
            checks.put("redis", Map.of(
                    "status", "DOWN",
                    "message", ex.getClass().getSimpleName() + ": " + messageOrDefault(ex.getMessage())
            ));
            return false;
        }
    }

    private String messageOrDefault(String message) {
        if (message == null || message.isBlank()) {
            return "-";
        }
        return message;
    }
}
