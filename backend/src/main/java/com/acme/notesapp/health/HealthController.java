package com.acme.notesapp.health;

import com.acme.notesapp.config.NotesProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
public class HealthController {
    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final JdbcTemplate jdbc;
    private final NotesProperties properties;

    public HealthController(JdbcTemplate jdbc, NotesProperties properties) {
        this.jdbc = jdbc;
        this.properties = properties;
    }

    @GetMapping("/health")
    public HealthDtos.LivenessResponse liveness() {
        return new HealthDtos.LivenessResponse("ok", Instant.now(), properties.version());
    }

    @GetMapping("/api/health/db")
    public ResponseEntity<HealthDtos.DatabaseResponse> database() {
        try {
            jdbc.queryForObject("SELECT 1", Integer.class);
            return ResponseEntity.ok(new HealthDtos.DatabaseResponse("ok", "connected", null));
        } catch (DataAccessException e) {
            log.warn("Database probe failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new HealthDtos.DatabaseResponse("error", "disconnected", e.getMessage()));
        }
    }
}
