package com.gpuopt.api.health;

import com.gpuopt.infrastructure.db.PoolStats;
import com.gpuopt.infrastructure.db.ResourcePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Instant;
import java.util.Map;

@RestController
public class HealthController {

  private static final Logger log = LoggerFactory.getLogger(HealthController.class);
  static final String VERSION = "1.0.0";

  private final ResourcePool pool;

  public HealthController(ResourcePool pool) {
    this.pool = pool;
  }

  @GetMapping("/api/health")
  public ResponseEntity<Map<String, Object>> health() {
    try {
      boolean dbOk = pool.withConnection(c -> {
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT 1")) {
          return rs.next() && rs.getInt(1) == 1;
        }
      });
      PoolStats stats = pool.stats();
      return ResponseEntity.ok(Map.of(
          "status", dbOk ? "healthy" : "unhealthy",
          "service", "gpuopt-api",
          "version", VERSION,
          "timestamp", Instant.now().toString(),
          "services", Map.of("database", dbOk ? "healthy" : "unhealthy", "api", "healthy"),
          "pool", Map.of("size", stats.poolSize(), "idle", stats.idle(), "ephemeral_opened", stats.ephemeralOpened())
      ));
    } catch (RuntimeException e) {
      log.error("Health check failed", e);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
          "status", "unhealthy",
          "error", String.valueOf(e.getMessage()),
          "timestamp", Instant.now().toString()
      ));
    }
  }
}
