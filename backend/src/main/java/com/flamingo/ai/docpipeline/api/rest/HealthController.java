package com.flamingo.ai.docpipeline.api.rest;

import com.flamingo.ai.docpipeline.domain.enums.DocumentStatus;
import com.flamingo.ai.docpipeline.service.document.DocumentStateStore;
import com.flamingo.ai.docpipeline.storage.StorageBackend;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and system info. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final DocumentStateStore stateStore;
  private final StorageBackend storageBackend;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "docpipeline");
    health.put("storage", storageBackend.name());
    return ResponseEntity.ok(health);
  }

  /** Returns document counts per status. */
  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    Map<DocumentStatus, Long> byStatus = new EnumMap<>(DocumentStatus.class);
    for (DocumentStatus status : DocumentStatus.values()) {
      byStatus.put(status, stateStore.countByStatus(status));
    }
    Map<String, Object> stats = new HashMap<>();
    stats.put("totalDocuments", stateStore.countActive());
    stats.put("documentsByStatus", byStatus);
    stats.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(stats);
  }
}
