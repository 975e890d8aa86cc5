package com.ospicorp.anomalyapi.web;

import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ServiceController {
  private final String cacheBackend;

  public ServiceController(@Value("${anomaly.cache.backend:local}") String cacheBackend) {
    this.cacheBackend = cacheBackend;
  }

  @GetMapping("/")
  public Map<String, Object> info() {
    return Map.of("service", "anomaly-api", "status", "ok", "cache_backend", cacheBackend);
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
