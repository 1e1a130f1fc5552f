package com.delta.urlscout.crawl.api;

import com.delta.urlscout.crawl.service.ActiveDiscoveryRunException;
import com.delta.urlscout.crawl.service.DiscoveryConfigurationException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class DiscoveryExceptionHandler {

  @ExceptionHandler(ActiveDiscoveryRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveDiscoveryRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_discovery_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(DiscoveryConfigurationException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(DiscoveryConfigurationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_discovery_request", "message", ex.getMessage()));
  }
}
