package com.openonco.discovery.pipeline.api;

import com.openonco.discovery.pipeline.persistence.PersistenceException;
import com.openonco.discovery.pipeline.service.DiscoveryNotFoundException;
import com.openonco.discovery.pipeline.service.UnknownSourceException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PipelineExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

  @ExceptionHandler(UnknownSourceException.class)
  public ResponseEntity<Map<String, String>> handleUnknownSource(UnknownSourceException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "unknown_source", "message", ex.getMessage()));
  }

  @ExceptionHandler(DiscoveryNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleMissingDiscovery(DiscoveryNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "discovery_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(PersistenceException.class)
  public ResponseEntity<Map<String, String>> handlePersistence(PersistenceException ex) {
    log.error("Storage failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "storage_failure", "message", ex.getMessage()));
  }
}
