package com.delta.propertytracker.crawl.api;

import com.delta.propertytracker.crawl.service.ActiveCrawlRunException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(ActiveCrawlRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveCrawlRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_crawl_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<Map<String, String>> handleRejected(ResponseStatusException ex) {
    String reason = ex.getReason() == null ? "" : ex.getReason();
    return ResponseEntity.status(ex.getStatusCode())
        .body(Map.of("error", "invalid_request", "message", reason));
  }
}
