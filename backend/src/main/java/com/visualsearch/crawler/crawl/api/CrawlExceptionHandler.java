package com.visualsearch.crawler.crawl.api;

import com.visualsearch.crawler.crawl.service.CrawlJobNotFoundException;
import com.visualsearch.crawler.crawl.service.InvalidJobTransitionException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(InvalidJobTransitionException.class)
  public ResponseEntity<Map<String, String>> handleInvalidTransition(InvalidJobTransitionException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of(
            "error", "invalid_job_transition",
            "status", String.valueOf(ex.getCurrentStatus()),
            "message", ex.getMessage()));
  }

  @ExceptionHandler(CrawlJobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(CrawlJobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "job_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }
}
