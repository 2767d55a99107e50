package com.harvest.jobcrawler.crawl.api;

import com.harvest.jobcrawler.crawl.service.ActiveCrawlRunException;
import com.harvest.jobcrawler.crawl.service.UnknownSourceException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(ActiveCrawlRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveCrawlRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_crawl_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(UnknownSourceException.class)
  public ResponseEntity<Map<String, String>> handleUnknownSource(UnknownSourceException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "unknown_source", "message", ex.getMessage()));
  }
}
