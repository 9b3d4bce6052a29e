package com.courtcapture.capture.api;

import com.courtcapture.capture.service.ActiveScheduleRunException;
import com.courtcapture.capture.service.ScheduleNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class CaptureExceptionHandler {

  @ExceptionHandler(ScheduleNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(ScheduleNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "schedule_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(ActiveScheduleRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveScheduleRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_schedule_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<Map<String, String>> handleStatus(ResponseStatusException ex) {
    String error = ex.getStatusCode().value() == 404 ? "not_found" : "bad_request";
    return ResponseEntity.status(ex.getStatusCode())
        .body(Map.of("error", error, "message", String.valueOf(ex.getReason())));
  }
}
