package com.signaldesk.pipeline.api;

import com.signaldesk.pipeline.scheduler.JobAlreadyRunningException;
import com.signaldesk.pipeline.scheduler.UnknownJobException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SchedulerExceptionHandler {

  @ExceptionHandler(UnknownJobException.class)
  public ResponseEntity<Map<String, String>> handleUnknownJob(UnknownJobException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "unknown_job", "message", ex.getMessage()));
  }

  @ExceptionHandler(JobAlreadyRunningException.class)
  public ResponseEntity<Map<String, String>> handleAlreadyRunning(JobAlreadyRunningException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "job_already_running", "message", ex.getMessage()));
  }
}
