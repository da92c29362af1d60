package com.delta.jobharvester.harvest.api;

import com.delta.jobharvester.harvest.service.TaskNotFoundException;
import com.delta.jobharvester.harvest.service.TaskSubmissionException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class HarvestExceptionHandler {

  @ExceptionHandler(TaskSubmissionException.class)
  public ResponseEntity<Map<String, Object>> handleSubmission(TaskSubmissionException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "submission_failed", "message", ex.getMessage(), "taskId", ex.getTaskId()));
  }

  @ExceptionHandler(TaskNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(TaskNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "task_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.badRequest()
        .body(Map.of("error", "invalid_request", "message", String.valueOf(ex.getMessage())));
  }
}
