package com.telelink.scoring.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;

/**
 * Maps pipeline failures onto HTTP responses for the scoring API.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(RecordValidationException.class)
  public ResponseEntity<ErrorResponse> handleInvalidRecord(RecordValidationException ex) {
    log.warn("Rejected customer record: {} violation(s) on {}", ex.getViolations().size(), ex.getViolations().keySet());
    ErrorResponse body = new ErrorResponse(Instant.now(), HttpStatus.BAD_REQUEST.value(),
        "Validation Failed", "Customer record failed validation", ex.getViolations());
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableInput(ServerWebInputException ex) {
    log.warn("Unreadable scoring request: {}", ex.getReason());
    return ResponseEntity.badRequest()
        .body(ErrorResponse.of(HttpStatus.BAD_REQUEST.value(), "Malformed Request", ex.getReason()));
  }

  @ExceptionHandler(InferenceException.class)
  public ResponseEntity<ErrorResponse> handleInferenceFailure(InferenceException ex) {
    log.error("Model inference failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR.value(), "Prediction Error", ex.getMessage()));
  }

  @ExceptionHandler(ScoringException.class)
  public ResponseEntity<ErrorResponse> handleScoringFailure(ScoringException ex) {
    log.error("Scoring failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR.value(), "Scoring Error", ex.getMessage()));
  }
}
