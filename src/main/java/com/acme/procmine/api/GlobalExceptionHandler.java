package com.acme.procmine.api;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    Map<String, String> details = new LinkedHashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) details.put(fe.getField(), fe.getDefaultMessage());
    log.warn("Rejected analysis request: {}", details);
    return badRequest("Validation Failed", "Request validation failed", details);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ErrorResponse> handleConstraint(ConstraintViolationException ex) {
    Map<String, String> details = new LinkedHashMap<>();
    ex.getConstraintViolations().forEach(v -> details.put(v.getPropertyPath().toString(), v.getMessage()));
    log.warn("Rejected analysis request: {}", details);
    return badRequest("Validation Failed", "Request validation failed", details);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    Throwable root = ex.getMostSpecificCause();
    log.warn("Unreadable analysis request: {}", root.getMessage());
    return badRequest("Malformed Request", root.getMessage(), Map.of());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid analysis input: {}", ex.getMessage());
    return badRequest("Invalid Input", ex.getMessage(), Map.of());
  }

  private static ResponseEntity<ErrorResponse> badRequest(String error, String message, Map<String, String> details) {
    return ResponseEntity.badRequest()
        .body(new ErrorResponse(Instant.now(), HttpStatus.BAD_REQUEST.value(), error, message, details));
  }
}
