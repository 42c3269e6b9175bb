package com.gpuopt.api.common;

import com.gpuopt.domain.DomainException;
import com.gpuopt.domain.ErrorKind;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static HttpStatus statusOf(ErrorKind kind) {
    return switch (kind) {
      case VALIDATION -> HttpStatus.BAD_REQUEST;
      case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
      case FORBIDDEN -> HttpStatus.FORBIDDEN;
      case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
      case NOT_FOUND -> HttpStatus.NOT_FOUND;
      case DUPLICATE_CUSTOMER, INVALID_STATE_TRANSITION -> HttpStatus.CONFLICT;
      case STORAGE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
    };
  }

  @ExceptionHandler(DomainException.class)
  public ResponseEntity<Map<String, Object>> domain(DomainException ex) {
    HttpStatus status = statusOf(ex.kind());
    if (status.is5xxServerError()) {
      log.error("Request failed: {}", ex.getMessage(), ex);
    } else {
      log.debug("Request rejected: reason={} message={}", ex.reason(), ex.getMessage());
    }
    return error(status, ex.reason(), ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage() == null ? "invalid_request" : ex.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", "Malformed request body");
  }

  @ExceptionHandler({MissingServletRequestParameterException.class, MissingRequestHeaderException.class})
  public ResponseEntity<Map<String, Object>> missing(Exception ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new HashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
        "status", "error",
        "reason", ErrorKind.VALIDATION.reason(),
        "message", "invalid_request",
        "fields", fields,
        "ts", Instant.now().toString()
    ));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
    return error(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION.reason(),
        ex.getMessage() == null ? "invalid_request" : ex.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> unexpected(Exception ex) {
    if (ex instanceof ErrorResponse er && er.getStatusCode().is4xxClientError()) {
      return error(HttpStatus.valueOf(er.getStatusCode().value()), "bad_request", ex.getMessage());
    }
    log.error("Unhandled error", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
  }

  public static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
    return ResponseEntity.status(status).body(Map.of(
        "status", "error",
        "reason", reason,
        "message", message == null ? "" : message,
        "ts", Instant.now().toString()
    ));
  }
}
