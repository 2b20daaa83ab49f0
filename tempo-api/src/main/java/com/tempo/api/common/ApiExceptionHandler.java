package com.tempo.api.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tempo.domain.auth.DuplicateEmailException;
import com.tempo.domain.auth.InvalidCredentialsException;
import com.tempo.domain.auth.OwnershipViolationException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to fixed statuses with a {"detail": ...} body.
 *
 * Request-shape problems use the 422 envelope {"status_code": 10422, "message": ..., "data": null}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final int VALIDATION_STATUS_CODE = 10422;

  /**
   * Bad bearer tokens never reach MVC: the security filter chain answers them through
   * BearerAuthenticationEntryPoint. Only the login form ends up here.
   */
  @ExceptionHandler(InvalidCredentialsException.class)
  public ResponseEntity<Map<String, Object>> unauthorized(InvalidCredentialsException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
        .body(detail(ex.getMessage()));
  }

  @ExceptionHandler(DuplicateEmailException.class)
  public ResponseEntity<Map<String, Object>> duplicateEmail(DuplicateEmailException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(detail(ex.getMessage()));
  }

  @ExceptionHandler(OwnershipViolationException.class)
  public ResponseEntity<Map<String, Object>> forbidden(OwnershipViolationException ex) {
    log.warn("[OWNER] denied userId={} ownerId={}", ex.userId(), ex.ownerId());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(detail(ex.getMessage()));
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(ResourceNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(detail(ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    String message = ex.getBindingResult().getFieldErrors().stream()
        .map(fe -> fe.getField() + ": " + (fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage()))
        .collect(Collectors.joining("; "));
    return unprocessable(message.isEmpty() ? "invalid_request" : message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
    return unprocessable(ex.getMessage());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Map<String, Object>> missingParameter(MissingServletRequestParameterException ex) {
    return unprocessable(ex.getParameterName() + ": field required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<Map<String, Object>> typeMismatch(MethodArgumentTypeMismatchException ex) {
    return unprocessable(ex.getName() + ": invalid value");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
    String cause = ex.getMostSpecificCause().getMessage();
    return unprocessable(cause == null ? "Malformed request body" : cause.replace('\n', ' '));
  }

  @ExceptionHandler(JsonProcessingException.class)
  public ResponseEntity<Map<String, Object>> unreadable(JsonProcessingException ex) {
    String cause = ex.getOriginalMessage();
    return unprocessable(cause == null ? "Malformed request body" : cause.replace('\n', ' '));
  }

  /**
   * Framework errors that already know their status (405, 415, unknown path) keep it;
   * anything else is an unexpected fault.
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> unexpected(Exception ex) {
    if (ex instanceof ErrorResponse er) {
      String reason = er.getBody().getDetail();
      return ResponseEntity.status(er.getStatusCode()).body(detail(reason == null ? ex.getMessage() : reason));
    }
    log.error("Unhandled request failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(detail("Internal server error"));
  }

  private static ResponseEntity<Map<String, Object>> unprocessable(String message) {
    log.error("Request validation failed: {}", message);
    // HashMap: Map.of rejects the null data value
    Map<String, Object> body = new HashMap<>();
    body.put("status_code", VALIDATION_STATUS_CODE);
    body.put("message", message);
    body.put("data", null);
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
  }

  private static Map<String, Object> detail(String message) {
    return Map.of("detail", message == null ? "error" : message);
  }
}
