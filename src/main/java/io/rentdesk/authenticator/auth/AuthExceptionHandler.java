package io.rentdesk.authenticator.auth;

import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

@RestControllerAdvice(basePackages = "io.rentdesk.authenticator.auth")
public class AuthExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(AuthExceptionHandler.class);

  @ExceptionHandler(AuthException.class)
  public ResponseEntity<Map<String, Object>> onAuthError(AuthException e) {
    HttpHeaders headers = new HttpHeaders();
    if (e.getRetryAfterSeconds() != null && e.getRetryAfterSeconds() > 0) {
      headers.add(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
    }
    if (e.getHttpStatus() >= 500) {
      log.warn("auth request failed: {} {}", e.getCode(), e.getMessage());
    }
    return ResponseEntity.status(e.getHttpStatus()).headers(headers).body(body(e));
  }

  @ExceptionHandler({
    ConstraintViolationException.class,
    WebExchangeBindException.class,
    BindException.class
  })
  public ResponseEntity<Map<String, Object>> onValidation(Exception e) {
    return ResponseEntity.unprocessableEntity()
        .body(
            Map.of(
                "ok", false,
                "code", AuthErrorCode.VALIDATION_ERROR.name(),
                "message", "missing fields",
                "retryAfterSeconds", 0,
                "timestamp", Instant.now().toEpochMilli()));
  }

  @ExceptionHandler({ServerWebInputException.class, IllegalArgumentException.class})
  public ResponseEntity<Map<String, Object>> onBadRequest(Exception e) {
    return ResponseEntity.badRequest()
        .body(
            Map.of(
                "ok", false,
                "code", AuthErrorCode.BAD_REQUEST.name(),
                "message", "Invalid request",
                "retryAfterSeconds", 0,
                "timestamp", Instant.now().toEpochMilli()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> onUnknown(Exception e) {
    log.error("auth internal error", e);
    return ResponseEntity.status(500)
        .body(
            Map.of(
                "ok", false,
                "code", AuthErrorCode.INTERNAL_ERROR.name(),
                "message", "Internal server error",
                "retryAfterSeconds", 0,
                "timestamp", Instant.now().toEpochMilli()));
  }

  /** Response body for an {@link AuthException}; also used by controllers that answer an error directly. */
  public static Map<String, Object> body(AuthException e) {
    return Map.of(
        "ok", false,
        "code", e.getCode().name(),
        "message", e.getMessage(),
        "retryAfterSeconds", e.getRetryAfterSeconds() == null ? 0 : e.getRetryAfterSeconds(),
        "timestamp", Instant.now().toEpochMilli());
  }
}
