package io.rentdesk.authenticator.auth;

public class AuthException extends RuntimeException {
  private final AuthErrorCode code;
  private final int httpStatus;
  private final Integer retryAfterSeconds;

  public AuthException(AuthErrorCode code, String message, int httpStatus) {
    this(code, message, httpStatus, null);
  }

  public AuthException(AuthErrorCode code, String message, int httpStatus, Integer retryAfterSeconds) {
    super(message);
    this.code = code;
    this.httpStatus = httpStatus;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public static AuthException invalidCredentials() {
    return new AuthException(AuthErrorCode.INVALID_CREDENTIALS, "invalid credentials", 401);
  }

  public static AuthException invalidCredentials(int httpStatus) {
    return new AuthException(AuthErrorCode.INVALID_CREDENTIALS, "invalid credentials", httpStatus);
  }

  public static AuthException missingFields() {
    return new AuthException(AuthErrorCode.VALIDATION_ERROR, "missing fields", 422);
  }

  public static AuthException validation(String message) {
    return new AuthException(AuthErrorCode.VALIDATION_ERROR, message, 422);
  }

  public AuthErrorCode getCode() {
    return code;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  public Integer getRetryAfterSeconds() {
    return retryAfterSeconds;
  }
}
