package io.rentdesk.authenticator.auth;

public enum AuthErrorCode {
  BAD_REQUEST,
  VALIDATION_ERROR,
  INVALID_CREDENTIALS,
  FORBIDDEN,
  RATE_LIMITED,
  DELIVERY_FAILED,
  FEATURE_DISABLED,
  UPSTREAM_UNAVAILABLE,
  INTERNAL_ERROR
}
