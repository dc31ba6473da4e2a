package io.rentdesk.authenticator.auth.token;

public class InvalidTokenException extends RuntimeException {
  private final TokenRejection reason;

  public InvalidTokenException(TokenRejection reason) {
    super("token rejected: " + reason.name().toLowerCase(java.util.Locale.ROOT));
    this.reason = reason;
  }

  public TokenRejection getReason() {
    return reason;
  }
}
