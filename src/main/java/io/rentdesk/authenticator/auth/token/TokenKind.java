package io.rentdesk.authenticator.auth.token;

/** Token families. Each is signed with the secret of its {@link SigningKey}. */
public enum TokenKind {
  ACCESS("access", SigningKey.ACCESS),
  SESSION("session", SigningKey.ACCESS),
  REFRESH("refresh", SigningKey.REFRESH),
  RESET("reset", SigningKey.RESET),
  APP_CREDENTIALS("app_credentials", SigningKey.APP_CREDENTIALS);

  private final String code;
  private final SigningKey signingKey;

  TokenKind(String code, SigningKey signingKey) {
    this.code = code;
    this.signingKey = signingKey;
  }

  public String code() {
    return code;
  }

  public SigningKey signingKey() {
    return signingKey;
  }

  public enum SigningKey {
    ACCESS,
    REFRESH,
    RESET,
    APP_CREDENTIALS
  }
}
