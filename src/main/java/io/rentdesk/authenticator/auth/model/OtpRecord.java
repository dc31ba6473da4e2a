package io.rentdesk.authenticator.auth.model;

/** Pending passcode. Timestamps are epoch milliseconds. */
public record OtpRecord(
    String code, long createdAt, long expiresAt, OtpChannel channel, String recipient) {

  public boolean isExpired(long nowMillis) {
    return nowMillis > expiresAt;
  }
}
