package io.rentdesk.authenticator.auth.risk;

/**
 * Outcome of an admitted request. {@code limit} and {@code remaining} describe the tightest rule, or
 * are negative when no rule applied.
 */
public record Admission(long delayMillis, int limit, int remaining) {
  public boolean hasQuota() {
    return limit >= 0;
  }
}
