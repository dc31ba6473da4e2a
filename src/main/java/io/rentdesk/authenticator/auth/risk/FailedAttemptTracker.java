package io.rentdesk.authenticator.auth.risk;

import io.rentdesk.authenticator.auth.AuthProperties;
import io.rentdesk.authenticator.auth.AuthUtils;
import io.rentdesk.authenticator.auth.store.CredentialStore;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Counts failed credential checks per client and identifier and flags brute-force patterns. */
@Component
public class FailedAttemptTracker {
  private static final Logger log = LoggerFactory.getLogger(FailedAttemptTracker.class);
  private static final String PREFIX_FAILED = "auth:failed:";

  private final CredentialStore store;
  private final AuthProperties authProperties;

  public FailedAttemptTracker(CredentialStore store, AuthProperties authProperties) {
    this.store = store;
    this.authProperties = authProperties;
  }

  /** Returns the number of failures in the current window, this one included. */
  public long recordFailure(String ip, String identifier) {
    AuthProperties.RateLimit rateLimit = authProperties.getRateLimit();
    String subject =
        identifier == null || identifier.isBlank()
            ? "anonymous"
            : AuthUtils.sha256Hex(identifier.trim().toLowerCase(Locale.ROOT));
    String key = PREFIX_FAILED + AuthUtils.normalizeIp(ip) + ":" + subject;
    long count =
        store
            .incrementInWindow(key, Duration.ofSeconds(Math.max(1, rateLimit.getFailedAttemptWindowSeconds())))
            .count();
    if (count == rateLimit.getFailedAttemptThreshold()) {
      log.error(
          "possible brute force: {} failed attempts from {} for {}", count, ip, maskIdentifier(identifier));
    }
    return count;
  }

  static String maskIdentifier(String identifier) {
    if (identifier == null || identifier.isBlank()) return "-";
    String value = identifier.trim();
    int at = value.indexOf('@');
    if (at > 0) {
      return value.charAt(0) + "***" + value.substring(at);
    }
    if (value.length() <= 4) return "***";
    return "***" + value.substring(value.length() - 4);
  }
}
