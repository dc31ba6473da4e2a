package io.rentdesk.authenticator.auth.risk;

import io.rentdesk.authenticator.auth.AuthErrorCode;
import io.rentdesk.authenticator.auth.AuthException;
import io.rentdesk.authenticator.auth.AuthMetrics;
import io.rentdesk.authenticator.auth.AuthProperties;
import io.rentdesk.authenticator.auth.AuthUtils;
import io.rentdesk.authenticator.auth.store.CredentialStore;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fixed-window rate limits and progressive slow-down. Counters live in the shared store so every
 * instance sees the same budget.
 */
@Service
public class AbuseMitigationService {
  private static final Logger log = LoggerFactory.getLogger(AbuseMitigationService.class);
  private static final String PREFIX_RATE_LIMIT = "auth:rl:";
  private static final String PREFIX_SLOW_DOWN = "auth:sd:";

  private final CredentialStore store;
  private final AuthProperties authProperties;
  private final AuthMetrics metrics;

  public AbuseMitigationService(
      CredentialStore store, AuthProperties authProperties, AuthMetrics metrics) {
    this.store = store;
    this.authProperties = authProperties;
    this.metrics = metrics;
  }

  /**
   * Counts the request against every rule of {@code guard}: IP rules first, then slow-down, then
   * identifier rules.
   *
   * @throws AuthException {@code RATE_LIMITED} with the seconds left in the exceeded window
   */
  public Admission admit(RouteGuard guard, String ip, String identifier) {
    String clientIp = AuthUtils.normalizeIp(ip);
    int limit = -1;
    int remaining = Integer.MAX_VALUE;
    long delayMillis = 0;

    if (authProperties.getRateLimit().isEnabled()) {
      for (String name : guard.ipRules()) {
        int left = check(name, clientIp, identifier);
        if (left < remaining) {
          remaining = left;
          limit = authProperties.getRateLimit().rule(name).getMaxHits();
        }
      }
    }
    if (guard.slowDown()) {
      delayMillis = slowDown(clientIp);
    }
    if (authProperties.getRateLimit().isEnabled()) {
      for (String name : guard.identifierRules()) {
        int left = check(name, clientIp, identifier);
        if (left < remaining) {
          remaining = left;
          limit = authProperties.getRateLimit().rule(name).getMaxHits();
        }
      }
    }
    return limit < 0 ? new Admission(delayMillis, -1, -1) : new Admission(delayMillis, limit, remaining);
  }

  /** Counter key for a rule. Identifiers are hashed so no e-mail or phone lands in the store. */
  static String scopeKey(AuthProperties.Scope scope, String ip, String identifier) {
    String base = ip == null || ip.isBlank() ? "unknown" : ip;
    if (scope == AuthProperties.Scope.IP || identifier == null || identifier.isBlank()) {
      return base;
    }
    return base + ":" + AuthUtils.sha256Hex(identifier.trim().toLowerCase(Locale.ROOT));
  }

  private int check(String name, String ip, String identifier) {
    AuthProperties.Rule rule = authProperties.getRateLimit().rule(name);
    int windowSeconds = Math.max(1, rule.getWindowSeconds());
    int maxHits = Math.max(1, rule.getMaxHits());
    String key = PREFIX_RATE_LIMIT + name + ":" + scopeKey(rule.getScope(), ip, identifier);
    CredentialStore.WindowCount count = store.incrementInWindow(key, Duration.ofSeconds(windowSeconds));
    if (count.count() > maxHits) {
      long ttl = count.secondsUntilReset();
      int retryAfter = ttl < 1 ? windowSeconds : (int) ttl;
      metrics.rateLimited(name);
      log.warn("rate limit {} exceeded by {} ({} hits)", name, ip, count.count());
      throw new AuthException(
          AuthErrorCode.RATE_LIMITED, "too many requests, please try again later", 429, retryAfter);
    }
    return (int) (maxHits - count.count());
  }

  private long slowDown(String ip) {
    AuthProperties.SlowDown slowDown = authProperties.getSlowDown();
    if (!slowDown.isEnabled()) return 0;
    String key = PREFIX_SLOW_DOWN + (ip.isBlank() ? "unknown" : ip);
    CredentialStore.WindowCount count =
        store.incrementInWindow(key, Duration.ofSeconds(Math.max(1, slowDown.getWindowSeconds())));
    if (count.count() <= slowDown.getDelayAfter()) return 0;
    long delay = Math.min(slowDown.getMaxDelayMillis(), count.count() * slowDown.getDelayStepMillis());
    metrics.slowedDown();
    log.debug("slowing down {} by {} ms", ip, delay);
    return delay;
  }
}
