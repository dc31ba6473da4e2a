package io.rentdesk.authenticator.auth.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key-value store holding refresh tokens, passcodes, sessions and abuse counters. Every entry
 * written by this service carries a native expiry.
 */
public interface CredentialStore {
  Optional<String> get(String key);

  void set(String key, String value, Duration ttl);

  /** Writes only when the key is absent; returns whether the write happened. */
  boolean setIfAbsent(String key, String value, Duration ttl);

  boolean delete(String key);

  /** Reads and removes in one step, so concurrent callers never both observe the value. */
  Optional<String> getAndDelete(String key);

  /**
   * Increments the counter at {@code key}. The first hit opens a window of length {@code window};
   * the counter disappears when the window closes.
   */
  WindowCount incrementInWindow(String key, Duration window);

  record WindowCount(long count, long secondsUntilReset) {}
}
