package io.rentdesk.authenticator.auth.store;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local store for a single instance (local development, tests). Counters kept here are not
 * shared between instances, so rate limits weaken when the service is scaled out.
 */
@Component
@ConditionalOnProperty(name = "app.auth.store", havingValue = "memory")
public class InMemoryCredentialStore implements CredentialStore {
  static final long SWEEP_INTERVAL_MILLIS = 60_000;

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();
  private final AtomicLong lastSweep = new AtomicLong();
  private final Clock clock;

  public InMemoryCredentialStore(Clock clock) {
    this.clock = clock;
    this.lastSweep.set(clock.millis());
  }

  @Override
  public Optional<String> get(String key) {
    if (key == null) return Optional.empty();
    return Optional.ofNullable(live(key)).map(Entry::value);
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    sweepExpired();
    entries.put(key, new Entry(value, expiry(ttl)));
  }

  @Override
  public boolean setIfAbsent(String key, String value, Duration ttl) {
    sweepExpired();
    AtomicReference<Boolean> written = new AtomicReference<>(false);
    entries.compute(
        key,
        (k, current) -> {
          if (current != null && !current.isExpired(now())) return current;
          written.set(true);
          return new Entry(value, expiry(ttl));
        });
    return written.get();
  }

  @Override
  public boolean delete(String key) {
    if (key == null) return false;
    Entry removed = entries.remove(key);
    return removed != null && !removed.isExpired(now());
  }

  @Override
  public Optional<String> getAndDelete(String key) {
    if (key == null) return Optional.empty();
    Entry removed = entries.remove(key);
    if (removed == null || removed.isExpired(now())) return Optional.empty();
    return Optional.of(removed.value());
  }

  @Override
  public WindowCount incrementInWindow(String key, Duration window) {
    sweepExpired();
    long now = now();
    Entry updated =
        entries.compute(
            key,
            (k, current) -> {
              if (current == null || current.isExpired(now)) {
                return new Entry("1", expiry(window));
              }
              long next = Long.parseLong(current.value()) + 1;
              return new Entry(String.valueOf(next), current.expiresAt());
            });
    long remainingMillis = updated.expiresAt() - now;
    return new WindowCount(
        Long.parseLong(updated.value()), Math.max(1L, (remainingMillis + 999) / 1000));
  }

  int size() {
    return entries.size();
  }

  /** Drops lapsed entries, at most once per sweep interval. */
  private void sweepExpired() {
    long now = now();
    long previous = lastSweep.get();
    if (now - previous < SWEEP_INTERVAL_MILLIS || !lastSweep.compareAndSet(previous, now)) return;
    entries.values().removeIf(entry -> entry.isExpired(now));
  }

  private Entry live(String key) {
    Entry entry = entries.get(key);
    if (entry == null) return null;
    if (entry.isExpired(now())) {
      entries.remove(key, entry);
      return null;
    }
    return entry;
  }

  private long expiry(Duration ttl) {
    long millis = ttl == null || ttl.isNegative() || ttl.isZero() ? 1_000 : ttl.toMillis();
    return now() + millis;
  }

  private long now() {
    return clock.millis();
  }

  private record Entry(String value, long expiresAt) {
    boolean isExpired(long now) {
      return now >= expiresAt;
    }
  }
}
