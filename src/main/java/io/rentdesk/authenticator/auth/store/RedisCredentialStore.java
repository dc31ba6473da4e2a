package io.rentdesk.authenticator.auth.store;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.auth.store", havingValue = "redis", matchIfMissing = true)
public class RedisCredentialStore implements CredentialStore {
  private final StringRedisTemplate redis;

  public RedisCredentialStore(StringRedisTemplate redis) {
    this.redis = redis;
  }

  @Override
  public Optional<String> get(String key) {
    if (key == null || key.isBlank()) return Optional.empty();
    return Optional.ofNullable(redis.opsForValue().get(key));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    redis.opsForValue().set(key, value, positive(ttl));
  }

  @Override
  public boolean setIfAbsent(String key, String value, Duration ttl) {
    Boolean ok = redis.opsForValue().setIfAbsent(key, value, positive(ttl));
    return Boolean.TRUE.equals(ok);
  }

  @Override
  public boolean delete(String key) {
    if (key == null || key.isBlank()) return false;
    return Boolean.TRUE.equals(redis.delete(key));
  }

  @Override
  public Optional<String> getAndDelete(String key) {
    if (key == null || key.isBlank()) return Optional.empty();
    // GETDEL, Redis 6.2+
    return Optional.ofNullable(redis.opsForValue().getAndDelete(key));
  }

  @Override
  public WindowCount incrementInWindow(String key, Duration window) {
    Duration w = positive(window);
    Long count = redis.opsForValue().increment(key);
    if (count != null && count == 1L) {
      redis.expire(key, w);
    }
    Long ttl = redis.getExpire(key, TimeUnit.SECONDS);
    if (ttl == null || ttl < 0) {
      // the expire after the first hit never landed; reopen the window rather than count forever
      redis.expire(key, w);
      ttl = w.getSeconds();
    }
    return new WindowCount(count == null ? 1L : count, Math.max(1L, ttl));
  }

  private static Duration positive(Duration ttl) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) return Duration.ofSeconds(1);
    return ttl;
  }
}
