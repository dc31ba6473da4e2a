package io.rentdesk.authenticator.auth.risk;

import io.rentdesk.authenticator.auth.AuthProperties;
import java.time.Duration;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Holds back the outcome of issuance routes until a minimum duration has elapsed, so known and
 * unknown identifiers answer in the same time.
 */
@Component
public class ResponsePadding {
  private final AuthProperties authProperties;

  public ResponsePadding(AuthProperties authProperties) {
    this.authProperties = authProperties;
  }

  public <T> Mono<T> pad(Mono<T> action) {
    long minimum = authProperties.getMinIssuanceResponseMillis();
    if (minimum <= 0) return action;
    return Mono.defer(
        () -> {
          long started = System.nanoTime();
          return action
              .materialize()
              .flatMap(
                  signal -> {
                    long elapsed = (System.nanoTime() - started) / 1_000_000L;
                    long wait = minimum - elapsed;
                    return wait > 0
                        ? Mono.just(signal).delayElement(Duration.ofMillis(wait))
                        : Mono.just(signal);
                  })
              .<T>dematerialize();
        });
  }
}
