package io.rentdesk.authenticator.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.rentdesk.authenticator.auth.AuthProperties;
import io.rentdesk.authenticator.support.AuthFixtures;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

class UpstreamCallsTest {
  private AuthProperties properties;
  private UpstreamCalls calls;

  @BeforeEach
  void setUp() {
    properties = AuthFixtures.properties();
    calls = new UpstreamCalls(CircuitBreakerRegistry.ofDefaults(), properties);
  }

  @Test
  void retriesTransportErrorsOnce() {
    AtomicInteger attempts = new AtomicInteger();
    Mono<String> flaky =
        Mono.defer(
            () ->
                attempts.incrementAndGet() == 1
                    ? Mono.error(connectionReset())
                    : Mono.just("ok"));

    assertEquals("ok", calls.call("test", flaky));
    assertEquals(2, attempts.get());
  }

  @Test
  void clientErrorsAreNotRetried() {
    AtomicInteger attempts = new AtomicInteger();
    Mono<String> rejected =
        Mono.defer(
            () -> {
              attempts.incrementAndGet();
              return Mono.error(status(400));
            });

    assertThatThrownBy(() -> calls.call("test", rejected)).isInstanceOf(WebClientResponseException.class);
    assertEquals(1, attempts.get());
  }

  @Test
  void slowCallsTimeOut() {
    properties.getDelivery().setTimeoutMillis(20);
    properties.getDelivery().setMaxRetries(0);

    assertThatThrownBy(() -> calls.call("test", Mono.never())).isInstanceOf(RuntimeException.class);
  }

  @Test
  void openCircuitFailsFast() {
    CircuitBreakerRegistry registry =
        CircuitBreakerRegistry.of(
            CircuitBreakerConfig.custom().slidingWindowSize(2).minimumNumberOfCalls(2).build());
    UpstreamCalls guarded = new UpstreamCalls(registry, properties);
    properties.getDelivery().setMaxRetries(0);
    AtomicInteger attempts = new AtomicInteger();
    Mono<String> failing =
        Mono.defer(
            () -> {
              attempts.incrementAndGet();
              return Mono.error(connectionReset());
            });

    assertThatThrownBy(() -> guarded.call("emailer", failing)).isInstanceOf(WebClientRequestException.class);
    assertThatThrownBy(() -> guarded.call("emailer", failing)).isInstanceOf(WebClientRequestException.class);
    assertThatThrownBy(() -> guarded.call("emailer", failing)).isInstanceOf(CallNotPermittedException.class);
    assertEquals(2, attempts.get());
  }

  @Test
  void transientErrorClassification() {
    assertThat(UpstreamCalls.isTransient(new TimeoutException())).isTrue();
    assertThat(UpstreamCalls.isTransient(connectionReset())).isTrue();
    assertThat(UpstreamCalls.isTransient(status(503))).isTrue();
    assertThat(UpstreamCalls.isTransient(status(404))).isFalse();
    assertThat(UpstreamCalls.isTransient(new IllegalStateException())).isFalse();
  }

  @Test
  void normalizesBaseUrls() {
    assertEquals("http://emailer", UpstreamCalls.normalizeBaseUrl(" http://emailer// "));
    assertEquals("", UpstreamCalls.normalizeBaseUrl(null));
  }

  private static WebClientResponseException status(int code) {
    return WebClientResponseException.create(code, "status " + code, new HttpHeaders(), new byte[0], null);
  }

  private static WebClientRequestException connectionReset() {
    return new WebClientRequestException(
        new IOException("connection reset"), HttpMethod.POST, URI.create("http://emailer/otp"), new HttpHeaders());
  }
}
