package io.rentdesk.authenticator.client;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.rentdesk.authenticator.auth.AuthProperties;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Timeout, bounded retry and circuit breaker shared by every outbound call. Only transport errors,
 * timeouts and 5xx answers are retried.
 */
@Component
public class UpstreamCalls {
  private final CircuitBreakerRegistry circuitBreakerRegistry;
  private final AuthProperties authProperties;

  public UpstreamCalls(CircuitBreakerRegistry circuitBreakerRegistry, AuthProperties authProperties) {
    this.circuitBreakerRegistry = circuitBreakerRegistry;
    this.authProperties = authProperties;
  }

  /** Blocks for the result; {@code null} when the call completed empty. */
  public <T> T call(String breakerName, Mono<T> request) {
    AuthProperties.Delivery delivery = authProperties.getDelivery();
    CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(breakerName);
    return request
        .timeout(Duration.ofMillis(Math.max(1, delivery.getTimeoutMillis())))
        .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
        .retryWhen(
            Retry.backoff(
                    Math.max(0, delivery.getMaxRetries()),
                    Duration.ofMillis(Math.max(1, delivery.getRetryBackoffMillis())))
                .filter(UpstreamCalls::isTransient)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
        .block();
  }

  static boolean isTransient(Throwable error) {
    if (error instanceof TimeoutException || error instanceof WebClientRequestException) {
      return true;
    }
    return error instanceof WebClientResponseException response
        && response.getStatusCode().is5xxServerError();
  }

  static String normalizeBaseUrl(String value) {
    if (value == null) return "";
    String trimmed = value.trim();
    while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
    return trimmed;
  }
}
