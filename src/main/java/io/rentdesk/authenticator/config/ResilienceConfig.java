package io.rentdesk.authenticator.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.rentdesk.authenticator.auth.AuthProperties;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Circuit breakers for the emailer, WhatsApp and platform API calls. */
@Configuration
public class ResilienceConfig {
  private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

  @Bean
  public CircuitBreakerRegistry circuitBreakerRegistry(AuthProperties authProperties) {
    AuthProperties.Delivery delivery = authProperties.getDelivery();
    int window = Math.max(1, delivery.getSlidingWindowSize());
    CircuitBreakerConfig config =
        CircuitBreakerConfig.custom()
            .failureRateThreshold(delivery.getFailureRateThreshold())
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(window)
            .minimumNumberOfCalls(Math.min(window, 5))
            .permittedNumberOfCallsInHalfOpenState(2)
            .waitDurationInOpenState(Duration.ofSeconds(Math.max(1, delivery.getOpenStateSeconds())))
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
    CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
    registry
        .getEventPublisher()
        .onEntryAdded(
            added ->
                added
                    .getAddedEntry()
                    .getEventPublisher()
                    .onStateTransition(
                        event ->
                            log.warn(
                                "circuit breaker {} {}",
                                event.getCircuitBreakerName(),
                                event.getStateTransition())));
    return registry;
  }
}
