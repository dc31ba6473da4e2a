package io.rentdesk.authenticator.auth.risk;

import io.rentdesk.authenticator.auth.AuthUtils;
import java.time.Duration;
import java.util.concurrent.Callable;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs a route action behind its {@link RouteGuard}. The slow-down wait is a timer, not a blocked
 * thread; the action itself runs on the bounded elastic scheduler.
 */
@Component
public class AbuseGuard {
  public static final String HEADER_LIMIT = "RateLimit-Limit";
  public static final String HEADER_REMAINING = "RateLimit-Remaining";
  public static final String HEADER_DELAY = "X-RateLimit-Delay";
  public static final String HEADER_WARNING = "X-RateLimit-Warning";

  private final AbuseMitigationService abuseMitigation;

  public AbuseGuard(AbuseMitigationService abuseMitigation) {
    this.abuseMitigation = abuseMitigation;
  }

  public <T> Mono<T> protect(
      RouteGuard guard, ServerWebExchange exchange, String identifier, Callable<T> action) {
    String ip = AuthUtils.resolveClientIp(exchange);
    return Mono.fromCallable(() -> abuseMitigation.admit(guard, ip, identifier))
        .subscribeOn(Schedulers.boundedElastic())
        .flatMap(
            admission -> {
              HttpHeaders headers = exchange.getResponse().getHeaders();
              if (admission.hasQuota()) {
                headers.set(HEADER_LIMIT, String.valueOf(admission.limit()));
                headers.set(HEADER_REMAINING, String.valueOf(Math.max(0, admission.remaining())));
                if (admission.remaining() > 0 && admission.remaining() <= 2) {
                  headers.set(HEADER_WARNING, "only " + admission.remaining() + " attempts remaining");
                }
              }
              Mono<T> run = Mono.fromCallable(action).subscribeOn(Schedulers.boundedElastic());
              if (admission.delayMillis() <= 0) return run;
              headers.set(HEADER_DELAY, String.valueOf(admission.delayMillis()));
              return Mono.delay(Duration.ofMillis(admission.delayMillis())).then(run);
            });
  }
}
