package io.rentdesk.authenticator.auth.risk;

import io.rentdesk.authenticator.auth.AuthUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/** Logs refused requests (401, 403, 429) on the authenticator routes. */
@Component
public class SecurityAuditFilter implements WebFilter {
  private static final Logger log = LoggerFactory.getLogger(SecurityAuditFilter.class);
  static final String AUTH_PATH_PREFIX = "/api/v2/authenticator";

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    String path = exchange.getRequest().getPath().value();
    if (!path.startsWith(AUTH_PATH_PREFIX)) {
      return chain.filter(exchange);
    }
    exchange.getResponse().beforeCommit(() -> Mono.fromRunnable(() -> audit(exchange, path)));
    return chain.filter(exchange);
  }

  private static void audit(ServerWebExchange exchange, String path) {
    HttpStatusCode status = exchange.getResponse().getStatusCode();
    if (status == null) return;
    int code = status.value();
    if (code != 401 && code != 403 && code != 429) return;
    log.warn(
        "security event status={} method={} path={} ip={} userAgent={}",
        code,
        exchange.getRequest().getMethod(),
        path,
        AuthUtils.resolveClientIp(exchange),
        exchange.getRequest().getHeaders().getFirst(HttpHeaders.USER_AGENT));
  }
}
