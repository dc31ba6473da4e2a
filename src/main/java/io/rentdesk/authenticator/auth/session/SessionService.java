package io.rentdesk.authenticator.auth.session;

import com.nimbusds.jwt.JWTClaimsSet;
import io.rentdesk.authenticator.auth.AuthException;
import io.rentdesk.authenticator.auth.AuthMetrics;
import io.rentdesk.authenticator.auth.AuthProperties;
import io.rentdesk.authenticator.auth.AuthUtils;
import io.rentdesk.authenticator.auth.model.Principal;
import io.rentdesk.authenticator.auth.model.TenantSession;
import io.rentdesk.authenticator.auth.store.CredentialStore;
import io.rentdesk.authenticator.auth.token.AuthJwtService;
import io.rentdesk.authenticator.auth.token.InvalidTokenException;
import io.rentdesk.authenticator.auth.token.PrincipalClaims;
import io.rentdesk.authenticator.auth.token.TokenKind;
import io.rentdesk.authenticator.auth.token.TokenRejection;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Tenant sessions: a signed token plus a store entry that sign-out removes. */
@Service
public class SessionService {
  private static final Logger log = LoggerFactory.getLogger(SessionService.class);
  private static final String PREFIX_SESSION = "auth:session:";

  private final AuthProperties authProperties;
  private final AuthJwtService jwtService;
  private final CredentialStore store;
  private final AuthMetrics metrics;

  public SessionService(
      AuthProperties authProperties,
      AuthJwtService jwtService,
      CredentialStore store,
      AuthMetrics metrics) {
    this.authProperties = authProperties;
    this.jwtService = jwtService;
    this.store = store;
    this.metrics = metrics;
  }

  public TenantSession createSession(Principal principal) {
    long ttl = authProperties.sessionTtlSeconds();
    String token =
        jwtService.sign(TokenKind.SESSION, principal.subject(), PrincipalClaims.of(principal), ttl);
    store.set(sessionKey(token), principal.subject(), Duration.ofSeconds(ttl));
    return new TenantSession(token, principal, ttl);
  }

  /** Principal of a live session. Signed-out sessions are refused even before they expire. */
  public Principal describe(String sessionToken) {
    if (sessionToken == null || sessionToken.isBlank()) {
      metrics.sessionRejected("missing");
      throw AuthException.invalidCredentials();
    }
    if (store.get(sessionKey(sessionToken)).isEmpty()) {
      log.debug("session not found in store");
      metrics.sessionRejected("signed_out");
      throw AuthException.invalidCredentials();
    }
    try {
      JWTClaimsSet claims = jwtService.verify(sessionToken, TokenKind.SESSION);
      return PrincipalClaims.from(claims)
          .orElseThrow(() -> new InvalidTokenException(TokenRejection.UNKNOWN_SHAPE));
    } catch (InvalidTokenException e) {
      log.debug("session token rejected: {}", e.getReason());
      metrics.sessionRejected(e.getReason().name().toLowerCase(Locale.ROOT));
      throw AuthException.invalidCredentials();
    }
  }

  public void signOut(String sessionToken) {
    if (sessionToken == null || sessionToken.isBlank()) return;
    store.delete(sessionKey(sessionToken));
  }

  private static String sessionKey(String token) {
    return PREFIX_SESSION + AuthUtils.sha256Hex(token.trim());
  }
}
