package io.rentdesk.authenticator.auth.session;

import com.nimbusds.jwt.JWTClaimsSet;
import io.rentdesk.authenticator.auth.AuthException;
import io.rentdesk.authenticator.auth.AuthMetrics;
import io.rentdesk.authenticator.auth.model.Principal;
import io.rentdesk.authenticator.auth.token.AuthJwtService;
import io.rentdesk.authenticator.auth.token.InvalidTokenException;
import io.rentdesk.authenticator.auth.token.PrincipalClaims;
import io.rentdesk.authenticator.auth.token.TokenKind;
import io.rentdesk.authenticator.auth.token.TokenRejection;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the caller of a protected route. The bearer header wins over the {@code sessionToken}
 * cookie; any rejection is reported as {@code INVALID_CREDENTIALS}.
 */
@Component
public class SessionValidator {
  private static final Logger log = LoggerFactory.getLogger(SessionValidator.class);
  private static final String BEARER = "Bearer ";

  private final AuthJwtService jwtService;
  private final AuthMetrics metrics;

  public SessionValidator(AuthJwtService jwtService, AuthMetrics metrics) {
    this.jwtService = jwtService;
    this.metrics = metrics;
  }

  public Principal resolve(String authorizationHeader, String cookieToken) {
    String token = bearerToken(authorizationHeader);
    if (token == null) token = cookieToken;
    try {
      JWTClaimsSet claims = jwtService.verify(token, TokenKind.ACCESS, TokenKind.SESSION);
      return PrincipalClaims.from(claims)
          .orElseThrow(() -> new InvalidTokenException(TokenRejection.UNKNOWN_SHAPE));
    } catch (InvalidTokenException e) {
      log.debug("request token rejected: {}", e.getReason());
      metrics.sessionRejected(e.getReason().name().toLowerCase(Locale.ROOT));
      throw AuthException.invalidCredentials();
    }
  }

  static String bearerToken(String header) {
    if (header == null) return null;
    String value = header.trim();
    if (value.length() <= BEARER.length()) return null;
    if (!value.regionMatches(true, 0, BEARER, 0, BEARER.length())) return null;
    String token = value.substring(BEARER.length()).trim();
    return token.isEmpty() ? null : token;
  }
}
