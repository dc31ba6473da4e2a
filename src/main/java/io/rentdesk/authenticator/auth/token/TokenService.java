package io.rentdesk.authenticator.auth.token;

import com.nimbusds.jwt.JWTClaimsSet;
import io.rentdesk.authenticator.auth.AuthErrorCode;
import io.rentdesk.authenticator.auth.AuthException;
import io.rentdesk.authenticator.auth.AuthMetrics;
import io.rentdesk.authenticator.auth.AuthProperties;
import io.rentdesk.authenticator.auth.AuthUtils;
import io.rentdesk.authenticator.auth.directory.OrganizationDirectory;
import io.rentdesk.authenticator.auth.directory.OrganizationRecord;
import io.rentdesk.authenticator.auth.model.ApplicationCredentials;
import io.rentdesk.authenticator.auth.model.MachineToken;
import io.rentdesk.authenticator.auth.model.Principal;
import io.rentdesk.authenticator.auth.model.PrincipalKind;
import io.rentdesk.authenticator.auth.model.Role;
import io.rentdesk.authenticator.auth.model.TokenPair;
import io.rentdesk.authenticator.auth.store.CredentialStore;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Issues, rotates and revokes landlord token pairs, machine-client access tokens and password-reset
 * tokens. Every refusal leaves this class as one {@code INVALID_CREDENTIALS} condition; the reason is
 * only logged.
 */
@Service
public class TokenService {
  private static final Logger log = LoggerFactory.getLogger(TokenService.class);
  private static final String PREFIX_REFRESH = "auth:refresh:";
  private static final String PREFIX_RESET = "auth:reset:";

  private final AuthProperties authProperties;
  private final AuthJwtService jwtService;
  private final CredentialStore store;
  private final OrganizationDirectory organizations;
  private final PasswordEncoder passwordEncoder;
  private final AuthMetrics metrics;
  private final Clock clock;

  public TokenService(
      AuthProperties authProperties,
      AuthJwtService jwtService,
      CredentialStore store,
      OrganizationDirectory organizations,
      PasswordEncoder passwordEncoder,
      AuthMetrics metrics,
      Clock clock) {
    this.authProperties = authProperties;
    this.jwtService = jwtService;
    this.store = store;
    this.organizations = organizations;
    this.passwordEncoder = passwordEncoder;
    this.metrics = metrics;
    this.clock = clock;
  }

  public TokenPair issue(Principal principal) {
    long accessTtl = authProperties.getTokens().getAccessTtlSeconds();
    long refreshTtl = authProperties.refreshTokenTtlSeconds();
    Map<String, Object> claims = PrincipalClaims.of(principal);
    String accessToken = jwtService.sign(TokenKind.ACCESS, principal.subject(), claims, accessTtl);
    String refreshToken = jwtService.sign(TokenKind.REFRESH, principal.subject(), claims, refreshTtl);
    store.set(refreshKey(refreshToken), accessToken, Duration.ofSeconds(refreshTtl));
    return new TokenPair(accessToken, refreshToken, accessTtl, refreshTtl);
  }

  /**
   * Exchanges a refresh token for a new pair. The presented token is removed from the store whether
   * or not it verifies, so it can be used at most once.
   */
  public Optional<TokenPair> rotate(String refreshToken) {
    if (refreshToken == null || refreshToken.isBlank()) return Optional.empty();
    if (store.getAndDelete(refreshKey(refreshToken)).isEmpty()) {
      log.info("refresh token not found in store");
      metrics.refreshRejected("not_found");
      return Optional.empty();
    }
    Principal principal;
    try {
      JWTClaimsSet claims = jwtService.verify(refreshToken, TokenKind.REFRESH);
      principal = PrincipalClaims.from(claims).orElse(null);
    } catch (InvalidTokenException e) {
      log.info("refresh token rejected: {}", e.getReason());
      metrics.refreshRejected(e.getReason().name().toLowerCase(Locale.ROOT));
      return Optional.empty();
    }
    if (principal == null || principal.kind() != PrincipalKind.USER) {
      log.info("refresh token carries no account");
      metrics.refreshRejected("unknown_shape");
      return Optional.empty();
    }
    metrics.refreshRotated();
    return Optional.of(issue(principal));
  }

  public void revoke(String refreshToken) {
    if (refreshToken == null || refreshToken.isBlank()) return;
    store.delete(refreshKey(refreshToken));
  }

  /**
   * Authenticates a machine client. The secret is itself a signed token naming the organization and
   * the key identifier, and must also match the hash registered with the organization.
   */
  public MachineToken issueMachineToken(String clientId, String clientSecret) {
    if (!AuthUtils.hasText(clientId, clientSecret)) {
      throw AuthException.missingFields();
    }
    String id = clientId.trim();
    String secret = clientSecret.trim();
    JWTClaimsSet claims;
    try {
      claims = jwtService.verify(secret, TokenKind.APP_CREDENTIALS);
    } catch (InvalidTokenException e) {
      return refuseApplication(id, null, "secret " + e.getReason().name().toLowerCase(Locale.ROOT));
    }
    String organizationId;
    try {
      organizationId = claims.getStringClaim("organizationId");
    } catch (ParseException e) {
      organizationId = null;
    }
    String keyId = claims.getJWTID();
    if (!AuthUtils.hasText(organizationId, keyId)) {
      return refuseApplication(id, organizationId, "secret lacks organization or key id");
    }
    if (!id.equals(keyId)) {
      return refuseApplication(id, organizationId, "clientId and clientSecret not matching");
    }
    Optional<OrganizationRecord> organization = organizations.findById(organizationId);
    if (organization.isEmpty()) {
      return refuseApplication(id, organizationId, "organization not found");
    }
    Optional<OrganizationRecord.Application> application = organization.get().application(id);
    if (application.isEmpty()) {
      return refuseApplication(id, organizationId, "application revoked");
    }
    String hash = application.get().clientSecretHash();
    if (hash == null || hash.isBlank() || !secretMatches(secret, hash)) {
      return refuseApplication(id, organizationId, "bad secret");
    }

    Role role;
    try {
      role = Role.fromCode(application.get().role(), Role.API_CLIENT);
    } catch (IllegalArgumentException e) {
      return refuseApplication(id, organizationId, "unsupported role " + application.get().role());
    }
    Principal principal = Principal.application(id, role, organizationId);
    long ttl = authProperties.getTokens().getApplicationAccessTtlSeconds();
    String accessToken = jwtService.sign(TokenKind.ACCESS, id, PrincipalClaims.of(principal), ttl);
    metrics.signinSuccess("application");
    return new MachineToken(accessToken, organizationId, ttl);
  }

  /**
   * Mints a client id and a signed client secret for an organization. Only administrators of that
   * organization may do so; persisting the hashed secret is up to the caller.
   */
  public ApplicationCredentials createApplicationCredentials(
      Principal caller, String organizationId, String expiry) {
    if (!AuthUtils.hasText(organizationId, expiry)) {
      throw AuthException.missingFields();
    }
    if (caller.kind() != PrincipalKind.USER) {
      throw new AuthException(AuthErrorCode.FORBIDDEN, "your current role does not allow to perform this action", 403);
    }
    OrganizationRecord organization =
        organizations
            .findById(organizationId.trim())
            .orElseThrow(
                () -> new AuthException(AuthErrorCode.FORBIDDEN, "organization not accessible", 403));
    Role role =
        organization
            .member(caller.email())
            .map(m -> memberRole(m.role()))
            .orElseThrow(
                () -> new AuthException(AuthErrorCode.FORBIDDEN, "organization not accessible", 403));
    if (role != Role.ADMINISTRATOR) {
      throw new AuthException(AuthErrorCode.FORBIDDEN, "your current role does not allow to perform this action", 403);
    }

    Instant expiresAt = parseExpiry(expiry.trim());
    if (!expiresAt.isAfter(clock.instant())) {
      throw AuthException.validation("expiry must be in the future");
    }
    String clientId = UUID.randomUUID().toString();
    String clientSecret =
        jwtService.sign(
            TokenKind.APP_CREDENTIALS,
            clientId,
            Map.of("organizationId", organization.id()),
            expiresAt,
            clientId);
    log.info("application credentials {} created for organization {}", clientId, organization.id());
    return new ApplicationCredentials(clientId, clientSecret);
  }

  public String issueResetToken(String email) {
    long ttl = authProperties.getTokens().getResetTtlSeconds();
    String token = jwtService.sign(TokenKind.RESET, email, Map.of("email", email), ttl);
    store.set(resetKey(token), email, Duration.ofSeconds(ttl));
    return token;
  }

  /** Single use: the stored entry is removed on first read, whatever the outcome. */
  public Optional<String> consumeResetToken(String resetToken) {
    if (resetToken == null || resetToken.isBlank()) return Optional.empty();
    Optional<String> email = store.getAndDelete(resetKey(resetToken));
    if (email.isEmpty()) {
      log.info("reset token not found in store");
      return Optional.empty();
    }
    try {
      jwtService.verify(resetToken, TokenKind.RESET);
    } catch (InvalidTokenException e) {
      log.info("reset token rejected: {}", e.getReason());
      return Optional.empty();
    }
    return email;
  }

  private boolean secretMatches(String secret, String hash) {
    try {
      return passwordEncoder.matches(secret, hash);
    } catch (IllegalArgumentException e) {
      // encoders that refuse inputs longer than 72 bytes
      log.warn("client secret hash check refused: {}", e.getMessage());
      return false;
    }
  }

  private static Role memberRole(String code) {
    try {
      return Role.fromCode(code, Role.RENTER);
    } catch (IllegalArgumentException e) {
      throw new AuthException(AuthErrorCode.FORBIDDEN, "your current role does not allow to perform this action", 403);
    }
  }

  private MachineToken refuseApplication(String clientId, String organizationId, String reason) {
    log.info("login failed for application {}@{}: {}", clientId, organizationId, reason);
    metrics.signinFailure("application", "invalid_credentials");
    throw AuthException.invalidCredentials();
  }

  private static Instant parseExpiry(String expiry) {
    try {
      return Instant.parse(expiry);
    } catch (DateTimeParseException ignored) {
      // date only
    }
    try {
      return LocalDate.parse(expiry).atStartOfDay(ZoneOffset.UTC).toInstant();
    } catch (DateTimeParseException e) {
      throw AuthException.validation("invalid expiry");
    }
  }

  private static String refreshKey(String token) {
    return PREFIX_REFRESH + AuthUtils.sha256Hex(token.trim());
  }

  private static String resetKey(String token) {
    return PREFIX_RESET + AuthUtils.sha256Hex(token.trim());
  }
}
