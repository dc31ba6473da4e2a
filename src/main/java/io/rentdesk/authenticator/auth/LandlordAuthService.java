package io.rentdesk.authenticator.auth;

import io.rentdesk.authenticator.auth.directory.AccountDirectory;
import io.rentdesk.authenticator.auth.directory.AccountRecord;
import io.rentdesk.authenticator.auth.model.MachineToken;
import io.rentdesk.authenticator.auth.model.Principal;
import io.rentdesk.authenticator.auth.model.Role;
import io.rentdesk.authenticator.auth.model.TokenPair;
import io.rentdesk.authenticator.auth.risk.FailedAttemptTracker;
import io.rentdesk.authenticator.auth.token.TokenService;
import io.rentdesk.authenticator.client.EmailerClient;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/** Landlord account flows: sign-up, password and machine sign-in, password reset. */
@Service
public class LandlordAuthService {
  private static final Logger log = LoggerFactory.getLogger(LandlordAuthService.class);

  private final AuthProperties authProperties;
  private final AccountDirectory accounts;
  private final TokenService tokenService;
  private final EmailerClient emailer;
  private final PasswordEncoder passwordEncoder;
  private final FailedAttemptTracker failedAttempts;
  private final AuthMetrics metrics;
  private final String unknownAccountHash;

  public LandlordAuthService(
      AuthProperties authProperties,
      AccountDirectory accounts,
      TokenService tokenService,
      EmailerClient emailer,
      PasswordEncoder passwordEncoder,
      FailedAttemptTracker failedAttempts,
      AuthMetrics metrics) {
    this.authProperties = authProperties;
    this.accounts = accounts;
    this.tokenService = tokenService;
    this.emailer = emailer;
    this.passwordEncoder = passwordEncoder;
    this.failedAttempts = failedAttempts;
    this.metrics = metrics;
    // compared against when the account does not exist, so both paths cost one hash check
    this.unknownAccountHash = passwordEncoder.encode(UUID.randomUUID().toString());
  }

  /** Creates the account unless the e-mail is taken; the caller sees the same outcome either way. */
  public void signup(String firstname, String lastname, String email, String password) {
    if (!authProperties.isSignupEnabled()) {
      throw new AuthException(AuthErrorCode.FEATURE_DISABLED, "signup is disabled", 404);
    }
    if (!AuthUtils.hasText(firstname, lastname, email, password)) {
      throw AuthException.missingFields();
    }
    String normalized = AuthUtils.normalizeEmail(email);
    if (!AuthUtils.isEmail(normalized)) {
      throw AuthException.validation("invalid email");
    }
    if (accounts.findAccountByEmail(normalized).isPresent()) {
      log.info("signup skipped: account already exists");
      return;
    }
    accounts.create(firstname.trim(), lastname.trim(), normalized, passwordEncoder.encode(password));
    log.info("landlord account created");
  }

  public TokenPair signin(String email, String password, String ip) {
    if (!AuthUtils.hasText(email, password)) {
      throw AuthException.missingFields();
    }
    String normalized = AuthUtils.normalizeEmail(email);
    Optional<AccountRecord> account = accounts.findAccountByEmail(normalized);
    String hash =
        account.map(AccountRecord::passwordHash).filter(h -> !h.isBlank()).orElse(unknownAccountHash);
    boolean matches = passwordEncoder.matches(password, hash);
    if (account.isEmpty() || !matches) {
      log.info("login failed for {}: {}", normalized, account.isEmpty() ? "account not found" : "bad password");
      metrics.signinFailure("password", "invalid_credentials");
      failedAttempts.recordFailure(ip, normalized);
      throw AuthException.invalidCredentials();
    }
    AccountRecord found = account.get();
    String accountEmail = found.email() == null ? normalized : AuthUtils.normalizeEmail(found.email());
    metrics.signinSuccess("password");
    return tokenService.issue(Principal.user(found.id(), accountEmail, Role.ADMINISTRATOR));
  }

  public MachineToken signinApplication(String clientId, String clientSecret, String ip) {
    try {
      return tokenService.issueMachineToken(clientId, clientSecret);
    } catch (AuthException e) {
      if (e.getCode() == AuthErrorCode.INVALID_CREDENTIALS) {
        failedAttempts.recordFailure(ip, clientId);
      }
      throw e;
    }
  }

  /**
   * Mails a reset link when the account exists. Delivery problems are logged, not surfaced, so the
   * answer never depends on whether the account exists.
   */
  public void forgotPassword(String email, String locale) {
    String normalized = AuthUtils.normalizeEmail(email);
    if (normalized.isEmpty()) {
      throw AuthException.missingFields();
    }
    metrics.passwordResetRequested();
    if (accounts.findAccountByEmail(normalized).isEmpty()) {
      log.info("password reset skipped: account not found");
      return;
    }
    String token = tokenService.issueResetToken(normalized);
    try {
      emailer.sendResetPassword(normalized, token, locale);
    } catch (AuthException e) {
      log.warn("reset password e-mail not sent: {}", e.getMessage());
    }
  }

  public void resetPassword(String resetToken, String password, String ip) {
    if (!AuthUtils.hasText(resetToken, password)) {
      throw AuthException.missingFields();
    }
    Optional<String> email = tokenService.consumeResetToken(resetToken);
    if (email.isEmpty()) {
      failedAttempts.recordFailure(ip, null);
      throw AuthException.invalidCredentials(403);
    }
    accounts.updatePassword(email.get(), passwordEncoder.encode(password));
    log.info("password reset completed");
  }
}
