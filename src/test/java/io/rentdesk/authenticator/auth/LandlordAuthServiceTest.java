package io.rentdesk.authenticator.auth;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.rentdesk.authenticator.auth.directory.AccountDirectory;
import io.rentdesk.authenticator.auth.directory.AccountRecord;
import io.rentdesk.authenticator.auth.model.Principal;
import io.rentdesk.authenticator.auth.model.Role;
import io.rentdesk.authenticator.auth.model.TokenPair;
import io.rentdesk.authenticator.auth.risk.FailedAttemptTracker;
import io.rentdesk.authenticator.auth.store.InMemoryCredentialStore;
import io.rentdesk.authenticator.auth.token.TokenService;
import io.rentdesk.authenticator.client.EmailerClient;
import io.rentdesk.authenticator.support.AuthFixtures;
import io.rentdesk.authenticator.support.MutableClock;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

class LandlordAuthServiceTest {
  private static final String IP = "203.0.113.7";

  private final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder(4);
  private AuthProperties properties;
  private AccountDirectory accounts;
  private TokenService tokens;
  private EmailerClient emailer;
  private FailedAttemptTracker failedAttempts;
  private LandlordAuthService service;

  @BeforeEach
  void setUp() {
    properties = AuthFixtures.properties();
    properties.setSignupEnabled(true);
    accounts = mock(AccountDirectory.class);
    tokens = mock(TokenService.class);
    emailer = mock(EmailerClient.class);
    failedAttempts =
        new FailedAttemptTracker(
            new InMemoryCredentialStore(new MutableClock(AuthFixtures.START)), properties);
    given(accounts.findAccountByEmail(anyString())).willReturn(Optional.empty());
    service =
        new LandlordAuthService(
            properties, accounts, tokens, emailer, encoder, failedAttempts, AuthFixtures.metrics(properties));
  }

  @Test
  void signupStoresNormalizedEmailAndBcryptHash() {
    service.signup(" Marta ", "Diaz", " Owner@Rent.Example ", "correct horse");

    ArgumentCaptor<String> hash = ArgumentCaptor.forClass(String.class);
    verify(accounts).create(eq("Marta"), eq("Diaz"), eq("owner@rent.example"), hash.capture());
    assertEquals(true, encoder.matches("correct horse", hash.getValue()));
  }

  @Test
  void signupForExistingEmailIsSilentlyAccepted() {
    givenAccount("owner@rent.example", "whatever");

    service.signup("Marta", "Diaz", "owner@rent.example", "another");

    verify(accounts, never()).create(anyString(), anyString(), anyString(), anyString());
  }

  @Test
  void signupRespectsFeatureFlag() {
    properties.setSignupEnabled(false);

    assertThatThrownBy(() -> service.signup("Marta", "Diaz", "owner@rent.example", "pw"))
        .isInstanceOfSatisfying(
            AuthException.class,
            e -> {
              assertEquals(AuthErrorCode.FEATURE_DISABLED, e.getCode());
              assertEquals(404, e.getHttpStatus());
            });
  }

  @Test
  void signupRejectsMissingAndMalformedFields() {
    assertThatThrownBy(() -> service.signup("Marta", "", "owner@rent.example", "pw"))
        .isInstanceOfSatisfying(AuthException.class, e -> assertEquals(422, e.getHttpStatus()));
    assertThatThrownBy(() -> service.signup("Marta", "Diaz", "not-an-email", "pw"))
        .isInstanceOfSatisfying(AuthException.class, e -> assertEquals(422, e.getHttpStatus()));
  }

  @Test
  void signinIssuesAdministratorTokenPair() {
    givenAccount("owner@rent.example", "correct horse");
    TokenPair pair = new TokenPair("access", "refresh", 900, 2_592_000);
    given(tokens.issue(any())).willReturn(pair);

    assertSame(pair, service.signin("OWNER@rent.example", "correct horse", IP));

    ArgumentCaptor<Principal> principal = ArgumentCaptor.forClass(Principal.class);
    verify(tokens).issue(principal.capture());
    assertEquals("acc-1", principal.getValue().id());
    assertEquals("owner@rent.example", principal.getValue().email());
    assertEquals(Role.ADMINISTRATOR, principal.getValue().role());
  }

  @Test
  void wrongPasswordAndUnknownAccountFailAlikeAndAreCounted() {
    givenAccount("owner@rent.example", "correct horse");

    assertThatThrownBy(() -> service.signin("owner@rent.example", "wrong", IP))
        .isInstanceOfSatisfying(
            AuthException.class,
            e -> {
              assertEquals(AuthErrorCode.INVALID_CREDENTIALS, e.getCode());
              assertEquals(401, e.getHttpStatus());
            });
    assertThatThrownBy(() -> service.signin("owner@rent.example", "wrong again", IP))
        .isInstanceOf(AuthException.class);
    assertThatThrownBy(() -> service.signin("ghost@rent.example", "anything", IP))
        .isInstanceOfSatisfying(
            AuthException.class, e -> assertEquals(AuthErrorCode.INVALID_CREDENTIALS, e.getCode()));

    assertEquals(3, failedAttempts.recordFailure(IP, "owner@rent.example"));
    verify(tokens, never()).issue(any());
  }

  @Test
  void failedMachineSigninIsCountedAgainstTheClientId() {
    given(tokens.issueMachineToken("c-1", "bad")).willThrow(AuthException.invalidCredentials());

    assertThatThrownBy(() -> service.signinApplication("c-1", "bad", IP)).isInstanceOf(AuthException.class);

    assertEquals(2, failedAttempts.recordFailure(IP, "c-1"));
  }

  @Test
  void forgotPasswordMailsResetTokenForKnownAccount() {
    givenAccount("owner@rent.example", "pw");
    given(tokens.issueResetToken("owner@rent.example")).willReturn("reset-token");

    service.forgotPassword(" Owner@rent.example", "es-DO");

    verify(emailer).sendResetPassword("owner@rent.example", "reset-token", "es-DO");
  }

  @Test
  void forgotPasswordForUnknownAccountSendsNothing() {
    service.forgotPassword("ghost@rent.example", "en-US");

    verify(tokens, never()).issueResetToken(anyString());
    verify(emailer, never()).sendResetPassword(anyString(), anyString(), anyString());
  }

  @Test
  void forgotPasswordHidesDeliveryFailures() {
    givenAccount("owner@rent.example", "pw");
    given(tokens.issueResetToken("owner@rent.example")).willReturn("reset-token");
    willThrow(new AuthException(AuthErrorCode.DELIVERY_FAILED, "email delivery failed", 502))
        .given(emailer)
        .sendResetPassword(anyString(), anyString(), anyString());

    service.forgotPassword("owner@rent.example", "en-US");

    verify(emailer).sendResetPassword("owner@rent.example", "reset-token", "en-US");
  }

  @Test
  void resetPasswordStoresNewHash() {
    given(tokens.consumeResetToken("reset-token")).willReturn(Optional.of("owner@rent.example"));

    service.resetPassword("reset-token", "new secret", IP);

    ArgumentCaptor<String> hash = ArgumentCaptor.forClass(String.class);
    verify(accounts).updatePassword(eq("owner@rent.example"), hash.capture());
    assertEquals(true, encoder.matches("new secret", hash.getValue()));
  }

  @Test
  void unknownResetTokenIsForbidden() {
    given(tokens.consumeResetToken("used")).willReturn(Optional.empty());

    assertThatThrownBy(() -> service.resetPassword("used", "new secret", IP))
        .isInstanceOfSatisfying(AuthException.class, e -> assertEquals(403, e.getHttpStatus()));
    verify(accounts, never()).updatePassword(anyString(), anyString());
  }

  private void givenAccount(String email, String password) {
    given(accounts.findAccountByEmail(email))
        .willReturn(Optional.of(new AccountRecord("acc-1", "Marta", "Diaz", email, encoder.encode(password))));
  }
}
