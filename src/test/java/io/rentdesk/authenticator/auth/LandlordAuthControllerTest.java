package io.rentdesk.authenticator.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willReturn;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.rentdesk.authenticator.auth.model.ApplicationCredentials;
import io.rentdesk.authenticator.auth.model.MachineToken;
import io.rentdesk.authenticator.auth.model.Principal;
import io.rentdesk.authenticator.auth.model.Role;
import io.rentdesk.authenticator.auth.model.TokenPair;
import io.rentdesk.authenticator.auth.risk.AbuseGuard;
import io.rentdesk.authenticator.auth.risk.ResponsePadding;
import io.rentdesk.authenticator.auth.risk.RouteGuard;
import io.rentdesk.authenticator.auth.session.SessionValidator;
import io.rentdesk.authenticator.auth.token.TokenService;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

@WebFluxTest(controllers = LandlordAuthController.class)
@Import({AuthCookies.class, AuthProperties.class})
class LandlordAuthControllerTest {
  private static final String BASE = "/api/v2/authenticator/landlord";

  @Autowired private WebTestClient webTestClient;

  @MockBean private LandlordAuthService landlordAuthService;
  @MockBean private TokenService tokenService;
  @MockBean private SessionValidator sessionValidator;
  @MockBean private AbuseGuard abuseGuard;
  @MockBean private ResponsePadding responsePadding;

  @BeforeEach
  void passThroughGuards() {
    given(abuseGuard.protect(any(), any(), any(), any()))
        .willAnswer(inv -> Mono.fromCallable(inv.<Callable<?>>getArgument(3)));
    given(responsePadding.pad(any())).willAnswer(inv -> inv.getArgument(0));
  }

  @Test
  void signupAnswersCreated() {
    webTestClient
        .post()
        .uri(BASE + "/signup")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(
            Map.of(
                "firstname", "Marta",
                "lastname", "Diaz",
                "email", "owner@rent.example",
                "password", "correct horse"))
        .exchange()
        .expectStatus()
        .isCreated();

    verify(landlordAuthService).signup("Marta", "Diaz", "owner@rent.example", "correct horse");
  }

  @Test
  void signupWithMissingFieldIsUnprocessable() {
    webTestClient
        .post()
        .uri(BASE + "/signup")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("firstname", "Marta", "email", "owner@rent.example", "password", "pw"))
        .exchange()
        .expectStatus()
        .isEqualTo(422)
        .expectBody()
        .jsonPath("$.code")
        .isEqualTo("VALIDATION_ERROR");

    verify(landlordAuthService, never()).signup(anyString(), anyString(), anyString(), anyString());
  }

  @Test
  void passwordSigninReturnsAccessTokenAndSetsRefreshCookie() {
    given(landlordAuthService.signin(eq("owner@rent.example"), eq("correct horse"), any()))
        .willReturn(new TokenPair("access-1", "refresh-1", 900, 2_592_000));

    webTestClient
        .post()
        .uri(BASE + "/signin")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("email", "owner@rent.example", "password", "correct horse"))
        .exchange()
        .expectStatus()
        .isOk()
        .expectHeader()
        .value(
            HttpHeaders.SET_COOKIE,
            cookie ->
                assertThat(cookie)
                    .startsWith("refreshToken=refresh-1;")
                    .contains("Max-Age=2592000")
                    .contains("HttpOnly")
                    .contains("SameSite=Strict"))
        .expectBody()
        .jsonPath("$.accessToken")
        .isEqualTo("access-1")
        .jsonPath("$.organizationId")
        .doesNotExist();
  }

  @Test
  void applicationSigninReturnsOrganizationWithoutCookie() {
    given(landlordAuthService.signinApplication(eq("c-1"), eq("secret-jwt"), any()))
        .willReturn(new MachineToken("machine-access", "org-1", 300));

    webTestClient
        .post()
        .uri(BASE + "/signin")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("clientId", "c-1", "clientSecret", "secret-jwt"))
        .exchange()
        .expectStatus()
        .isOk()
        .expectHeader()
        .doesNotExist(HttpHeaders.SET_COOKIE)
        .expectBody()
        .jsonPath("$.accessToken")
        .isEqualTo("machine-access")
        .jsonPath("$.organizationId")
        .isEqualTo("org-1");
  }

  @Test
  void emailTakesPrecedenceOverClientCredentials() {
    given(landlordAuthService.signin(eq("owner@rent.example"), eq("correct horse"), any()))
        .willReturn(new TokenPair("access-1", "refresh-1", 900, 2_592_000));

    webTestClient
        .post()
        .uri(BASE + "/signin")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(
            Map.of(
                "email", "owner@rent.example",
                "password", "correct horse",
                "clientId", "c-1"))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.accessToken")
        .isEqualTo("access-1");

    verify(landlordAuthService, never()).signinApplication(any(), any(), any());
    verify(abuseGuard).protect(eq(RouteGuard.SIGNIN), any(), eq("owner@rent.example"), any());
  }

  @Test
  void invalidCredentialsAnswerUnauthorized() {
    given(landlordAuthService.signin(anyString(), anyString(), any()))
        .willThrow(AuthException.invalidCredentials());

    webTestClient
        .post()
        .uri(BASE + "/signin")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("email", "owner@rent.example", "password", "wrong"))
        .exchange()
        .expectStatus()
        .isUnauthorized()
        .expectBody()
        .jsonPath("$.code")
        .isEqualTo("INVALID_CREDENTIALS");
  }

  @Test
  void rateLimitedSigninCarriesRetryAfter() {
    willReturn(Mono.error(new AuthException(AuthErrorCode.RATE_LIMITED, "too many requests", 429, 900)))
        .given(abuseGuard)
        .protect(eq(RouteGuard.SIGNIN), any(), any(), any());

    webTestClient
        .post()
        .uri(BASE + "/signin")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("email", "owner@rent.example", "password", "pw"))
        .exchange()
        .expectStatus()
        .isEqualTo(429)
        .expectHeader()
        .valueEquals(HttpHeaders.RETRY_AFTER, "900")
        .expectBody()
        .jsonPath("$.code")
        .isEqualTo("RATE_LIMITED")
        .jsonPath("$.retryAfterSeconds")
        .isEqualTo(900);
  }

  @Test
  void refreshRotatesCookie() {
    given(tokenService.rotate("refresh-1"))
        .willReturn(Optional.of(new TokenPair("access-2", "refresh-2", 900, 2_592_000)));

    webTestClient
        .post()
        .uri(BASE + "/refreshtoken")
        .cookie("refreshToken", "refresh-1")
        .exchange()
        .expectStatus()
        .isOk()
        .expectHeader()
        .value(HttpHeaders.SET_COOKIE, cookie -> assertThat(cookie).startsWith("refreshToken=refresh-2;"))
        .expectBody()
        .jsonPath("$.accessToken")
        .isEqualTo("access-2");
  }

  @Test
  void refusedRefreshIsForbiddenAndClearsCookie() {
    given(tokenService.rotate("stale")).willReturn(Optional.empty());

    webTestClient
        .post()
        .uri(BASE + "/refreshtoken")
        .cookie("refreshToken", "stale")
        .exchange()
        .expectStatus()
        .isForbidden()
        .expectHeader()
        .value(HttpHeaders.SET_COOKIE, cookie -> assertThat(cookie).startsWith("refreshToken=;").contains("Max-Age=0"))
        .expectBody()
        .jsonPath("$.code")
        .isEqualTo("INVALID_CREDENTIALS");
  }

  @Test
  void refreshWithoutCookieIsForbidden() {
    webTestClient.post().uri(BASE + "/refreshtoken").exchange().expectStatus().isForbidden();
    verify(tokenService, never()).rotate(anyString());
  }

  @Test
  void signoutWithoutCookieIsAccepted() {
    webTestClient.delete().uri(BASE + "/signout").exchange().expectStatus().isAccepted();
    verify(tokenService, never()).revoke(anyString());
  }

  @Test
  void signoutRevokesAndClearsCookie() {
    webTestClient
        .delete()
        .uri(BASE + "/signout")
        .cookie("refreshToken", "refresh-1")
        .exchange()
        .expectStatus()
        .isNoContent()
        .expectHeader()
        .value(HttpHeaders.SET_COOKIE, cookie -> assertThat(cookie).startsWith("refreshToken=;").contains("Max-Age=0"));

    verify(tokenService).revoke("refresh-1");
  }

  @Test
  void forgotPasswordPassesRequestLocale() {
    webTestClient
        .post()
        .uri(BASE + "/forgotpassword")
        .header(HttpHeaders.ACCEPT_LANGUAGE, "es-DO,es;q=0.9")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("email", "owner@rent.example"))
        .exchange()
        .expectStatus()
        .isNoContent();

    verify(landlordAuthService).forgotPassword("owner@rent.example", "es-DO");
  }

  @Test
  void resetPasswordWithSpentTokenIsForbidden() {
    willThrow(AuthException.invalidCredentials(403))
        .given(landlordAuthService)
        .resetPassword(eq("spent"), eq("new secret"), any());

    webTestClient
        .patch()
        .uri(BASE + "/resetpassword")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("resetToken", "spent", "password", "new secret"))
        .exchange()
        .expectStatus()
        .isForbidden();
  }

  @Test
  void appCredentialsRequireAnAuthenticatedCaller() {
    Principal owner = Principal.user("acc-1", "owner@rent.example", Role.ADMINISTRATOR);
    given(sessionValidator.resolve("Bearer access-1", null)).willReturn(owner);
    given(tokenService.createApplicationCredentials(owner, "org-1", "2027-01-01"))
        .willReturn(new ApplicationCredentials("c-1", "secret-jwt"));

    webTestClient
        .post()
        .uri(BASE + "/appcredz")
        .header(HttpHeaders.AUTHORIZATION, "Bearer access-1")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("organizationId", "org-1", "expiry", "2027-01-01"))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.clientId")
        .isEqualTo("c-1")
        .jsonPath("$.clientSecret")
        .isEqualTo("secret-jwt");
  }

  @Test
  void appCredentialsWithoutTokenAreUnauthorized() {
    given(sessionValidator.resolve(null, null)).willThrow(AuthException.invalidCredentials());

    webTestClient
        .post()
        .uri(BASE + "/appcredz")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("organizationId", "org-1", "expiry", "2027-01-01"))
        .exchange()
        .expectStatus()
        .isUnauthorized();
  }
}
