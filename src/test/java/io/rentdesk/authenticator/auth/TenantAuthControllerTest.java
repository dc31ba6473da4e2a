package io.rentdesk.authenticator.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.rentdesk.authenticator.auth.model.OtpChannel;
import io.rentdesk.authenticator.auth.model.Principal;
import io.rentdesk.authenticator.auth.model.TenantSession;
import io.rentdesk.authenticator.auth.risk.AbuseGuard;
import io.rentdesk.authenticator.auth.risk.ResponsePadding;
import java.util.Map;
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

@WebFluxTest(controllers = TenantAuthController.class)
@Import({AuthCookies.class, AuthProperties.class})
class TenantAuthControllerTest {
  private static final String BASE = "/api/v2/authenticator/tenant";

  @Autowired private WebTestClient webTestClient;

  @MockBean private TenantAuthService tenantAuthService;
  @MockBean private AbuseGuard abuseGuard;
  @MockBean private ResponsePadding responsePadding;

  @BeforeEach
  void passThroughGuards() {
    given(abuseGuard.protect(any(), any(), any(), any()))
        .willAnswer(inv -> Mono.fromCallable(inv.<Callable<?>>getArgument(3)));
    given(responsePadding.pad(any())).willAnswer(inv -> inv.getArgument(0));
  }

  @Test
  void emailSigninAnswersNoContent() {
    webTestClient
        .post()
        .uri(BASE + "/signin")
        .header(HttpHeaders.ACCEPT_LANGUAGE, "fr-FR")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("email", "ana@rent.example"))
        .exchange()
        .expectStatus()
        .isNoContent();

    verify(tenantAuthService).requestEmailOtp("ana@rent.example", "fr-FR");
  }

  @Test
  void signinWithoutEmailIsUnprocessable() {
    willThrow(AuthException.missingFields()).given(tenantAuthService).requestEmailOtp(isNull(), anyString());

    webTestClient
        .post()
        .uri(BASE + "/signin")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of())
        .exchange()
        .expectStatus()
        .isEqualTo(422)
        .expectBody()
        .jsonPath("$.code")
        .isEqualTo("VALIDATION_ERROR");
  }

  @Test
  void failedPasscodeDeliveryIsBadGateway() {
    willThrow(new AuthException(AuthErrorCode.DELIVERY_FAILED, "whatsapp delivery failed", 502))
        .given(tenantAuthService)
        .requestWhatsAppOtp(eq("+18091234567"), anyString());

    webTestClient
        .post()
        .uri(BASE + "/whatsapp/signin")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("phoneNumber", "+18091234567"))
        .exchange()
        .expectStatus()
        .isEqualTo(502)
        .expectBody()
        .jsonPath("$.code")
        .isEqualTo("DELIVERY_FAILED");
  }

  @Test
  void validPasscodeReturnsSessionTokenAndCookie() {
    given(tenantAuthService.signIn(eq("042917"), isNull(), any()))
        .willReturn(
            new TenantSession("session-1", Principal.tenant("ana@rent.example", null, null), 2_592_000));

    webTestClient
        .get()
        .uri(BASE + "/signedin?otp=042917")
        .exchange()
        .expectStatus()
        .isOk()
        .expectHeader()
        .value(
            HttpHeaders.SET_COOKIE,
            cookie -> assertThat(cookie).startsWith("sessionToken=session-1;").contains("HttpOnly"))
        .expectBody()
        .jsonPath("$.sessionToken")
        .isEqualTo("session-1");
  }

  @Test
  void invalidPasscodeIsUnauthorized() {
    given(tenantAuthService.signIn(eq("000000"), isNull(), any()))
        .willThrow(AuthException.invalidCredentials());

    webTestClient
        .get()
        .uri(BASE + "/signedin?otp=000000")
        .exchange()
        .expectStatus()
        .isUnauthorized()
        .expectHeader()
        .doesNotExist(HttpHeaders.SET_COOKIE);
  }

  @Test
  void whatsAppPasscodeReturnsTenantUser() {
    given(tenantAuthService.signIn(eq("583104"), eq(OtpChannel.WHATSAPP), any()))
        .willReturn(
            new TenantSession(
                "session-2", Principal.tenant("ana@rent.example", "+18091234567", "t-1"), 2_592_000));

    webTestClient
        .get()
        .uri(BASE + "/whatsapp/signedin?otp=583104")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.sessionToken")
        .isEqualTo("session-2")
        .jsonPath("$.user.email")
        .isEqualTo("ana@rent.example")
        .jsonPath("$.user.phone")
        .isEqualTo("+18091234567")
        .jsonPath("$.user.role")
        .isEqualTo("tenant")
        .jsonPath("$.user.tenantId")
        .isEqualTo("t-1");
  }

  @Test
  void emailSessionDescribesOnlyTheAddress() {
    given(tenantAuthService.session("session-1"))
        .willReturn(Principal.tenant("ana@rent.example", null, null));

    webTestClient
        .get()
        .uri(BASE + "/session")
        .cookie("sessionToken", "session-1")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.email")
        .isEqualTo("ana@rent.example")
        .jsonPath("$.phone")
        .doesNotExist()
        .jsonPath("$.role")
        .doesNotExist();
  }

  @Test
  void sessionWithoutCookieIsUnauthorized() {
    given(tenantAuthService.session(null)).willThrow(AuthException.invalidCredentials());

    webTestClient.get().uri(BASE + "/session").exchange().expectStatus().isUnauthorized();
  }

  @Test
  void signoutClearsSessionCookie() {
    webTestClient
        .delete()
        .uri(BASE + "/signout")
        .cookie("sessionToken", "session-1")
        .exchange()
        .expectStatus()
        .isNoContent()
        .expectHeader()
        .value(HttpHeaders.SET_COOKIE, cookie -> assertThat(cookie).startsWith("sessionToken=;"));

    verify(tenantAuthService).signOut("session-1");
  }

  @Test
  void signoutWithoutCookieStillSucceeds() {
    webTestClient.delete().uri(BASE + "/signout").exchange().expectStatus().isNoContent();
    verify(tenantAuthService, never()).signOut(any());
  }
}
