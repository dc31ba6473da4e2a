package io.rentdesk.authenticator.auth;

import io.rentdesk.authenticator.auth.dto.AuthDtos;
import io.rentdesk.authenticator.auth.model.OtpChannel;
import io.rentdesk.authenticator.auth.model.Principal;
import io.rentdesk.authenticator.auth.model.TenantSession;
import io.rentdesk.authenticator.auth.risk.AbuseGuard;
import io.rentdesk.authenticator.auth.risk.ResponsePadding;
import io.rentdesk.authenticator.auth.risk.RouteGuard;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@Validated
@RequestMapping("/api/v2/authenticator/tenant")
public class TenantAuthController {
  private final TenantAuthService tenantAuthService;
  private final AbuseGuard abuseGuard;
  private final ResponsePadding responsePadding;
  private final AuthCookies cookies;

  public TenantAuthController(
      TenantAuthService tenantAuthService,
      AbuseGuard abuseGuard,
      ResponsePadding responsePadding,
      AuthCookies cookies) {
    this.tenantAuthService = tenantAuthService;
    this.abuseGuard = abuseGuard;
    this.responsePadding = responsePadding;
    this.cookies = cookies;
  }

  @PostMapping(path = "/signin")
  public Mono<ResponseEntity<Void>> signin(
      @RequestBody AuthDtos.TenantSigninRequest request, ServerWebExchange exchange) {
    String locale = AuthUtils.resolveLocale(exchange);
    return responsePadding.pad(
        abuseGuard.protect(
            RouteGuard.TENANT_SIGNIN,
            exchange,
            request.email(),
            () -> {
              tenantAuthService.requestEmailOtp(request.email(), locale);
              return ResponseEntity.noContent().<Void>build();
            }));
  }

  @PostMapping(path = "/whatsapp/signin")
  public Mono<ResponseEntity<Void>> whatsAppSignin(
      @RequestBody AuthDtos.WhatsAppSigninRequest request, ServerWebExchange exchange) {
    String locale = AuthUtils.resolveLocale(exchange);
    return responsePadding.pad(
        abuseGuard.protect(
            RouteGuard.TENANT_SIGNIN,
            exchange,
            request.phoneNumber(),
            () -> {
              tenantAuthService.requestWhatsAppOtp(request.phoneNumber(), locale);
              return ResponseEntity.noContent().<Void>build();
            }));
  }

  @GetMapping(path = "/signedin", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<ResponseEntity<AuthDtos.SessionTokenResponse>> signedIn(
      @RequestParam(value = "otp", required = false) String otp, ServerWebExchange exchange) {
    String ip = AuthUtils.resolveClientIp(exchange);
    return abuseGuard.protect(
        RouteGuard.OTP_VERIFY,
        exchange,
        null,
        () -> {
          TenantSession session = tenantAuthService.signIn(otp, null, ip);
          return ResponseEntity.ok()
              .header(HttpHeaders.SET_COOKIE, sessionCookie(session))
              .body(new AuthDtos.SessionTokenResponse(session.sessionToken()));
        });
  }

  @GetMapping(path = "/whatsapp/signedin", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<ResponseEntity<AuthDtos.WhatsAppSessionResponse>> whatsAppSignedIn(
      @RequestParam(value = "otp", required = false) String otp, ServerWebExchange exchange) {
    String ip = AuthUtils.resolveClientIp(exchange);
    return abuseGuard.protect(
        RouteGuard.OTP_VERIFY,
        exchange,
        null,
        () -> {
          TenantSession session = tenantAuthService.signIn(otp, OtpChannel.WHATSAPP, ip);
          Principal principal = session.principal();
          return ResponseEntity.ok()
              .header(HttpHeaders.SET_COOKIE, sessionCookie(session))
              .body(
                  new AuthDtos.WhatsAppSessionResponse(
                      session.sessionToken(),
                      new AuthDtos.TenantUser(
                          principal.email(),
                          principal.phone(),
                          principal.role().code(),
                          principal.tenantId())));
        });
  }

  /** Phone-based sessions describe the whole tenant user; e-mail sessions only the address. */
  @GetMapping(path = "/session", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<AuthDtos.TenantUser> session(
      @CookieValue(name = AuthCookies.SESSION_TOKEN, required = false) String sessionToken) {
    return Mono.fromCallable(
            () -> {
              Principal principal = tenantAuthService.session(sessionToken);
              if (principal.phone() != null) {
                return new AuthDtos.TenantUser(
                    principal.email(), principal.phone(), principal.role().code(), principal.tenantId());
              }
              return new AuthDtos.TenantUser(principal.email(), null, null, null);
            })
        .subscribeOn(Schedulers.boundedElastic());
  }

  @DeleteMapping(path = "/signout")
  public Mono<ResponseEntity<Void>> signout(
      @CookieValue(name = AuthCookies.SESSION_TOKEN, required = false) String sessionToken) {
    return Mono.fromCallable(
            () -> {
              if (sessionToken == null || sessionToken.isBlank()) {
                return ResponseEntity.noContent().<Void>build();
              }
              tenantAuthService.signOut(sessionToken);
              return ResponseEntity.noContent()
                  .header(HttpHeaders.SET_COOKIE, cookies.clear(AuthCookies.SESSION_TOKEN).toString())
                  .<Void>build();
            })
        .subscribeOn(Schedulers.boundedElastic());
  }

  private String sessionCookie(TenantSession session) {
    return cookies
        .issue(AuthCookies.SESSION_TOKEN, session.sessionToken(), session.expiresInSeconds())
        .toString();
  }
}
