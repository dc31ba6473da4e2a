package io.rentdesk.authenticator.auth;

import io.rentdesk.authenticator.auth.dto.AuthDtos;
import io.rentdesk.authenticator.auth.model.ApplicationCredentials;
import io.rentdesk.authenticator.auth.model.MachineToken;
import io.rentdesk.authenticator.auth.model.Principal;
import io.rentdesk.authenticator.auth.model.TokenPair;
import io.rentdesk.authenticator.auth.risk.AbuseGuard;
import io.rentdesk.authenticator.auth.risk.ResponsePadding;
import io.rentdesk.authenticator.auth.risk.RouteGuard;
import io.rentdesk.authenticator.auth.session.SessionValidator;
import io.rentdesk.authenticator.auth.token.TokenService;
import jakarta.validation.Valid;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@Validated
@RequestMapping("/api/v2/authenticator/landlord")
public class LandlordAuthController {
  private final LandlordAuthService landlordAuthService;
  private final TokenService tokenService;
  private final SessionValidator sessionValidator;
  private final AbuseGuard abuseGuard;
  private final ResponsePadding responsePadding;
  private final AuthCookies cookies;

  public LandlordAuthController(
      LandlordAuthService landlordAuthService,
      TokenService tokenService,
      SessionValidator sessionValidator,
      AbuseGuard abuseGuard,
      ResponsePadding responsePadding,
      AuthCookies cookies) {
    this.landlordAuthService = landlordAuthService;
    this.tokenService = tokenService;
    this.sessionValidator = sessionValidator;
    this.abuseGuard = abuseGuard;
    this.responsePadding = responsePadding;
    this.cookies = cookies;
  }

  @PostMapping(path = "/signup")
  public Mono<ResponseEntity<Void>> signup(
      @Valid @RequestBody AuthDtos.SignupRequest request, ServerWebExchange exchange) {
    return responsePadding.pad(
        abuseGuard.protect(
            RouteGuard.SIGNUP,
            exchange,
            request.email(),
            () -> {
              landlordAuthService.signup(
                  request.firstname(), request.lastname(), request.email(), request.password());
              return ResponseEntity.status(HttpStatus.CREATED).<Void>build();
            }));
  }

  @PostMapping(path = "/signin", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<ResponseEntity<AuthDtos.SigninResponse>> signin(
      @RequestBody AuthDtos.SigninRequest request, ServerWebExchange exchange) {
    String ip = AuthUtils.resolveClientIp(exchange);
    return abuseGuard.protect(
        RouteGuard.SIGNIN,
        exchange,
        request.identifier(),
        () -> {
          if (request.isApplication()) {
            MachineToken token =
                landlordAuthService.signinApplication(request.clientId(), request.clientSecret(), ip);
            return ResponseEntity.ok(
                new AuthDtos.SigninResponse(token.accessToken(), token.organizationId()));
          }
          TokenPair pair = landlordAuthService.signin(request.email(), request.password(), ip);
          return ResponseEntity.ok()
              .header(
                  HttpHeaders.SET_COOKIE,
                  cookies
                      .issue(AuthCookies.REFRESH_TOKEN, pair.refreshToken(), pair.refreshTokenExpiresInSeconds())
                      .toString())
              .body(new AuthDtos.SigninResponse(pair.accessToken(), null));
        });
  }

  @PostMapping(path = "/appcredz", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<AuthDtos.AppCredentialsResponse> appCredentials(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorizationHeader,
      @Valid @RequestBody AuthDtos.AppCredentialsRequest request) {
    return Mono.fromCallable(
            () -> {
              Principal caller = sessionValidator.resolve(authorizationHeader, null);
              ApplicationCredentials credentials =
                  tokenService.createApplicationCredentials(
                      caller, request.organizationId(), request.expiry());
              return new AuthDtos.AppCredentialsResponse(
                  credentials.clientId(), credentials.clientSecret());
            })
        .subscribeOn(Schedulers.boundedElastic());
  }

  /** Refused refreshes answer 403 and drop the cookie in the same response. */
  @PostMapping(path = "/refreshtoken", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<ResponseEntity<Object>> refreshToken(
      @CookieValue(name = AuthCookies.REFRESH_TOKEN, required = false) String refreshToken,
      ServerWebExchange exchange) {
    return abuseGuard.protect(
        RouteGuard.REFRESH_TOKEN,
        exchange,
        null,
        () -> {
          if (refreshToken == null || refreshToken.isBlank()) {
            throw AuthException.invalidCredentials(403);
          }
          Optional<TokenPair> pair = tokenService.rotate(refreshToken);
          if (pair.isEmpty()) {
            Map<String, Object> body = AuthExceptionHandler.body(AuthException.invalidCredentials(403));
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .header(HttpHeaders.SET_COOKIE, cookies.clear(AuthCookies.REFRESH_TOKEN).toString())
                .<Object>body(body);
          }
          TokenPair rotated = pair.get();
          return ResponseEntity.ok()
              .header(
                  HttpHeaders.SET_COOKIE,
                  cookies
                      .issue(AuthCookies.REFRESH_TOKEN, rotated.refreshToken(), rotated.refreshTokenExpiresInSeconds())
                      .toString())
              .<Object>body(new AuthDtos.SigninResponse(rotated.accessToken(), null));
        });
  }

  @DeleteMapping(path = "/signout")
  public Mono<ResponseEntity<Void>> signout(
      @CookieValue(name = AuthCookies.REFRESH_TOKEN, required = false) String refreshToken) {
    if (refreshToken == null || refreshToken.isBlank()) {
      return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).build());
    }
    return Mono.fromCallable(
            () -> {
              tokenService.revoke(refreshToken);
              return ResponseEntity.noContent()
                  .header(HttpHeaders.SET_COOKIE, cookies.clear(AuthCookies.REFRESH_TOKEN).toString())
                  .<Void>build();
            })
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping(path = "/forgotpassword")
  public Mono<ResponseEntity<Void>> forgotPassword(
      @Valid @RequestBody AuthDtos.ForgotPasswordRequest request, ServerWebExchange exchange) {
    String locale = AuthUtils.resolveLocale(exchange);
    return responsePadding.pad(
        abuseGuard.protect(
            RouteGuard.FORGOT_PASSWORD,
            exchange,
            request.email(),
            () -> {
              landlordAuthService.forgotPassword(request.email(), locale);
              return ResponseEntity.noContent().<Void>build();
            }));
  }

  @PatchMapping(path = "/resetpassword")
  public Mono<ResponseEntity<Void>> resetPassword(
      @Valid @RequestBody AuthDtos.ResetPasswordRequest request, ServerWebExchange exchange) {
    String ip = AuthUtils.resolveClientIp(exchange);
    return abuseGuard.protect(
        RouteGuard.RESET_PASSWORD,
        exchange,
        null,
        () -> {
          landlordAuthService.resetPassword(request.resetToken(), request.password(), ip);
          return ResponseEntity.ok().<Void>build();
        });
  }
}
