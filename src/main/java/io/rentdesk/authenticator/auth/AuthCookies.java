package io.rentdesk.authenticator.auth;

import java.time.Duration;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/** Cookies carrying the landlord refresh token and the tenant session token. */
@Component
public class AuthCookies {
  public static final String REFRESH_TOKEN = "refreshToken";
  public static final String SESSION_TOKEN = "sessionToken";

  private final AuthProperties authProperties;

  public AuthCookies(AuthProperties authProperties) {
    this.authProperties = authProperties;
  }

  public ResponseCookie issue(String name, String value, long maxAgeSeconds) {
    return builder(name, value).maxAge(Duration.ofSeconds(maxAgeSeconds)).build();
  }

  public ResponseCookie clear(String name) {
    return builder(name, "").maxAge(Duration.ZERO).build();
  }

  private ResponseCookie.ResponseCookieBuilder builder(String name, String value) {
    AuthProperties.Cookies cookies = authProperties.getCookies();
    ResponseCookie.ResponseCookieBuilder builder =
        ResponseCookie.from(name, value)
            .path(cookies.getPath())
            .secure(cookies.isSecure())
            .httpOnly(cookies.isHttpOnly())
            .sameSite(cookies.getSameSite());
    if (cookies.getDomain() != null && !cookies.getDomain().isBlank()) {
      builder.domain(cookies.getDomain().trim());
    }
    return builder;
  }
}
