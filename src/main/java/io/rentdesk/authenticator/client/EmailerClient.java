package io.rentdesk.authenticator.client;

import io.rentdesk.authenticator.auth.AuthErrorCode;
import io.rentdesk.authenticator.auth.AuthException;
import io.rentdesk.authenticator.auth.AuthProperties;
import io.rentdesk.authenticator.auth.model.OtpChannel;
import io.rentdesk.authenticator.auth.otp.OtpDelivery;
import io.rentdesk.authenticator.auth.otp.OtpNotifier;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** Email delivery through the platform's emailer service, which owns templates and transport. */
@Component
public class EmailerClient implements OtpNotifier {
  private static final Logger log = LoggerFactory.getLogger(EmailerClient.class);
  static final String BREAKER = "emailer";

  private final WebClient webClient;
  private final AuthProperties authProperties;
  private final UpstreamCalls upstreamCalls;

  public EmailerClient(
      WebClient webClient,
      AuthProperties authProperties,
      UpstreamCalls upstreamCalls) {
    this.webClient = webClient;
    this.authProperties = authProperties;
    this.upstreamCalls = upstreamCalls;
  }

  @Override
  public OtpChannel channel() {
    return OtpChannel.EMAIL;
  }

  @Override
  public void deliver(OtpDelivery delivery) {
    send("/otp", "otp", delivery.recipient(), Map.of("otp", delivery.code()), delivery.locale());
  }

  public void sendResetPassword(String email, String token, String locale) {
    send("/resetpassword", "reset_password", email, Map.of("token", token), locale);
  }

  private void send(
      String path, String templateName, String recordId, Map<String, Object> params, String locale) {
    String baseUrl = UpstreamCalls.normalizeBaseUrl(authProperties.getEmailer().getUrl());
    if (baseUrl.isBlank()) {
      throw new AuthException(AuthErrorCode.DELIVERY_FAILED, "emailer url not configured", 502);
    }
    Map<String, Object> body =
        Map.of("templateName", templateName, "recordId", recordId, "params", params);
    try {
      upstreamCalls.call(
          BREAKER,
          webClient
              .post()
              .uri(baseUrl + path)
              .contentType(MediaType.APPLICATION_JSON)
              .header(HttpHeaders.ACCEPT_LANGUAGE, locale == null ? "en-US" : locale)
              .bodyValue(body)
              .retrieve()
              .toBodilessEntity());
    } catch (RuntimeException e) {
      log.warn("emailer {} failed: {}", templateName, e.getMessage());
      throw new AuthException(AuthErrorCode.DELIVERY_FAILED, "email delivery failed", 502);
    }
  }
}
