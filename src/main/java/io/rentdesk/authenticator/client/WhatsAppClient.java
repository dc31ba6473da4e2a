package io.rentdesk.authenticator.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.rentdesk.authenticator.auth.AuthErrorCode;
import io.rentdesk.authenticator.auth.AuthException;
import io.rentdesk.authenticator.auth.AuthProperties;
import io.rentdesk.authenticator.auth.model.OtpChannel;
import io.rentdesk.authenticator.auth.otp.OtpDelivery;
import io.rentdesk.authenticator.auth.otp.OtpNotifier;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Sends passcodes as a WhatsApp template message. The template carries the code twice: in the body
 * and as the parameter of its copy-code URL button.
 */
@Component
public class WhatsAppClient implements OtpNotifier {
  private static final Logger log = LoggerFactory.getLogger(WhatsAppClient.class);
  static final String BREAKER = "whatsapp";

  private final WebClient webClient;
  private final AuthProperties authProperties;
  private final UpstreamCalls upstreamCalls;

  public WhatsAppClient(
      WebClient webClient,
      AuthProperties authProperties,
      UpstreamCalls upstreamCalls) {
    this.webClient = webClient;
    this.authProperties = authProperties;
    this.upstreamCalls = upstreamCalls;
  }

  @Override
  public OtpChannel channel() {
    return OtpChannel.WHATSAPP;
  }

  @Override
  public void deliver(OtpDelivery delivery) {
    AuthProperties.WhatsApp whatsapp = authProperties.getWhatsapp();
    String apiUrl = UpstreamCalls.normalizeBaseUrl(whatsapp.getApiUrl());
    if (apiUrl.isBlank() || isBlank(whatsapp.getPhoneNumberId()) || isBlank(whatsapp.getAccessToken())) {
      throw new AuthException(AuthErrorCode.DELIVERY_FAILED, "whatsapp not configured", 502);
    }

    JsonNode response;
    try {
      response =
          upstreamCalls.call(
              BREAKER,
              webClient
                  .post()
                  .uri(apiUrl + "/" + whatsapp.getPhoneNumberId().trim() + "/messages")
                  .contentType(MediaType.APPLICATION_JSON)
                  .headers(h -> h.setBearerAuth(whatsapp.getAccessToken().trim()))
                  .bodyValue(templateMessage(whatsapp, delivery))
                  .retrieve()
                  .bodyToMono(JsonNode.class));
    } catch (RuntimeException e) {
      log.warn("whatsapp send failed: {}", e.getMessage());
      throw new AuthException(AuthErrorCode.DELIVERY_FAILED, "whatsapp delivery failed", 502);
    }
    String messageId = response == null ? "" : response.path("messages").path(0).path("id").asText("");
    if (messageId.isBlank()) {
      log.warn("whatsapp answered without a message id");
      throw new AuthException(AuthErrorCode.DELIVERY_FAILED, "whatsapp delivery failed", 502);
    }
    log.info("whatsapp passcode sent, message {}", messageId);
  }

  static Map<String, Object> templateMessage(AuthProperties.WhatsApp whatsapp, OtpDelivery delivery) {
    List<Map<String, Object>> codeParameter = List.of(Map.of("type", "text", "text", delivery.code()));
    return Map.of(
        "messaging_product", "whatsapp",
        "recipient_type", "individual",
        "to", delivery.recipient().startsWith("+") ? delivery.recipient().substring(1) : delivery.recipient(),
        "type", "template",
        "template",
            Map.of(
                "name", whatsapp.getTemplateName(),
                "language", Map.of("code", whatsapp.getTemplateLanguage()),
                "components",
                    List.of(
                        Map.of("type", "body", "parameters", codeParameter),
                        Map.of(
                            "type", "button",
                            "sub_type", "url",
                            "index", "0",
                            "parameters", codeParameter))));
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
