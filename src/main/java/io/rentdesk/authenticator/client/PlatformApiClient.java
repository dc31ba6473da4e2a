package io.rentdesk.authenticator.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.rentdesk.authenticator.auth.AuthErrorCode;
import io.rentdesk.authenticator.auth.AuthException;
import io.rentdesk.authenticator.auth.AuthProperties;
import io.rentdesk.authenticator.auth.directory.AccountDirectory;
import io.rentdesk.authenticator.auth.directory.AccountRecord;
import io.rentdesk.authenticator.auth.directory.OrganizationDirectory;
import io.rentdesk.authenticator.auth.directory.OrganizationRecord;
import io.rentdesk.authenticator.auth.directory.TenantContact;
import io.rentdesk.authenticator.auth.directory.TenantDirectory;
import io.rentdesk.authenticator.auth.directory.TenantRecord;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/**
 * Directory lookups against the platform API's internal routes. A 404 means "no such record";
 * anything else that fails is reported as {@code UPSTREAM_UNAVAILABLE}.
 */
@Component
public class PlatformApiClient implements TenantDirectory, AccountDirectory, OrganizationDirectory {
  private static final Logger log = LoggerFactory.getLogger(PlatformApiClient.class);
  static final String BREAKER = "platform-api";

  private final WebClient webClient;
  private final AuthProperties authProperties;
  private final UpstreamCalls upstreamCalls;

  public PlatformApiClient(
      WebClient webClient, AuthProperties authProperties, UpstreamCalls upstreamCalls) {
    this.webClient = webClient;
    this.authProperties = authProperties;
    this.upstreamCalls = upstreamCalls;
  }

  @Override
  public List<TenantRecord> findByEmail(String email) {
    return tenants(uri("/internal/tenants", "email", email));
  }

  @Override
  public List<TenantRecord> findByPhone(String phone) {
    return tenants(uri("/internal/tenants", "phone", phone));
  }

  @Override
  public Optional<AccountRecord> findAccountByEmail(String email) {
    JsonNode node = get(uri("/internal/accounts", "email", email));
    if (node == null || node.isMissingNode() || node.isNull()) return Optional.empty();
    return Optional.of(
        new AccountRecord(
            id(node),
            text(node, "firstname"),
            text(node, "lastname"),
            text(node, "email"),
            text(node, "password")));
  }

  @Override
  public void create(String firstname, String lastname, String email, String passwordHash) {
    send(
        webClient
            .post()
            .uri(uri("/internal/accounts", null, null))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(
                Map.of(
                    "firstname", firstname,
                    "lastname", lastname,
                    "email", email,
                    "password", passwordHash))
            .retrieve()
            .toBodilessEntity());
  }

  @Override
  public void updatePassword(String email, String passwordHash) {
    send(
        webClient
            .patch()
            .uri(uri("/internal/accounts/password", null, null))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("email", email, "password", passwordHash))
            .retrieve()
            .toBodilessEntity());
  }

  @Override
  public Optional<OrganizationRecord> findById(String organizationId) {
    JsonNode node =
        get(
            UriComponentsBuilder.fromUriString(baseUrl() + "/internal/realms/{id}")
                .buildAndExpand(organizationId)
                .encode()
                .toUri());
    if (node == null || node.isMissingNode() || node.isNull()) return Optional.empty();
    List<OrganizationRecord.Member> members = new ArrayList<>();
    for (JsonNode m : node.path("members")) {
      members.add(new OrganizationRecord.Member(text(m, "email"), text(m, "role")));
    }
    List<OrganizationRecord.Application> applications = new ArrayList<>();
    for (JsonNode a : node.path("applications")) {
      applications.add(
          new OrganizationRecord.Application(
              text(a, "clientId"), text(a, "name"), text(a, "clientSecret"), text(a, "role")));
    }
    return Optional.of(new OrganizationRecord(id(node), text(node, "name"), members, applications));
  }

  private List<TenantRecord> tenants(URI uri) {
    JsonNode node = get(uri);
    if (node == null || !node.isArray()) return List.of();
    List<TenantRecord> out = new ArrayList<>();
    for (JsonNode t : node) {
      List<TenantContact> contacts = new ArrayList<>();
      for (JsonNode c : t.path("contacts")) {
        contacts.add(
            new TenantContact(
                text(c, "contact"),
                text(c, "email"),
                text(c, "phone1"),
                text(c, "phone2"),
                c.path("whatsapp1").asBoolean(false),
                c.path("whatsapp2").asBoolean(false)));
      }
      out.add(new TenantRecord(id(t), text(t, "name"), contacts));
    }
    return out;
  }

  private JsonNode get(URI uri) {
    return call(
        webClient
            .get()
            .uri(uri)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty()));
  }

  private void send(Mono<?> request) {
    call(request);
  }

  private <T> T call(Mono<T> request) {
    try {
      Duration timeout = Duration.ofMillis(Math.max(1, authProperties.getPlatformApi().getTimeoutMillis()));
      return upstreamCalls.call(BREAKER, request.timeout(timeout));
    } catch (RuntimeException e) {
      log.warn("platform api call failed: {}", e.getMessage());
      throw new AuthException(AuthErrorCode.UPSTREAM_UNAVAILABLE, "service temporarily unavailable", 503);
    }
  }

  private URI uri(String path, String param, String value) {
    UriComponentsBuilder b = UriComponentsBuilder.fromUriString(baseUrl() + path);
    if (param == null) {
      return b.build().toUri();
    }
    return b.queryParam(param, "{value}").encode().buildAndExpand(value).toUri();
  }

  private String baseUrl() {
    return UpstreamCalls.normalizeBaseUrl(authProperties.getPlatformApi().getUrl());
  }

  private static String id(JsonNode node) {
    String id = text(node, "_id");
    return id != null ? id : text(node, "id");
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull()) return null;
    String s = value.asText("").trim();
    return s.isEmpty() ? null : s;
  }
}
