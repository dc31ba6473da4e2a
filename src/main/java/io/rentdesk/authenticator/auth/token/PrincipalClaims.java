package io.rentdesk.authenticator.auth.token;

import com.nimbusds.jwt.JWTClaimsSet;
import io.rentdesk.authenticator.auth.model.Principal;
import io.rentdesk.authenticator.auth.model.PrincipalKind;
import io.rentdesk.authenticator.auth.model.Role;
import java.text.ParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps principals to the claim shapes carried in tokens: {@code account} for end users, {@code
 * application} for machine clients and {@code service} for internal services.
 */
public final class PrincipalClaims {
  public static final String ACCOUNT = "account";
  public static final String APPLICATION = "application";
  public static final String SERVICE = "service";

  private PrincipalClaims() {}

  public static Map<String, Object> of(Principal principal) {
    Map<String, Object> body = new LinkedHashMap<>();
    switch (principal.kind()) {
      case USER -> {
        put(body, "id", principal.id());
        put(body, "email", principal.email());
        put(body, "phone", principal.phone());
        put(body, "role", principal.role().code());
        put(body, "organizationId", principal.organizationId());
        put(body, "tenantId", principal.tenantId());
        return Map.of(ACCOUNT, body);
      }
      case APPLICATION -> {
        put(body, "clientId", principal.clientId());
        put(body, "role", principal.role().code());
        put(body, "organizationId", principal.organizationId());
        return Map.of(APPLICATION, body);
      }
      case SERVICE -> {
        put(body, "serviceId", principal.id());
        put(body, "realmId", principal.organizationId());
        put(body, "role", principal.role().code());
        return Map.of(SERVICE, body);
      }
      default -> throw new IllegalStateException("unsupported principal kind " + principal.kind());
    }
  }

  /** Empty when none of the known claim shapes is present or a shape is unreadable. */
  public static Optional<Principal> from(JWTClaimsSet claims) {
    try {
      Map<String, Object> account = claims.getJSONObjectClaim(ACCOUNT);
      if (account != null) {
        return Optional.of(
            new Principal(
                PrincipalKind.USER,
                str(account, "id"),
                str(account, "email"),
                str(account, "phone"),
                Role.fromCode(str(account, "role"), Role.ADMINISTRATOR),
                str(account, "organizationId"),
                str(account, "tenantId"),
                null));
      }
      Map<String, Object> application = claims.getJSONObjectClaim(APPLICATION);
      if (application != null) {
        String clientId = str(application, "clientId");
        if (clientId == null) return Optional.empty();
        return Optional.of(
            Principal.application(
                clientId,
                Role.fromCode(str(application, "role"), Role.API_CLIENT),
                str(application, "organizationId")));
      }
      Map<String, Object> service = claims.getJSONObjectClaim(SERVICE);
      if (service != null) {
        String serviceId = str(service, "serviceId");
        if (serviceId == null) return Optional.empty();
        return Optional.of(
            Principal.service(
                serviceId,
                Role.fromCode(str(service, "role"), Role.ADMINISTRATOR),
                str(service, "realmId")));
      }
      return Optional.empty();
    } catch (ParseException | IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  private static void put(Map<String, Object> body, String key, String value) {
    if (value != null && !value.isBlank()) body.put(key, value);
  }

  private static String str(Map<String, Object> body, String key) {
    Object value = body.get(key);
    if (value == null) return null;
    String s = String.valueOf(value).trim();
    return s.isEmpty() ? null : s;
  }
}
