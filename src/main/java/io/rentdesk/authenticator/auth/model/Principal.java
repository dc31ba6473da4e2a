package io.rentdesk.authenticator.auth.model;

/**
 * Authenticated identity attached to a request. Built from token claims; the core never stores it on
 * its own.
 */
public record Principal(
    PrincipalKind kind,
    String id,
    String email,
    String phone,
    Role role,
    String organizationId,
    String tenantId,
    String clientId) {

  public static Principal user(String id, String email, Role role) {
    return new Principal(PrincipalKind.USER, id, email, null, role, null, null, null);
  }

  public static Principal tenant(String email, String phone, String tenantId) {
    return new Principal(PrincipalKind.USER, tenantId, email, phone, Role.TENANT, null, tenantId, null);
  }

  public static Principal application(String clientId, Role role, String organizationId) {
    return new Principal(PrincipalKind.APPLICATION, clientId, null, null, role, organizationId, null, clientId);
  }

  public static Principal service(String serviceId, Role role, String realmId) {
    return new Principal(PrincipalKind.SERVICE, serviceId, null, null, role, realmId, null, null);
  }

  public String subject() {
    if (email != null && !email.isBlank()) return email;
    if (phone != null && !phone.isBlank()) return phone;
    return id;
  }
}
