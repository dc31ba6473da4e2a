package io.rentdesk.authenticator.auth.directory;

import java.util.List;
import java.util.Optional;

public record OrganizationRecord(
    String id, String name, List<Member> members, List<Application> applications) {
  public OrganizationRecord {
    members = members == null ? List.of() : List.copyOf(members);
    applications = applications == null ? List.of() : List.copyOf(applications);
  }

  public Optional<Member> member(String email) {
    if (email == null) return Optional.empty();
    return members.stream().filter(m -> email.equalsIgnoreCase(m.email())).findFirst();
  }

  public Optional<Application> application(String clientId) {
    if (clientId == null) return Optional.empty();
    return applications.stream().filter(a -> clientId.equals(a.clientId())).findFirst();
  }

  public record Member(String email, String role) {}

  /** Registered machine client; {@code clientSecretHash} is a BCrypt hash of the issued secret. */
  public record Application(String clientId, String name, String clientSecretHash, String role) {}
}
