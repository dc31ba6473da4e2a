package io.rentdesk.authenticator.auth.directory;

import java.util.Optional;

public interface OrganizationDirectory {
  Optional<OrganizationRecord> findById(String organizationId);
}
