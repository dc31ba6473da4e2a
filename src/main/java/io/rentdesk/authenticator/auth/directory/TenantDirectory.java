package io.rentdesk.authenticator.auth.directory;

import java.util.List;

/** Read-only view of the tenants owned by the platform's data service. */
public interface TenantDirectory {
  List<TenantRecord> findByEmail(String email);

  /** Tenants having {@code phone} as the first or second phone of any contact. */
  List<TenantRecord> findByPhone(String phone);
}
