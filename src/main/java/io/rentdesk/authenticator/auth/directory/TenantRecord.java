package io.rentdesk.authenticator.auth.directory;

import java.util.List;
import java.util.Optional;

public record TenantRecord(String id, String name, List<TenantContact> contacts) {
  public TenantRecord {
    contacts = contacts == null ? List.of() : List.copyOf(contacts);
  }

  public Optional<TenantContact> contactWithPhone(String phone) {
    return contacts.stream().filter(c -> c.hasPhone(phone)).findFirst();
  }

  public boolean whatsAppEnabledFor(String phone) {
    return contacts.stream().anyMatch(c -> c.whatsAppEnabledFor(phone));
  }
}
