package io.rentdesk.authenticator.auth.directory;

import java.util.Optional;

/** Landlord accounts. Password hashes are produced by this service before they are handed over. */
public interface AccountDirectory {
  Optional<AccountRecord> findAccountByEmail(String email);

  void create(String firstname, String lastname, String email, String passwordHash);

  void updatePassword(String email, String passwordHash);
}
