package io.rentdesk.authenticator.auth.directory;

/** One contact of a tenant. Each phone carries its own WhatsApp flag. */
public record TenantContact(
    String contactName,
    String email,
    String phone1,
    String phone2,
    boolean whatsapp1,
    boolean whatsapp2) {

  public boolean hasPhone(String value) {
    return value != null && (value.equals(phone1) || value.equals(phone2));
  }

  public boolean whatsAppEnabledFor(String value) {
    if (value == null) return false;
    return (value.equals(phone1) && whatsapp1) || (value.equals(phone2) && whatsapp2);
  }
}
