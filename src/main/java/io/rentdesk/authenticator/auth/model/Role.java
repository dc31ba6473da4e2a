package io.rentdesk.authenticator.auth.model;

public enum Role {
  ADMINISTRATOR("administrator"),
  RENTER("renter"),
  TENANT("tenant"),
  API_CLIENT("api_client");

  private final String code;

  Role(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static Role fromCode(String value, Role fallback) {
    if (value == null || value.isBlank()) return fallback;
    for (Role role : values()) {
      if (role.code.equalsIgnoreCase(value.trim())) return role;
    }
    throw new IllegalArgumentException("unsupported role: " + value);
  }
}
