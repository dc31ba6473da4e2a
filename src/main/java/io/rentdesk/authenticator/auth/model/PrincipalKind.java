package io.rentdesk.authenticator.auth.model;

/** Claim shape a principal was resolved from. */
public enum PrincipalKind {
  USER,
  APPLICATION,
  SERVICE
}
