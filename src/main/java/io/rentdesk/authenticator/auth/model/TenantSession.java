package io.rentdesk.authenticator.auth.model;

public record TenantSession(String sessionToken, Principal principal, long expiresInSeconds) {}
