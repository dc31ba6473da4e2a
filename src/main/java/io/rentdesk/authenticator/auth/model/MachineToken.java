package io.rentdesk.authenticator.auth.model;

public record MachineToken(String accessToken, String organizationId, long expiresInSeconds) {}
