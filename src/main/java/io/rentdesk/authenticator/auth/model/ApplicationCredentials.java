package io.rentdesk.authenticator.auth.model;

public record ApplicationCredentials(String clientId, String clientSecret) {}
