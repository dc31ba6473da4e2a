package io.rentdesk.authenticator.auth.directory;

public record AccountRecord(
    String id, String firstname, String lastname, String email, String passwordHash) {}
