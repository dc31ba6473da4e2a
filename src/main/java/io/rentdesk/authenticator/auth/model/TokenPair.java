package io.rentdesk.authenticator.auth.model;

public record TokenPair(
    String accessToken,
    String refreshToken,
    long accessTokenExpiresInSeconds,
    long refreshTokenExpiresInSeconds) {}
