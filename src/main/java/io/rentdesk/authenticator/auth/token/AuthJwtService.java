package io.rentdesk.authenticator.auth.token;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.rentdesk.authenticator.auth.AuthErrorCode;
import io.rentdesk.authenticator.auth.AuthException;
import io.rentdesk.authenticator.auth.AuthProperties;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;

/** HS256 signing and verification for every token family issued by this service. */
@Service
public class AuthJwtService {
  private static final String TOKEN_TYPE = "tokenType";

  private final AuthProperties authProperties;
  private final Clock clock;
  private final Map<TokenKind.SigningKey, byte[]> secrets = new EnumMap<>(TokenKind.SigningKey.class);

  public AuthJwtService(AuthProperties authProperties, Clock clock) {
    this.authProperties = authProperties;
    this.clock = clock;
    AuthProperties.Tokens tokens = authProperties.getTokens();
    secrets.put(TokenKind.SigningKey.ACCESS, secretBytes("access", tokens.getAccessSecret()));
    secrets.put(TokenKind.SigningKey.REFRESH, secretBytes("refresh", tokens.getRefreshSecret()));
    secrets.put(TokenKind.SigningKey.RESET, secretBytes("reset", tokens.getResetSecret()));
    secrets.put(
        TokenKind.SigningKey.APP_CREDENTIALS,
        secretBytes("app-credentials", tokens.getAppCredentialsSecret()));
  }

  public String sign(TokenKind kind, String subject, Map<String, Object> claims, long ttlSeconds) {
    Instant expiresAt = clock.instant().plusSeconds(Math.max(1, ttlSeconds));
    return sign(kind, subject, claims, expiresAt, UUID.randomUUID().toString());
  }

  public String sign(
      TokenKind kind, String subject, Map<String, Object> claims, Instant expiresAt, String jwtId) {
    try {
      JWTClaimsSet.Builder builder =
          new JWTClaimsSet.Builder()
              .issuer(authProperties.getTokens().getIssuer())
              .subject(subject)
              .issueTime(Date.from(clock.instant()))
              .expirationTime(Date.from(expiresAt))
              .jwtID(jwtId)
              .claim(TOKEN_TYPE, kind.code());
      claims.forEach(builder::claim);
      SignedJWT jwt =
          new SignedJWT(
              new JWSHeader.Builder(JWSAlgorithm.HS256).type(JOSEObjectType.JWT).build(),
              builder.build());
      jwt.sign(new MACSigner(secrets.get(kind.signingKey())));
      return jwt.serialize();
    } catch (JOSEException e) {
      throw new AuthException(AuthErrorCode.INTERNAL_ERROR, "failed to sign " + kind.code() + " token", 500);
    }
  }

  /**
   * Verifies signature, issuer, validity window and token type. {@code alsoAccepted} kinds must share
   * the signing key of {@code kind}.
   *
   * @throws InvalidTokenException with the precise rejection reason
   */
  public JWTClaimsSet verify(String token, TokenKind kind, TokenKind... alsoAccepted) {
    if (token == null || token.isBlank()) {
      throw new InvalidTokenException(TokenRejection.MISSING);
    }
    String[] parts = token.trim().split("\\.", -1);
    if (parts.length != 3 || Arrays.stream(parts).anyMatch(String::isEmpty)) {
      throw new InvalidTokenException(TokenRejection.MALFORMED);
    }
    try {
      SignedJWT jwt = SignedJWT.parse(token.trim());
      if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
        throw new InvalidTokenException(TokenRejection.MALFORMED);
      }
      JWSVerifier verifier = new MACVerifier(secrets.get(kind.signingKey()));
      if (!jwt.verify(verifier)) {
        throw new InvalidTokenException(TokenRejection.BAD_SIGNATURE);
      }
      JWTClaimsSet claims = jwt.getJWTClaimsSet();
      Date now = Date.from(clock.instant());
      if (claims.getNotBeforeTime() != null && claims.getNotBeforeTime().after(now)) {
        throw new InvalidTokenException(TokenRejection.NOT_YET_VALID);
      }
      Date expires = claims.getExpirationTime();
      if (expires == null || !expires.after(now)) {
        throw new InvalidTokenException(TokenRejection.EXPIRED);
      }
      if (!authProperties.getTokens().getIssuer().equals(claims.getIssuer())) {
        throw new InvalidTokenException(TokenRejection.UNTRUSTED_ISSUER);
      }
      String tokenType = claims.getStringClaim(TOKEN_TYPE);
      if (!accepts(tokenType, kind, alsoAccepted)) {
        throw new InvalidTokenException(TokenRejection.WRONG_TYPE);
      }
      return claims;
    } catch (InvalidTokenException e) {
      throw e;
    } catch (ParseException | JOSEException e) {
      throw new InvalidTokenException(TokenRejection.MALFORMED);
    }
  }

  private static boolean accepts(String tokenType, TokenKind kind, TokenKind... alsoAccepted) {
    if (kind.code().equals(tokenType)) return true;
    for (TokenKind other : alsoAccepted) {
      if (other.signingKey() == kind.signingKey() && other.code().equals(tokenType)) return true;
    }
    return false;
  }

  private static byte[] secretBytes(String name, String secret) {
    byte[] bytes = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
    if (bytes.length < 32) {
      throw new IllegalStateException("app.auth.tokens " + name + " secret must be at least 32 bytes");
    }
    return bytes;
  }
}
