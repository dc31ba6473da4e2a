package io.rentdesk.authenticator.auth.token;

/** Why a token was refused. Logged only; callers always answer with one generic error. */
public enum TokenRejection {
  MISSING,
  MALFORMED,
  BAD_SIGNATURE,
  EXPIRED,
  NOT_YET_VALID,
  UNTRUSTED_ISSUER,
  WRONG_TYPE,
  UNKNOWN_SHAPE
}
