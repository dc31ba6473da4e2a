package io.rentdesk.authenticator.auth.risk;

import java.util.List;

/** Rate-limit rules and slow-down applied to each abuse-prone route, in evaluation order. */
public enum RouteGuard {
  SIGNIN(true, List.of("signin"), List.of("signin-account")),
  TENANT_SIGNIN(true, List.of("tenant-signin"), List.of("tenant-signin-account")),
  SIGNUP(false, List.of("signup"), List.of("signup-account")),
  FORGOT_PASSWORD(false, List.of("forgot-password"), List.of("forgot-password-account")),
  RESET_PASSWORD(false, List.of("reset-password"), List.of()),
  REFRESH_TOKEN(false, List.of("refresh-token"), List.of()),
  OTP_VERIFY(false, List.of("otp-verify"), List.of());

  private final boolean slowDown;
  private final List<String> ipRules;
  private final List<String> identifierRules;

  RouteGuard(boolean slowDown, List<String> ipRules, List<String> identifierRules) {
    this.slowDown = slowDown;
    this.ipRules = ipRules;
    this.identifierRules = identifierRules;
  }

  public boolean slowDown() {
    return slowDown;
  }

  public List<String> ipRules() {
    return ipRules;
  }

  public List<String> identifierRules() {
    return identifierRules;
  }
}
