package io.rentdesk.authenticator.auth;

import io.rentdesk.authenticator.auth.model.OtpChannel;
import io.rentdesk.authenticator.auth.model.Principal;
import io.rentdesk.authenticator.auth.model.TenantSession;
import io.rentdesk.authenticator.auth.otp.OtpService;
import io.rentdesk.authenticator.auth.risk.FailedAttemptTracker;
import io.rentdesk.authenticator.auth.session.SessionService;
import org.springframework.stereotype.Service;

/** Tenant passwordless flows on top of the passcode and session services. */
@Service
public class TenantAuthService {
  private final OtpService otpService;
  private final SessionService sessionService;
  private final FailedAttemptTracker failedAttempts;

  public TenantAuthService(
      OtpService otpService, SessionService sessionService, FailedAttemptTracker failedAttempts) {
    this.otpService = otpService;
    this.sessionService = sessionService;
    this.failedAttempts = failedAttempts;
  }

  public void requestEmailOtp(String email, String locale) {
    otpService.requestOtp(email, OtpChannel.EMAIL, locale);
  }

  public void requestWhatsAppOtp(String phoneNumber, String locale) {
    otpService.requestOtp(phoneNumber, OtpChannel.WHATSAPP, locale);
  }

  /**
   * @param requiredChannel channel the passcode must come from, {@code null} for any
   */
  public TenantSession signIn(String otp, OtpChannel requiredChannel, String ip) {
    try {
      return otpService.verifyOtp(otp, requiredChannel);
    } catch (AuthException e) {
      if (e.getCode() == AuthErrorCode.INVALID_CREDENTIALS) {
        failedAttempts.recordFailure(ip, null);
      }
      throw e;
    }
  }

  public Principal session(String sessionToken) {
    return sessionService.describe(sessionToken);
  }

  public void signOut(String sessionToken) {
    sessionService.signOut(sessionToken);
  }
}
