package io.rentdesk.authenticator.auth.otp;

import io.rentdesk.authenticator.auth.model.OtpChannel;

/**
 * Sends a passcode to its recipient. Implementations either return once the transport accepted the
 * message or throw; they never retry beyond their own bounded policy.
 */
public interface OtpNotifier {
  OtpChannel channel();

  void deliver(OtpDelivery delivery);
}
