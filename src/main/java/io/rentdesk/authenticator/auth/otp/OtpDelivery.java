package io.rentdesk.authenticator.auth.otp;

import io.rentdesk.authenticator.auth.model.OtpChannel;

public record OtpDelivery(OtpChannel channel, String recipient, String code, String locale) {}
