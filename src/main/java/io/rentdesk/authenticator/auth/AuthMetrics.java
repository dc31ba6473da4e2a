package io.rentdesk.authenticator.auth;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class AuthMetrics {
  private final MeterRegistry meterRegistry;
  private final AuthProperties authProperties;

  public AuthMetrics(MeterRegistry meterRegistry, AuthProperties authProperties) {
    this.meterRegistry = meterRegistry;
    this.authProperties = authProperties;
  }

  public void signinSuccess(String method) {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("auth.signin.success", "method", method).increment();
  }

  public void signinFailure(String method, String reason) {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("auth.signin.failure", "method", method, "reason", reason).increment();
  }

  public void refreshRotated() {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("auth.refresh.rotated").increment();
  }

  public void refreshRejected(String reason) {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("auth.refresh.rejected", "reason", reason).increment();
  }

  public void otpIssued(String channel) {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("auth.otp.issued", "channel", channel).increment();
  }

  public void otpSuppressed(String channel, String reason) {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("auth.otp.suppressed", "channel", channel, "reason", reason).increment();
  }

  public void otpVerified(String channel) {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("auth.otp.verified", "channel", channel).increment();
  }

  public void otpRejected(String reason) {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("auth.otp.rejected", "reason", reason).increment();
  }

  public void deliveryFailure(String channel) {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("auth.delivery.failure", "channel", channel).increment();
  }

  public void passwordResetRequested() {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("auth.password_reset.requested").increment();
  }

  public void rateLimited(String rule) {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("auth.rate_limited", "rule", rule).increment();
  }

  public void slowedDown() {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("auth.slowed_down").increment();
  }

  public void sessionRejected(String reason) {
    if (!authProperties.isMetricsEnabled()) return;
    meterRegistry.counter("auth.session.rejected", "reason", reason).increment();
  }
}
