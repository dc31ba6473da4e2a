package io.rentdesk.authenticator.auth.otp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rentdesk.authenticator.auth.AuthErrorCode;
import io.rentdesk.authenticator.auth.AuthException;
import io.rentdesk.authenticator.auth.AuthMetrics;
import io.rentdesk.authenticator.auth.AuthProperties;
import io.rentdesk.authenticator.auth.AuthUtils;
import io.rentdesk.authenticator.auth.directory.TenantContact;
import io.rentdesk.authenticator.auth.directory.TenantDirectory;
import io.rentdesk.authenticator.auth.directory.TenantRecord;
import io.rentdesk.authenticator.auth.model.OtpChannel;
import io.rentdesk.authenticator.auth.model.OtpRecord;
import io.rentdesk.authenticator.auth.model.Principal;
import io.rentdesk.authenticator.auth.model.TenantSession;
import io.rentdesk.authenticator.auth.session.SessionService;
import io.rentdesk.authenticator.auth.store.CredentialStore;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues and redeems tenant passcodes. A stored passcode is consumed by the first verification
 * attempt, successful or not.
 */
@Service
public class OtpService {
  private static final Logger log = LoggerFactory.getLogger(OtpService.class);
  private static final String PREFIX_OTP = "auth:otp:";
  private static final String WHATSAPP_EMAIL_DOMAIN = "@whatsapp.tenant";

  private final AuthProperties authProperties;
  private final CredentialStore store;
  private final TenantDirectory tenants;
  private final SessionService sessions;
  private final ObjectMapper objectMapper;
  private final AuthMetrics metrics;
  private final Clock clock;
  private final Map<OtpChannel, OtpNotifier> notifiers = new EnumMap<>(OtpChannel.class);

  public OtpService(
      AuthProperties authProperties,
      CredentialStore store,
      TenantDirectory tenants,
      SessionService sessions,
      List<OtpNotifier> notifiers,
      ObjectMapper objectMapper,
      AuthMetrics metrics,
      Clock clock) {
    this.authProperties = authProperties;
    this.store = store;
    this.tenants = tenants;
    this.sessions = sessions;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.clock = clock;
    for (OtpNotifier notifier : notifiers) {
      this.notifiers.put(notifier.channel(), notifier);
    }
  }

  /**
   * Sends a passcode when {@code identifier} belongs to a tenant reachable on {@code channel}, and
   * returns silently otherwise.
   *
   * @throws AuthException {@code VALIDATION_ERROR} for a malformed identifier, {@code
   *     DELIVERY_FAILED} when the notifier could not send the code
   */
  public void requestOtp(String identifier, OtpChannel channel, String locale) {
    String recipient = normalize(identifier, channel);
    if (!isReachable(recipient, channel)) {
      log.info("{} passcode not sent: no matching tenant", channel.code());
      return;
    }

    OtpRecord record = store(recipient, channel);
    OtpNotifier notifier = notifiers.get(channel);
    try {
      if (notifier == null) {
        throw new IllegalStateException("no notifier for channel " + channel.code());
      }
      notifier.deliver(new OtpDelivery(channel, recipient, record.code(), locale));
    } catch (RuntimeException e) {
      store.delete(otpKey(record.code()));
      metrics.deliveryFailure(channel.code());
      log.warn("{} passcode delivery failed: {}", channel.code(), e.getMessage());
      throw new AuthException(AuthErrorCode.DELIVERY_FAILED, "passcode delivery failed", 502);
    }
    metrics.otpIssued(channel.code());
  }

  /**
   * Redeems a passcode for a tenant session.
   *
   * @param requiredChannel the channel the code must have been sent on, or {@code null} for any
   */
  public TenantSession verifyOtp(String code, OtpChannel requiredChannel) {
    String candidate = code == null ? "" : code.trim();
    if (!AuthUtils.isOtpCode(candidate)) {
      return reject("malformed");
    }
    Optional<String> raw = store.getAndDelete(otpKey(candidate));
    if (raw.isEmpty()) {
      return reject("not_found");
    }
    OtpRecord record = read(raw.get());
    if (record == null) {
      return reject("unreadable");
    }
    if (record.isExpired(clock.millis())) {
      return reject("expired");
    }
    if (requiredChannel != null && record.channel() != requiredChannel) {
      return reject("wrong_channel");
    }

    Principal principal =
        record.channel() == OtpChannel.WHATSAPP
            ? whatsAppPrincipal(record.recipient())
            : Principal.tenant(record.recipient(), null, null);
    if (principal == null) {
      return reject("tenant_not_found");
    }
    metrics.otpVerified(record.channel().code());
    return sessions.createSession(principal);
  }

  private String normalize(String identifier, OtpChannel channel) {
    if (channel == OtpChannel.EMAIL) {
      String email = AuthUtils.normalizeEmail(identifier);
      if (email.isEmpty()) throw AuthException.missingFields();
      if (!AuthUtils.isEmail(email)) throw AuthException.validation("invalid email");
      return email;
    }
    String phone = AuthUtils.normalizePhone(identifier);
    if (phone.isEmpty()) throw AuthException.missingFields();
    if (!AuthUtils.isPhoneNumber(phone)) throw AuthException.validation("invalid phone number format");
    return phone;
  }

  private boolean isReachable(String recipient, OtpChannel channel) {
    if (channel == OtpChannel.EMAIL) {
      if (tenants.findByEmail(recipient).isEmpty()) {
        metrics.otpSuppressed(channel.code(), "not_found");
        return false;
      }
      return true;
    }
    List<TenantRecord> matches = tenants.findByPhone(recipient);
    if (matches.isEmpty()) {
      metrics.otpSuppressed(channel.code(), "not_found");
      return false;
    }
    if (matches.stream().noneMatch(t -> t.whatsAppEnabledFor(recipient))) {
      metrics.otpSuppressed(channel.code(), "whatsapp_disabled");
      return false;
    }
    return true;
  }

  private OtpRecord store(String recipient, OtpChannel channel) {
    AuthProperties.Otp otp = authProperties.getOtp();
    Duration ttl = Duration.ofSeconds(otp.getTtlSeconds() + otp.getStoreGraceSeconds());
    int attempts = Math.max(1, otp.getMaxGenerationAttempts());
    for (int i = 0; i < attempts; i++) {
      long now = clock.millis();
      OtpRecord record =
          new OtpRecord(
              AuthUtils.randomOtpCode(), now, now + otp.getTtlSeconds() * 1000L, channel, recipient);
      if (store.setIfAbsent(otpKey(record.code()), write(record), ttl)) {
        return record;
      }
      log.debug("passcode collision, regenerating");
    }
    throw new AuthException(AuthErrorCode.INTERNAL_ERROR, "could not allocate a passcode", 500);
  }

  private Principal whatsAppPrincipal(String phone) {
    for (TenantRecord tenant : tenants.findByPhone(phone)) {
      Optional<TenantContact> contact = tenant.contactWithPhone(phone);
      if (contact.isPresent()) {
        String email = contact.get().email();
        if (email == null || email.isBlank()) {
          email = phone + WHATSAPP_EMAIL_DOMAIN;
        }
        return Principal.tenant(AuthUtils.normalizeEmail(email), phone, tenant.id());
      }
    }
    return null;
  }

  private TenantSession reject(String reason) {
    log.info("passcode rejected: {}", reason);
    metrics.otpRejected(reason);
    throw AuthException.invalidCredentials();
  }

  private String write(OtpRecord record) {
    try {
      return objectMapper.writeValueAsString(record);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize passcode", e);
    }
  }

  private OtpRecord read(String json) {
    try {
      return objectMapper.readValue(json, OtpRecord.class);
    } catch (JsonProcessingException e) {
      log.warn("unreadable passcode record: {}", e.getOriginalMessage());
      return null;
    }
  }

  private static String otpKey(String code) {
    return PREFIX_OTP + code;
  }
}
