package io.rentdesk.authenticator.auth;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.web.server.ServerWebExchange;

public final class AuthUtils {
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final Pattern PHONE = Pattern.compile("^\\+?[1-9]\\d{1,14}$");
  private static final Pattern EMAIL = Pattern.compile("^[^@\\s;=]+@[^@\\s;=]+\\.[^@\\s;=]+$");
  private static final Pattern OTP_CODE = Pattern.compile("^\\d{6}$");

  private AuthUtils() {}

  /** Six ASCII digits, leading zeros kept. */
  public static String randomOtpCode() {
    return String.format(Locale.ROOT, "%06d", RANDOM.nextInt(1_000_000));
  }

  public static boolean isOtpCode(String value) {
    return value != null && OTP_CODE.matcher(value).matches();
  }

  public static String sha256Hex(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] out = digest.digest(value.getBytes(StandardCharsets.UTF_8));
      StringBuilder sb = new StringBuilder();
      for (byte b : out) {
        sb.append(String.format("%02x", b));
      }
      return sb.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }

  public static String normalizeEmail(String email) {
    if (email == null) return "";
    return email.trim().toLowerCase(Locale.ROOT);
  }

  public static boolean isEmail(String email) {
    return email != null && EMAIL.matcher(email).matches();
  }

  public static String normalizePhone(String phone) {
    if (phone == null) return "";
    return phone.trim();
  }

  public static boolean isPhoneNumber(String phone) {
    return phone != null && PHONE.matcher(phone).matches();
  }

  public static boolean hasText(String... values) {
    for (String value : values) {
      if (value == null || value.isBlank()) return false;
    }
    return true;
  }

  public static String normalizeIp(String ip) {
    if (ip == null) return "";
    return ip.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Socket peer address of the request. Forwarding headers are only honoured once
   * {@code server.forward-headers-strategy=framework} has rewritten the remote address from them;
   * the raw headers are client-controlled and never read here.
   */
  public static String resolveClientIp(ServerWebExchange exchange) {
    InetSocketAddress remote = exchange.getRequest().getRemoteAddress();
    if (remote == null) return "";
    if (remote.getAddress() == null) return remote.getHostString();
    return remote.getAddress().getHostAddress();
  }

  public static String resolveLocale(ServerWebExchange exchange) {
    String raw = exchange.getRequest().getHeaders().getFirst("Accept-Language");
    if (raw == null || raw.isBlank()) return "en-US";
    String first = raw.split(",")[0].trim();
    int q = first.indexOf(';');
    return q > 0 ? first.substring(0, q).trim() : first;
  }
}
