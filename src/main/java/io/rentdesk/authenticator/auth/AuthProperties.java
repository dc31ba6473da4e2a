package io.rentdesk.authenticator.auth;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.auth")
public class AuthProperties {
  private boolean production = false;
  private boolean metricsEnabled = true;
  private boolean signupEnabled = true;
  private long minIssuanceResponseMillis = 400;

  private Tokens tokens = new Tokens();
  private Otp otp = new Otp();
  private Cookies cookies = new Cookies();
  private RateLimit rateLimit = new RateLimit();
  private SlowDown slowDown = new SlowDown();
  private Delivery delivery = new Delivery();
  private Emailer emailer = new Emailer();
  private WhatsApp whatsapp = new WhatsApp();
  private PlatformApi platformApi = new PlatformApi();

  public boolean isProduction() {
    return production;
  }

  public void setProduction(boolean production) {
    this.production = production;
  }

  public boolean isMetricsEnabled() {
    return metricsEnabled;
  }

  public void setMetricsEnabled(boolean metricsEnabled) {
    this.metricsEnabled = metricsEnabled;
  }

  public boolean isSignupEnabled() {
    return signupEnabled;
  }

  public void setSignupEnabled(boolean signupEnabled) {
    this.signupEnabled = signupEnabled;
  }

  public long getMinIssuanceResponseMillis() {
    return minIssuanceResponseMillis;
  }

  public void setMinIssuanceResponseMillis(long minIssuanceResponseMillis) {
    this.minIssuanceResponseMillis = minIssuanceResponseMillis;
  }

  public Tokens getTokens() {
    return tokens;
  }

  public void setTokens(Tokens tokens) {
    this.tokens = tokens;
  }

  public Otp getOtp() {
    return otp;
  }

  public void setOtp(Otp otp) {
    this.otp = otp;
  }

  public Cookies getCookies() {
    return cookies;
  }

  public void setCookies(Cookies cookies) {
    this.cookies = cookies;
  }

  public RateLimit getRateLimit() {
    return rateLimit;
  }

  public void setRateLimit(RateLimit rateLimit) {
    this.rateLimit = rateLimit;
  }

  public SlowDown getSlowDown() {
    return slowDown;
  }

  public void setSlowDown(SlowDown slowDown) {
    this.slowDown = slowDown;
  }

  public Delivery getDelivery() {
    return delivery;
  }

  public void setDelivery(Delivery delivery) {
    this.delivery = delivery;
  }

  public Emailer getEmailer() {
    return emailer;
  }

  public void setEmailer(Emailer emailer) {
    this.emailer = emailer;
  }

  public WhatsApp getWhatsapp() {
    return whatsapp;
  }

  public void setWhatsapp(WhatsApp whatsapp) {
    this.whatsapp = whatsapp;
  }

  public PlatformApi getPlatformApi() {
    return platformApi;
  }

  public void setPlatformApi(PlatformApi platformApi) {
    this.platformApi = platformApi;
  }

  public long refreshTokenTtlSeconds() {
    return production ? tokens.getRefreshTtlSeconds() : tokens.getDevRefreshTtlSeconds();
  }

  public long sessionTtlSeconds() {
    return production ? tokens.getSessionTtlSeconds() : tokens.getDevSessionTtlSeconds();
  }

  public static class Tokens {
    private String issuer = "rentdesk-authenticator";
    private String accessSecret = "replace-me-dev-access-secret-at-least-32-bytes";
    private String refreshSecret = "replace-me-dev-refresh-secret-at-least-32-bytes";
    private String resetSecret = "replace-me-dev-reset-secret-at-least-32-bytes";
    private String appCredentialsSecret = "replace-me-dev-appcredz-secret-at-least-32-bytes";
    private long accessTtlSeconds = 30;
    private long refreshTtlSeconds = 600;
    private long devRefreshTtlSeconds = 43_200;
    private long sessionTtlSeconds = 1_800;
    private long devSessionTtlSeconds = 43_200;
    private long applicationAccessTtlSeconds = 300;
    private long resetTtlSeconds = 3_600;

    public String getIssuer() {
      return issuer;
    }

    public void setIssuer(String issuer) {
      this.issuer = issuer;
    }

    public String getAccessSecret() {
      return accessSecret;
    }

    public void setAccessSecret(String accessSecret) {
      this.accessSecret = accessSecret;
    }

    public String getRefreshSecret() {
      return refreshSecret;
    }

    public void setRefreshSecret(String refreshSecret) {
      this.refreshSecret = refreshSecret;
    }

    public String getResetSecret() {
      return resetSecret;
    }

    public void setResetSecret(String resetSecret) {
      this.resetSecret = resetSecret;
    }

    public String getAppCredentialsSecret() {
      return appCredentialsSecret;
    }

    public void setAppCredentialsSecret(String appCredentialsSecret) {
      this.appCredentialsSecret = appCredentialsSecret;
    }

    public long getAccessTtlSeconds() {
      return accessTtlSeconds;
    }

    public void setAccessTtlSeconds(long accessTtlSeconds) {
      this.accessTtlSeconds = accessTtlSeconds;
    }

    public long getRefreshTtlSeconds() {
      return refreshTtlSeconds;
    }

    public void setRefreshTtlSeconds(long refreshTtlSeconds) {
      this.refreshTtlSeconds = refreshTtlSeconds;
    }

    public long getDevRefreshTtlSeconds() {
      return devRefreshTtlSeconds;
    }

    public void setDevRefreshTtlSeconds(long devRefreshTtlSeconds) {
      this.devRefreshTtlSeconds = devRefreshTtlSeconds;
    }

    public long getSessionTtlSeconds() {
      return sessionTtlSeconds;
    }

    public void setSessionTtlSeconds(long sessionTtlSeconds) {
      this.sessionTtlSeconds = sessionTtlSeconds;
    }

    public long getDevSessionTtlSeconds() {
      return devSessionTtlSeconds;
    }

    public void setDevSessionTtlSeconds(long devSessionTtlSeconds) {
      this.devSessionTtlSeconds = devSessionTtlSeconds;
    }

    public long getApplicationAccessTtlSeconds() {
      return applicationAccessTtlSeconds;
    }

    public void setApplicationAccessTtlSeconds(long applicationAccessTtlSeconds) {
      this.applicationAccessTtlSeconds = applicationAccessTtlSeconds;
    }

    public long getResetTtlSeconds() {
      return resetTtlSeconds;
    }

    public void setResetTtlSeconds(long resetTtlSeconds) {
      this.resetTtlSeconds = resetTtlSeconds;
    }
  }

  public static class Otp {
    private long ttlSeconds = 300;
    private long storeGraceSeconds = 60;
    private int maxGenerationAttempts = 5;

    public long getTtlSeconds() {
      return ttlSeconds;
    }

    public void setTtlSeconds(long ttlSeconds) {
      this.ttlSeconds = ttlSeconds;
    }

    public long getStoreGraceSeconds() {
      return storeGraceSeconds;
    }

    public void setStoreGraceSeconds(long storeGraceSeconds) {
      this.storeGraceSeconds = storeGraceSeconds;
    }

    public int getMaxGenerationAttempts() {
      return maxGenerationAttempts;
    }

    public void setMaxGenerationAttempts(int maxGenerationAttempts) {
      this.maxGenerationAttempts = maxGenerationAttempts;
    }
  }

  public static class Cookies {
    private String domain = "";
    private String path = "/";
    private boolean secure = false;
    private boolean httpOnly = true;
    private String sameSite = "Strict";

    public String getDomain() {
      return domain;
    }

    public void setDomain(String domain) {
      this.domain = domain;
    }

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public boolean isSecure() {
      return secure;
    }

    public void setSecure(boolean secure) {
      this.secure = secure;
    }

    public boolean isHttpOnly() {
      return httpOnly;
    }

    public void setHttpOnly(boolean httpOnly) {
      this.httpOnly = httpOnly;
    }

    public String getSameSite() {
      return sameSite;
    }

    public void setSameSite(String sameSite) {
      this.sameSite = sameSite;
    }
  }

  public static class RateLimit {
    private boolean enabled = true;
    private int failedAttemptThreshold = 5;
    private int failedAttemptWindowSeconds = 900;
    private Map<String, Rule> rules = defaultRules();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getFailedAttemptThreshold() {
      return failedAttemptThreshold;
    }

    public void setFailedAttemptThreshold(int failedAttemptThreshold) {
      this.failedAttemptThreshold = failedAttemptThreshold;
    }

    public int getFailedAttemptWindowSeconds() {
      return failedAttemptWindowSeconds;
    }

    public void setFailedAttemptWindowSeconds(int failedAttemptWindowSeconds) {
      this.failedAttemptWindowSeconds = failedAttemptWindowSeconds;
    }

    public Map<String, Rule> getRules() {
      return rules;
    }

    public void setRules(Map<String, Rule> rules) {
      this.rules = rules;
    }

    public Rule rule(String name) {
      Rule rule = rules.get(name);
      if (rule == null) {
        throw new IllegalStateException("rate limit rule not configured: " + name);
      }
      return rule;
    }

    private static Map<String, Rule> defaultRules() {
      Map<String, Rule> out = new LinkedHashMap<>();
      out.put("signin", new Rule(Scope.IP, 5, 900));
      out.put("signin-account", new Rule(Scope.IP_AND_IDENTIFIER, 5, 900));
      out.put("tenant-signin", new Rule(Scope.IP, 5, 900));
      out.put("tenant-signin-account", new Rule(Scope.IP_AND_IDENTIFIER, 5, 900));
      out.put("signup", new Rule(Scope.IP, 5, 3_600));
      out.put("signup-account", new Rule(Scope.IP_AND_IDENTIFIER, 3, 3_600));
      out.put("forgot-password", new Rule(Scope.IP, 3, 3_600));
      out.put("forgot-password-account", new Rule(Scope.IP_AND_IDENTIFIER, 2, 3_600));
      out.put("reset-password", new Rule(Scope.IP, 5, 900));
      out.put("refresh-token", new Rule(Scope.IP, 20, 300));
      out.put("otp-verify", new Rule(Scope.IP, 5, 900));
      return out;
    }
  }

  public enum Scope {
    IP,
    IP_AND_IDENTIFIER
  }

  public static class Rule {
    private Scope scope = Scope.IP;
    private int maxHits = 5;
    private int windowSeconds = 900;

    public Rule() {}

    public Rule(Scope scope, int maxHits, int windowSeconds) {
      this.scope = scope;
      this.maxHits = maxHits;
      this.windowSeconds = windowSeconds;
    }

    public Scope getScope() {
      return scope;
    }

    public void setScope(Scope scope) {
      this.scope = scope;
    }

    public int getMaxHits() {
      return maxHits;
    }

    public void setMaxHits(int maxHits) {
      this.maxHits = maxHits;
    }

    public int getWindowSeconds() {
      return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
      this.windowSeconds = windowSeconds;
    }
  }

  public static class SlowDown {
    private boolean enabled = true;
    private int windowSeconds = 900;
    private int delayAfter = 2;
    private long delayStepMillis = 1_000;
    private long maxDelayMillis = 10_000;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getWindowSeconds() {
      return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
      this.windowSeconds = windowSeconds;
    }

    public int getDelayAfter() {
      return delayAfter;
    }

    public void setDelayAfter(int delayAfter) {
      this.delayAfter = delayAfter;
    }

    public long getDelayStepMillis() {
      return delayStepMillis;
    }

    public void setDelayStepMillis(long delayStepMillis) {
      this.delayStepMillis = delayStepMillis;
    }

    public long getMaxDelayMillis() {
      return maxDelayMillis;
    }

    public void setMaxDelayMillis(long maxDelayMillis) {
      this.maxDelayMillis = maxDelayMillis;
    }
  }

  public static class Delivery {
    private long timeoutMillis = 5_000;
    private int maxRetries = 1;
    private long retryBackoffMillis = 200;
    private int failureRateThreshold = 50;
    private int slidingWindowSize = 20;
    private long openStateSeconds = 30;

    public long getTimeoutMillis() {
      return timeoutMillis;
    }

    public void setTimeoutMillis(long timeoutMillis) {
      this.timeoutMillis = timeoutMillis;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public long getRetryBackoffMillis() {
      return retryBackoffMillis;
    }

    public void setRetryBackoffMillis(long retryBackoffMillis) {
      this.retryBackoffMillis = retryBackoffMillis;
    }

    public int getFailureRateThreshold() {
      return failureRateThreshold;
    }

    public void setFailureRateThreshold(int failureRateThreshold) {
      this.failureRateThreshold = failureRateThreshold;
    }

    public int getSlidingWindowSize() {
      return slidingWindowSize;
    }

    public void setSlidingWindowSize(int slidingWindowSize) {
      this.slidingWindowSize = slidingWindowSize;
    }

    public long getOpenStateSeconds() {
      return openStateSeconds;
    }

    public void setOpenStateSeconds(long openStateSeconds) {
      this.openStateSeconds = openStateSeconds;
    }
  }

  public static class Emailer {
    private String url = "http://localhost:8083/emailer";

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }
  }

  public static class WhatsApp {
    private String apiUrl = "https://graph.facebook.com/v18.0";
    private String accessToken = "";
    private String phoneNumberId = "";
    private String templateName = "otpcode";
    private String templateLanguage = "es";

    public String getApiUrl() {
      return apiUrl;
    }

    public void setApiUrl(String apiUrl) {
      this.apiUrl = apiUrl;
    }

    public String getAccessToken() {
      return accessToken;
    }

    public void setAccessToken(String accessToken) {
      this.accessToken = accessToken;
    }

    public String getPhoneNumberId() {
      return phoneNumberId;
    }

    public void setPhoneNumberId(String phoneNumberId) {
      this.phoneNumberId = phoneNumberId;
    }

    public String getTemplateName() {
      return templateName;
    }

    public void setTemplateName(String templateName) {
      this.templateName = templateName;
    }

    public String getTemplateLanguage() {
      return templateLanguage;
    }

    public void setTemplateLanguage(String templateLanguage) {
      this.templateLanguage = templateLanguage;
    }
  }

  public static class PlatformApi {
    private String url = "http://localhost:8200/api/v2";
    private long timeoutMillis = 5_000;

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public long getTimeoutMillis() {
      return timeoutMillis;
    }

    public void setTimeoutMillis(long timeoutMillis) {
      this.timeoutMillis = timeoutMillis;
    }
  }
}
