package io.rentdesk.authenticator.auth.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;

public final class AuthDtos {
  private AuthDtos() {}

  public record SignupRequest(
      @NotBlank String firstname,
      @NotBlank String lastname,
      @NotBlank String email,
      @NotBlank String password) {}

  /** Password sign-in when {@code email} is set, machine sign-in when client credentials are. */
  public record SigninRequest(String email, String password, String clientId, String clientSecret) {
    @JsonIgnore
    public boolean isApplication() {
      if (email != null && !email.isBlank()) return false;
      return (clientId != null && !clientId.isBlank())
          || (clientSecret != null && !clientSecret.isBlank());
    }

    @JsonIgnore
    public String identifier() {
      return isApplication() ? clientId : email;
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record SigninResponse(String accessToken, String organizationId) {}

  public record AppCredentialsRequest(@NotBlank String expiry, @NotBlank String organizationId) {}

  public record AppCredentialsResponse(String clientId, String clientSecret) {}

  public record ForgotPasswordRequest(@NotBlank String email) {}

  public record ResetPasswordRequest(@NotBlank String resetToken, @NotBlank String password) {}

  public record TenantSigninRequest(String email) {}

  public record WhatsAppSigninRequest(String phoneNumber) {}

  public record SessionTokenResponse(String sessionToken) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record TenantUser(String email, String phone, String role, String tenantId) {}

  public record WhatsAppSessionResponse(String sessionToken, TenantUser user) {}
}
