package io.rentdesk.authenticator.auth.model;

public enum OtpChannel {
  EMAIL("email"),
  WHATSAPP("whatsapp");

  private final String code;

  OtpChannel(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
