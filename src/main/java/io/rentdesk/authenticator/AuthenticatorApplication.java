package io.rentdesk.authenticator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AuthenticatorApplication {
  public static void main(String[] args) {
    SpringApplication.run(AuthenticatorApplication.class, args);
  }
}
