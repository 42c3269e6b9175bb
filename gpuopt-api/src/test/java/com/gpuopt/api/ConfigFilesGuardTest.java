package com.gpuopt.api;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfigFilesGuardTest {

  @Test
  void gatewaySecretsComeFromEnvironment() throws Exception {
    var content = Files.readString(Path.of("src/main/resources/application.yml"), StandardCharsets.UTF_8);

    assertThat(content)
        .contains("api-key: ${NOWPAYMENTS_API_KEY:}")
        .contains("ipn-secret: ${NOWPAYMENTS_IPN_SECRET:}")
        .contains("secret-key: ${FLUTTERWAVE_SECRET_KEY:}")
        .contains("client-secret: ${PAYPAL_CLIENT_SECRET:}")
        .contains("key-secret: ${RAZORPAY_KEY_SECRET:}")
        .contains("token: ${GPUOPT_ADMIN_TOKEN:}");
  }

  @Test
  void responsesUseSnakeCase() throws Exception {
    var content = Files.readString(Path.of("src/main/resources/application.yml"), StandardCharsets.UTF_8);
    assertThat(content).contains("property-naming-strategy: SNAKE_CASE");
  }
}
