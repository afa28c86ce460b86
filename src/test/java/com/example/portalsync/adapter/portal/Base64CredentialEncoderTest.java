package com.example.portalsync.adapter.portal;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

class Base64CredentialEncoderTest {

  private final CredentialEncoder encoder = new Base64CredentialEncoder();

  @Test
  void joinsEncodedPartsWithPercentSeparator() {
    assertThat(encoder.encode("20210001", "pa55")).isEqualTo("MjAyMTAwMDE=%%%cGE1NQ==");
  }

  @Test
  void encodesUtf8Passwords() {
    String encoded = encoder.encode("u", "密码");
    String passwordPart = encoded.substring(encoded.indexOf("%%%") + 3);

    assertThat(new String(Base64.getDecoder().decode(passwordPart), StandardCharsets.UTF_8)).isEqualTo("密码");
  }
}
