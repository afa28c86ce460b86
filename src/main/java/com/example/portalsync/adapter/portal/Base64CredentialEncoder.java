package com.example.portalsync.adapter.portal;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * base64(username) + "%%%" + base64(password), the form the portal's own login page submits.
 */
public class Base64CredentialEncoder implements CredentialEncoder {

  private static final String SEPARATOR = "%%%";

  @Override
  public String encode(String username, String password) {
    return b64(username) + SEPARATOR + b64(password);
  }

  private static String b64(String value) {
    return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
  }
}
