package com.example.portalsync.service.session;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Session id generation, validation and log masking.
 */
public final class SessionIds {

  private static final int SESSION_ID_ENTROPY_BYTES = 32;
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private SessionIds() {
  }

  public static String generate() {
    byte[] randomBytes = new byte[SESSION_ID_ENTROPY_BYTES];
    SECURE_RANDOM.nextBytes(randomBytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
  }

  public static boolean isWellFormed(String sessionId) {
    return sessionId != null && sessionId.length() >= 42 && sessionId.length() <= 44;
  }

  public static String mask(String sessionId) {
    if (sessionId == null || sessionId.length() < 8) {
      return "INVALID";
    }
    return sessionId.substring(0, 8) + "...";
  }
}
