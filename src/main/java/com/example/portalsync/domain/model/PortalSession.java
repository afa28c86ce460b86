package com.example.portalsync.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Authenticated session bound to the upstream cookie jar.
 * absoluteExpiresAt is fixed at creation; idleExpiresAt slides on every successful read.
 */
public record PortalSession(
    String sessionId,
    String account,
    Map<String, String> cookies,
    Instant createdAt,
    Instant absoluteExpiresAt,
    Instant idleExpiresAt
) {

  public PortalSession {
    cookies = cookies == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(cookies));
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(absoluteExpiresAt) || !now.isBefore(idleExpiresAt);
  }

  /**
   * The idle expiry moved forward by idleTtl from now, never past the absolute expiry.
   */
  public PortalSession touch(Instant now, Duration idleTtl) {
    Instant bumped = now.plus(idleTtl);
    if (bumped.isAfter(absoluteExpiresAt)) {
      bumped = absoluteExpiresAt;
    }
    return new PortalSession(sessionId, account, cookies, createdAt, absoluteExpiresAt, bumped);
  }

  public Instant expiresAt() {
    return idleExpiresAt.isBefore(absoluteExpiresAt) ? idleExpiresAt : absoluteExpiresAt;
  }
}
