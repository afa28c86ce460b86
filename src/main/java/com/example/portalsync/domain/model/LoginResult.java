package com.example.portalsync.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResult(
    boolean success,
    String sessionId,
    Instant expiresAt,
    ReasonCode reason,
    String message,
    Diagnostic diagnostic
) {

  public static LoginResult success(String sessionId, Instant expiresAt) {
    return new LoginResult(true, sessionId, expiresAt, null, null, null);
  }

  public static LoginResult failure(ReasonCode reason, String message, Diagnostic diagnostic) {
    return new LoginResult(false, null, null, reason, message, diagnostic);
  }
}
