package com.example.portalsync.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one resource fetch. Always carries {@code success}; failures carry a reason and message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncResult<T>(
    boolean success,
    T data,
    boolean cached,
    boolean fallback,
    ReasonCode reason,
    String message,
    Diagnostic diagnostic,
    Instant fetchedAt,
    List<ReasonCode> warnings
) {

  public SyncResult {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public static <T> SyncResult<T> live(T data, List<ReasonCode> warnings) {
    return new SyncResult<>(true, data, false, false, null, null, null, null, warnings);
  }

  public static <T> SyncResult<T> cached(T data) {
    return new SyncResult<>(true, data, true, false, null, null, null, null, null);
  }

  public static <T> SyncResult<T> degraded(T data, String message) {
    return new SyncResult<>(true, data, false, false, ReasonCode.EXTRACTION_DEGRADED, message, null, null, null);
  }

  public static <T> SyncResult<T> fallback(T data, ReasonCode reason, String message, Instant fetchedAt) {
    return new SyncResult<>(true, data, false, true, reason, message, null, fetchedAt, null);
  }

  public static <T> SyncResult<T> failure(ReasonCode reason, String message, Diagnostic diagnostic) {
    return new SyncResult<>(false, null, false, false, reason, message, diagnostic, null, null);
  }
}
