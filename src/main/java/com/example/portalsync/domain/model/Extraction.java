package com.example.portalsync.domain.model;

/**
 * Result of reading one upstream page. A degraded extraction reached the page
 * but did not find the structure it expected.
 */
public record Extraction<T>(T data, boolean degraded, String note) {

  public static <T> Extraction<T> of(T data) {
    return new Extraction<>(data, false, null);
  }

  public static <T> Extraction<T> degraded(T data, String note) {
    return new Extraction<>(data, true, note);
  }
}
