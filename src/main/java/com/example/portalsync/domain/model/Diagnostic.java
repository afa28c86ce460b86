package com.example.portalsync.domain.model;

/**
 * Operator-facing details of an upstream response. Never carries credential material.
 */
public record Diagnostic(
    int statusCode,
    String redirectLocation,
    String htmlSample
) {

  public static final int SAMPLE_LIMIT = 200;

  public static Diagnostic of(int statusCode, String redirectLocation, String body) {
    return new Diagnostic(statusCode, redirectLocation, sample(body));
  }

  public static String sample(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= SAMPLE_LIMIT ? body : body.substring(0, SAMPLE_LIMIT);
  }
}
