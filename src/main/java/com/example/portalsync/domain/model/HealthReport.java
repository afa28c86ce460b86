package com.example.portalsync.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Upstream reachability probe. Redirects and 4xx still count as reachable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthReport(
    boolean reachable,
    Integer statusCode,
    String url,
    String redirectLocation,
    String contentSample,
    Long contentLength,
    String contentType,
    String message
) {

  public static HealthReport unreachable(String message) {
    return new HealthReport(false, null, null, null, null, null, null, message);
  }
}
