package com.example.portalsync.adapter.portal;

/**
 * Raw upstream response as seen without following redirects.
 */
public record PortalResponse(
    int statusCode,
    String url,
    String location,
    String body,
    String contentType,
    long contentLength
) {

  public boolean isRedirect() {
    return statusCode >= 300 && statusCode < 400;
  }

  public boolean isOk() {
    return statusCode >= 200 && statusCode < 300;
  }
}
