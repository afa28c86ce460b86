package com.example.portalsync.domain.model;

import org.springframework.http.HttpStatus;

/**
 * Machine-checkable reason attached to every non-plain result.
 */
public enum ReasonCode {
  CREDENTIALS_REJECTED(HttpStatus.UNAUTHORIZED),
  SESSION_INVALID(HttpStatus.UNAUTHORIZED),
  UPSTREAM_UNREACHABLE(HttpStatus.BAD_GATEWAY),
  SESSION_STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
  EXTRACTION_DEGRADED(HttpStatus.OK),
  PERSISTENCE_WARNING(HttpStatus.OK),
  INVALID_REQUEST(HttpStatus.BAD_REQUEST);

  private final HttpStatus httpStatus;

  ReasonCode(HttpStatus httpStatus) {
    this.httpStatus = httpStatus;
  }

  public HttpStatus httpStatus() {
    return httpStatus;
  }
}
