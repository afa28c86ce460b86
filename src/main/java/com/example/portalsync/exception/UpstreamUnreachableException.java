package com.example.portalsync.exception;

import com.example.portalsync.domain.model.Diagnostic;

/**
 * Upstream Unreachable Exception
 */
public class UpstreamUnreachableException extends RuntimeException {

  private final Diagnostic diagnostic;

  public UpstreamUnreachableException(String message) {
    this(message, null, null);
  }

  public UpstreamUnreachableException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public UpstreamUnreachableException(String message, Diagnostic diagnostic, Throwable cause) {
    super(message, cause);
    this.diagnostic = diagnostic;
  }

  public Diagnostic getDiagnostic() {
    return diagnostic;
  }
}
