package com.example.portalsync.exception;

/**
 * Local session is missing or expired, or the upstream returned to its login flow mid-use.
 */
public class SessionInvalidException extends RuntimeException {
  public SessionInvalidException(String message) {
    super(message);
  }

  public SessionInvalidException(String message, Throwable cause) {
    super(message, cause);
  }
}
