package com.example.portalsync.exception;

/**
 * The session store could not be reached or refused a write.
 */
public class SessionStoreUnavailableException extends RuntimeException {
  public SessionStoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
