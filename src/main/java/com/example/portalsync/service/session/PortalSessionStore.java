package com.example.portalsync.service.session;

import com.example.portalsync.domain.model.PortalSession;

import java.util.Map;
import java.util.Optional;

/**
 * Opaque session id to upstream cookie jar, with an absolute and a sliding idle expiry.
 */
public interface PortalSessionStore {

  /**
   * Create a session for a freshly authenticated account.
   *
   * @throws com.example.portalsync.exception.SessionStoreUnavailableException if the store rejects the write
   */
  PortalSession create(String account, Map<String, String> cookies);

  /**
   * Resolve a session and slide its idle expiry. Empty when unknown, corrupt or expired;
   * expired entries are removed as a side effect.
   */
  Optional<PortalSession> get(String sessionId);

  /**
   * Remove a session. Unknown ids are ignored.
   *
   * @throws com.example.portalsync.exception.SessionStoreUnavailableException if the store cannot be reached
   */
  void delete(String sessionId);
}
