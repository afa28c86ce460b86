package com.example.portalsync.service.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived lock used to keep concurrent fetches of the same resource down to one upstream call.
 */
public interface FetchLock {

  /**
   * @return the owner token when acquired, empty when someone else holds the lock
   */
  Optional<String> tryAcquire(String lockKey, Duration ttl);

  /**
   * Release only if still held with the given token.
   */
  boolean release(String lockKey, String token);
}
