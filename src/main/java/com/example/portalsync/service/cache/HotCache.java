package com.example.portalsync.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Hot tier holding serialized payloads per (kind, owner, scope) key. Never the source of truth:
 * implementations swallow their own outages and behave like a miss.
 */
public interface HotCache {

  Optional<String> get(String key);

  void put(String key, String value, Duration ttl);

  void evict(String key);
}
