package com.example.portalsync.service.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Simple distributed lock using Redis
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.store", name = "backend", havingValue = "redis", matchIfMissing = true)
public class RedisFetchLock implements FetchLock {

  static final String LOCK_PREFIX = "lock:";

  private final StringRedisTemplate redisTemplate;

  @Override
  public Optional<String> tryAcquire(String lockKey, Duration ttl) {
    String lockToken = UUID.randomUUID().toString();
    try {
      Boolean acquired = redisTemplate.opsForValue().setIfAbsent(LOCK_PREFIX + lockKey, lockToken, ttl);
      return Boolean.TRUE.equals(acquired) ? Optional.of(lockToken) : Optional.empty();
    } catch (DataAccessException e) {
      // without Redis there is nobody to coordinate with
      log.warn("Fetch lock unavailable for {}: {}", lockKey, e.getMessage());
      return Optional.of(lockToken);
    }
  }

  @Override
  public boolean release(String lockKey, String token) {
    String fullKey = LOCK_PREFIX + lockKey;
    try {
      String currentToken = redisTemplate.opsForValue().get(fullKey);
      if (token.equals(currentToken)) {
        redisTemplate.delete(fullKey);
        return true;
      }
    } catch (DataAccessException e) {
      log.warn("Fetch lock release failed for {}: {}", lockKey, e.getMessage());
    }
    return false;
  }
}
