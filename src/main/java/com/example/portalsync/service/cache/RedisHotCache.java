package com.example.portalsync.service.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.store", name = "backend", havingValue = "redis", matchIfMissing = true)
public class RedisHotCache implements HotCache {

  private final StringRedisTemplate redisTemplate;

  @Override
  public Optional<String> get(String key) {
    try {
      return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    } catch (DataAccessException e) {
      log.warn("Hot cache read failed for {}: {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    try {
      redisTemplate.opsForValue().set(key, value, ttl);
    } catch (DataAccessException e) {
      log.warn("Hot cache write failed for {}: {}", key, e.getMessage());
    }
  }

  @Override
  public void evict(String key) {
    try {
      redisTemplate.delete(key);
    } catch (DataAccessException e) {
      log.warn("Hot cache evict failed for {}: {}", key, e.getMessage());
    }
  }
}
