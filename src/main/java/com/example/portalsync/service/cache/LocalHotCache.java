package com.example.portalsync.service.cache;

import com.example.portalsync.properties.ApplicationProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed hot tier with a TTL per entry.
 */
@Service
@ConditionalOnProperty(prefix = "app.store", name = "backend", havingValue = "memory")
public class LocalHotCache implements HotCache {

  private final Cache<String, Entry> cache;

  public LocalHotCache(ApplicationProperties properties) {
    this(properties.cache().localMaxSize(), Ticker.systemTicker());
  }

  LocalHotCache(int maximumSize, Ticker ticker) {
    this.cache = Caffeine.newBuilder()
        .maximumSize(maximumSize)
        .expireAfter(new PerEntryExpiry())
        .ticker(ticker)
        .executor(Runnable::run)
        .build();
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(cache.getIfPresent(key)).map(Entry::value);
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    cache.put(key, new Entry(value, ttl));
  }

  @Override
  public void evict(String key) {
    cache.invalidate(key);
  }

  private record Entry(String value, Duration ttl) {}

  private static final class PerEntryExpiry implements Expiry<String, Entry> {
    @Override
    public long expireAfterCreate(String key, Entry entry, long currentTime) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
