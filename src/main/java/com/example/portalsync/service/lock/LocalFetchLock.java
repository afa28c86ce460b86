package com.example.portalsync.service.lock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
@ConditionalOnProperty(prefix = "app.store", name = "backend", havingValue = "memory")
public class LocalFetchLock implements FetchLock {

  private final Map<String, Held> locks = new ConcurrentHashMap<>();
  private final Clock clock;

  public LocalFetchLock(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<String> tryAcquire(String lockKey, Duration ttl) {
    Instant now = clock.instant();
    String token = UUID.randomUUID().toString();
    Held mine = new Held(token, now.plus(ttl));
    Held winner = locks.merge(lockKey, mine, (current, candidate) ->
        now.isBefore(current.expiresAt()) ? current : candidate);
    return winner == mine ? Optional.of(token) : Optional.empty();
  }

  @Override
  public boolean release(String lockKey, String token) {
    boolean[] released = {false};
    locks.computeIfPresent(lockKey, (key, held) -> {
      if (held.token().equals(token)) {
        released[0] = true;
        return null;
      }
      return held;
    });
    return released[0];
  }

  private record Held(String token, Instant expiresAt) {}
}
