package com.example.portalsync.service.session;

import com.example.portalsync.domain.model.PortalSession;
import com.example.portalsync.properties.ApplicationProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Process-local session store for single-node deployments and tests. Each entry lives until the
 * earlier of its two expiries, so abandoned sessions are evicted without being read again.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.store", name = "backend", havingValue = "memory")
public class InMemoryPortalSessionStore implements PortalSessionStore {

  private final Cache<String, PortalSession> sessions;
  private final Clock clock;
  private final ApplicationProperties.SessionProperties sessionProperties;

  public InMemoryPortalSessionStore(Clock clock, ApplicationProperties properties) {
    this.clock = clock;
    this.sessionProperties = properties.session();
    this.sessions = Caffeine.newBuilder()
        .expireAfter(new UntilSessionExpiry())
        .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
        .executor(Runnable::run)
        .build();
  }

  @Override
  public PortalSession create(String account, Map<String, String> cookies) {
    Instant now = clock.instant();
    PortalSession session = new PortalSession(
        SessionIds.generate(),
        account,
        cookies,
        now,
        now.plus(sessionProperties.absoluteTtl()),
        now).touch(now, sessionProperties.idleTtl());
    sessions.put(session.sessionId(), session);
    log.info("Created session {} for account {}", SessionIds.mask(session.sessionId()), account);
    return session;
  }

  @Override
  public Optional<PortalSession> get(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    Instant now = clock.instant();
    // compute keeps the expiry check and the idle bump atomic per id
    PortalSession touched = sessions.asMap().computeIfPresent(sessionId, (id, session) ->
        session.isExpired(now) ? null : session.touch(now, sessionProperties.idleTtl()));
    return Optional.ofNullable(touched);
  }

  @Override
  public void delete(String sessionId) {
    if (sessionId != null) {
      sessions.invalidate(sessionId);
    }
  }

  /**
   * Entries currently held, after pending evictions have run.
   */
  long size() {
    sessions.cleanUp();
    return sessions.estimatedSize();
  }

  private final class UntilSessionExpiry implements Expiry<String, PortalSession> {
    @Override
    public long expireAfterCreate(String id, PortalSession session, long currentTime) {
      return remaining(session);
    }

    @Override
    public long expireAfterUpdate(String id, PortalSession session, long currentTime, long currentDuration) {
      return remaining(session);
    }

    @Override
    public long expireAfterRead(String id, PortalSession session, long currentTime, long currentDuration) {
      return currentDuration;
    }

    private long remaining(PortalSession session) {
      return Math.max(0L, Duration.between(clock.instant(), session.expiresAt()).toNanos());
    }
  }
}
