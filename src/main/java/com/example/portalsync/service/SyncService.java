package com.example.portalsync.service;

import com.example.portalsync.adapter.portal.PortalPageClient;
import com.example.portalsync.adapter.portal.PortalResponse;
import com.example.portalsync.domain.model.Diagnostic;
import com.example.portalsync.domain.model.Extraction;
import com.example.portalsync.domain.model.PortalSession;
import com.example.portalsync.domain.model.ReasonCode;
import com.example.portalsync.domain.model.StoredSnapshot;
import com.example.portalsync.domain.model.SyncResult;
import com.example.portalsync.exception.SessionInvalidException;
import com.example.portalsync.exception.SessionStoreUnavailableException;
import com.example.portalsync.exception.UpstreamUnreachableException;
import com.example.portalsync.properties.ApplicationProperties;
import com.example.portalsync.repository.SnapshotRepository;
import com.example.portalsync.service.lock.FetchLock;
import com.example.portalsync.service.resource.PortalResource;
import com.example.portalsync.service.session.PortalSessionStore;
import com.example.portalsync.service.session.SessionIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Layered read of one resource for one session: hot cache, then a live fetch, then the last
 * durable snapshot when the live fetch fails.
 *
 * Session and credential problems are always surfaced. Upstream outages and unexpected markup
 * are absorbed when a snapshot exists.
 */
@Slf4j
@Service
public class SyncService {

  static final Duration CACHE_POLL_INTERVAL = Duration.ofMillis(100);

  private final PortalSessionStore sessionStore;
  private final PortalPageClient pageClient;
  private final SnapshotRepository snapshotRepository;
  private final FetchLock fetchLock;
  private final ApplicationProperties.SyncProperties syncProperties;

  public SyncService(
      PortalSessionStore sessionStore,
      PortalPageClient pageClient,
      SnapshotRepository snapshotRepository,
      FetchLock fetchLock,
      ApplicationProperties properties) {
    this.sessionStore = sessionStore;
    this.pageClient = pageClient;
    this.snapshotRepository = snapshotRepository;
    this.fetchLock = fetchLock;
    this.syncProperties = properties.sync();
  }

  public <T> SyncResult<T> fetch(String sessionId, PortalResource<T> resource, String scope,
                                 boolean forceRefresh, String requestId) {
    Optional<PortalSession> resolved = sessionStore.get(sessionId);
    if (resolved.isEmpty()) {
      log.info("Rejecting {} fetch: session {} is missing or expired",
          resource.kind().code(), SessionIds.mask(sessionId));
      return SyncResult.failure(ReasonCode.SESSION_INVALID, "Session is missing or expired, please log in again", null);
    }
    PortalSession session = resolved.get();
    String owner = session.account();
    String normalizedScope = scope == null ? "" : scope.trim();

    if (!forceRefresh) {
      Optional<T> cached = snapshotRepository.readCached(resource.kind(), owner, normalizedScope, resource.type());
      if (cached.isPresent()) {
        log.debug("Hot cache hit for {} scope '{}'", resource.kind().code(), normalizedScope);
        return SyncResult.cached(cached.get());
      }
    }

    if (!syncProperties.singleFlight()) {
      return fetchLive(session, resource, normalizedScope, requestId);
    }

    String lockKey = resource.kind().cacheKey(owner, normalizedScope);
    Optional<String> lockToken = fetchLock.tryAcquire(lockKey, syncProperties.lockTtl());
    if (lockToken.isEmpty() && !forceRefresh) {
      Optional<T> filled = awaitCache(resource, owner, normalizedScope);
      if (filled.isPresent()) {
        return SyncResult.cached(filled.get());
      }
      log.debug("Concurrent fetch of {} did not fill the cache in time, fetching anyway", lockKey);
    }
    try {
      return fetchLive(session, resource, normalizedScope, requestId);
    } finally {
      lockToken.ifPresent(token -> fetchLock.release(lockKey, token));
    }
  }

  private <T> SyncResult<T> fetchLive(PortalSession session, PortalResource<T> resource, String scope,
                                      String requestId) {
    String owner = session.account();
    Extraction<T> extraction;
    try {
      PortalResponse response = pageClient.fetch(session, resource.request(scope, requestId));
      extraction = resource.extract(response, scope);
    } catch (SessionInvalidException e) {
      log.info("Upstream session for {} is gone ({}), dropping local session {}",
          owner, e.getMessage(), SessionIds.mask(session.sessionId()));
      try {
        sessionStore.delete(session.sessionId());
      } catch (SessionStoreUnavailableException storeFailure) {
        log.warn("Could not drop session {}: {}", SessionIds.mask(session.sessionId()), storeFailure.getMessage());
      }
      return SyncResult.failure(ReasonCode.SESSION_INVALID, e.getMessage(), null);
    } catch (UpstreamUnreachableException e) {
      log.warn("Live fetch of {} for {} failed: {}", resource.kind().code(), owner, e.getMessage());
      return fallback(resource, owner, scope, ReasonCode.UPSTREAM_UNREACHABLE, e.getMessage(), e.getDiagnostic());
    }

    if (extraction.degraded()) {
      log.warn("Extraction of {} degraded: {}", resource.kind().code(), extraction.note());
      Optional<StoredSnapshot<T>> snapshot = lastSnapshot(resource, owner, scope);
      if (snapshot.isPresent()) {
        return SyncResult.fallback(snapshot.get().data(), ReasonCode.EXTRACTION_DEGRADED,
            extraction.note(), snapshot.get().fetchedAt());
      }
      return SyncResult.degraded(extraction.data(), extraction.note());
    }

    List<ReasonCode> warnings = new ArrayList<>();
    try {
      resource.persist(snapshotRepository, owner, scope, extraction.data());
    } catch (RuntimeException e) {
      log.warn("Persisting {} for {} failed after a successful fetch", resource.kind().code(), owner, e);
      warnings.add(ReasonCode.PERSISTENCE_WARNING);
    }
    return SyncResult.live(extraction.data(), warnings);
  }

  private <T> SyncResult<T> fallback(PortalResource<T> resource, String owner, String scope,
                                     ReasonCode reason, String message, Diagnostic diagnostic) {
    Optional<StoredSnapshot<T>> snapshot = lastSnapshot(resource, owner, scope);
    if (snapshot.isEmpty()) {
      return SyncResult.failure(reason, message, diagnostic);
    }
    log.info("Serving {} snapshot from {} for {}", resource.kind().code(), snapshot.get().fetchedAt(), owner);
    return SyncResult.fallback(snapshot.get().data(), reason, message, snapshot.get().fetchedAt());
  }

  private <T> Optional<StoredSnapshot<T>> lastSnapshot(PortalResource<T> resource, String owner, String scope) {
    try {
      return snapshotRepository.latest(resource.kind(), owner, scope, resource.type());
    } catch (RuntimeException e) {
      log.warn("Snapshot lookup for {} failed: {}", resource.kind().code(), e.getMessage());
      return Optional.empty();
    }
  }

  private <T> Optional<T> awaitCache(PortalResource<T> resource, String owner, String scope) {
    long deadline = System.nanoTime() + syncProperties.lockWait().toNanos();
    while (System.nanoTime() < deadline) {
      try {
        Thread.sleep(CACHE_POLL_INTERVAL.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return Optional.empty();
      }
      Optional<T> cached = snapshotRepository.readCached(resource.kind(), owner, scope, resource.type());
      if (cached.isPresent()) {
        return cached;
      }
    }
    return Optional.empty();
  }
}
