package com.example.portalsync.service;

import com.example.portalsync.adapter.portal.LoginFlow;
import com.example.portalsync.adapter.portal.LoginOutcome;
import com.example.portalsync.adapter.portal.PortalRequest;
import com.example.portalsync.adapter.portal.PortalResponse;
import com.example.portalsync.adapter.portal.PortalTransport;
import com.example.portalsync.adapter.portal.SessionCookieJar;
import com.example.portalsync.domain.model.Diagnostic;
import com.example.portalsync.domain.model.GradeSheet;
import com.example.portalsync.domain.model.HealthReport;
import com.example.portalsync.domain.model.LoginResult;
import com.example.portalsync.domain.model.PortalSession;
import com.example.portalsync.domain.model.ProfileView;
import com.example.portalsync.domain.model.ReasonCode;
import com.example.portalsync.domain.model.ResourceKind;
import com.example.portalsync.domain.model.ScheduleView;
import com.example.portalsync.domain.model.SemesterList;
import com.example.portalsync.domain.model.SnapshotView;
import com.example.portalsync.domain.model.SyncResult;
import com.example.portalsync.exception.SessionStoreUnavailableException;
import com.example.portalsync.exception.UpstreamUnreachableException;
import com.example.portalsync.properties.ApplicationProperties;
import com.example.portalsync.repository.SnapshotRepository;
import com.example.portalsync.service.resource.GradeResource;
import com.example.portalsync.service.resource.ProfileResource;
import com.example.portalsync.service.resource.ScheduleResource;
import com.example.portalsync.service.resource.SemesterResource;
import com.example.portalsync.service.session.PortalSessionStore;
import com.example.portalsync.service.session.SessionIds;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * The operations offered to the HTTP layer. Every call runs with the caller's request id in the
 * logging context and returns a structured result instead of throwing.
 */
@Slf4j
@Service
public class AcademicPortalService {

  public static final String MDC_REQUEST_ID = "requestId";
  public static final int DEFAULT_SNAPSHOT_LIMIT = 10;

  private final PortalTransport transport;
  private final LoginFlow loginFlow;
  private final PortalSessionStore sessionStore;
  private final SyncService syncService;
  private final SnapshotRepository snapshotRepository;
  private final ProfileResource profileResource;
  private final SemesterResource semesterResource;
  private final GradeResource gradeResource;
  private final ScheduleResource scheduleResource;
  private final ApplicationProperties.PortalProperties portal;

  public AcademicPortalService(
      PortalTransport transport,
      LoginFlow loginFlow,
      PortalSessionStore sessionStore,
      SyncService syncService,
      SnapshotRepository snapshotRepository,
      ProfileResource profileResource,
      SemesterResource semesterResource,
      GradeResource gradeResource,
      ScheduleResource scheduleResource,
      ApplicationProperties properties) {
    this.transport = transport;
    this.loginFlow = loginFlow;
    this.sessionStore = sessionStore;
    this.syncService = syncService;
    this.snapshotRepository = snapshotRepository;
    this.profileResource = profileResource;
    this.semesterResource = semesterResource;
    this.gradeResource = gradeResource;
    this.scheduleResource = scheduleResource;
    this.portal = properties.portal();
  }

  /**
   * Probe the upstream login page. Any status below 500 counts as reachable.
   */
  public HealthReport health(String requestId) {
    return withRequestId(requestId, () -> {
      try {
        PortalResponse response = transport.execute(
            PortalRequest.get(portal.healthPath(), requestId), new SessionCookieJar());
        boolean reachable = response.statusCode() >= 200 && response.statusCode() < 500;
        return new HealthReport(
            reachable,
            response.statusCode(),
            response.url(),
            response.location(),
            Diagnostic.sample(response.body()),
            response.contentLength(),
            response.contentType(),
            null);
      } catch (UpstreamUnreachableException e) {
        log.warn("Upstream health probe failed: {}", e.getMessage());
        return HealthReport.unreachable(e.getMessage());
      }
    });
  }

  public LoginResult login(String username, String password, String requestId) {
    return withRequestId(requestId, () -> {
      if (username == null || username.isBlank() || password == null || password.isEmpty()) {
        return LoginResult.failure(ReasonCode.INVALID_REQUEST, "Username and password are required", null);
      }
      String account = username.trim();
      LoginOutcome outcome;
      try {
        outcome = loginFlow.login(account, password, requestId);
      } catch (UpstreamUnreachableException e) {
        log.warn("Login for {} failed, upstream unreachable: {}", account, e.getMessage());
        return LoginResult.failure(ReasonCode.UPSTREAM_UNREACHABLE, e.getMessage(), e.getDiagnostic());
      }
      if (!outcome.success()) {
        log.info("Credentials rejected for {}", account);
        return LoginResult.failure(ReasonCode.CREDENTIALS_REJECTED,
            "The academic portal rejected the credentials", outcome.diagnostic());
      }

      PortalSession session;
      try {
        session = sessionStore.create(account, outcome.cookies());
      } catch (SessionStoreUnavailableException e) {
        log.error("Login for {} succeeded upstream but the session could not be stored", account, e);
        return LoginResult.failure(ReasonCode.SESSION_STORE_UNAVAILABLE,
            "Session storage is unavailable, please retry", null);
      }
      try {
        snapshotRepository.ensureIdentity(account);
      } catch (RuntimeException e) {
        log.warn("Could not record identity {} after login: {}", account, e.getMessage());
      }
      return LoginResult.success(session.sessionId(), session.expiresAt());
    });
  }

  /**
   * Remove the session. False only when the store could not be reached; the entry then lapses by TTL.
   */
  public boolean logout(String sessionId) {
    try {
      sessionStore.delete(sessionId);
    } catch (SessionStoreUnavailableException e) {
      log.warn("Logout of session {} failed: {}", SessionIds.mask(sessionId), e.getMessage());
      return false;
    }
    log.info("Session {} logged out", SessionIds.mask(sessionId));
    return true;
  }

  public SyncResult<ProfileView> me(String sessionId, String requestId, boolean refresh) {
    return withRequestId(requestId, () -> syncService.fetch(sessionId, profileResource, "", refresh, requestId));
  }

  public SyncResult<SemesterList> semesters(String sessionId, String requestId, boolean refresh) {
    return withRequestId(requestId, () -> syncService.fetch(sessionId, semesterResource, "", refresh, requestId));
  }

  public SyncResult<GradeSheet> grades(String sessionId, String semester, String requestId, boolean refresh) {
    return withRequestId(requestId, () -> syncService.fetch(sessionId, gradeResource, semester, refresh, requestId));
  }

  public SyncResult<ScheduleView> schedule(String sessionId, String xnxq, String requestId, boolean refresh) {
    return withRequestId(requestId, () -> syncService.fetch(sessionId, scheduleResource, xnxq, refresh, requestId));
  }

  /**
   * Recent snapshot history of the session's identity, newest first.
   */
  public SyncResult<List<SnapshotView>> snapshots(String sessionId, String kind, String scope, Integer limit,
                                                  String requestId) {
    return withRequestId(requestId, () -> {
      Optional<PortalSession> session = sessionStore.get(sessionId);
      if (session.isEmpty()) {
        return SyncResult.failure(ReasonCode.SESSION_INVALID, "Session is missing or expired, please log in again", null);
      }
      ResourceKind resourceKind = null;
      if (kind != null && !kind.isBlank()) {
        Optional<ResourceKind> parsed = ResourceKind.fromCode(kind.trim());
        if (parsed.isEmpty()) {
          return SyncResult.failure(ReasonCode.INVALID_REQUEST, "Unknown snapshot kind: " + kind, null);
        }
        resourceKind = parsed.get();
      }
      int size = limit == null ? DEFAULT_SNAPSHOT_LIMIT : limit;
      if (size < 1 || size > SnapshotRepository.MAX_HISTORY) {
        return SyncResult.failure(ReasonCode.INVALID_REQUEST,
            "limit must be between 1 and " + SnapshotRepository.MAX_HISTORY, null);
      }
      return SyncResult.live(
          snapshotRepository.recent(session.get().account(), resourceKind, scope, size), List.of());
    });
  }

  private static <T> T withRequestId(String requestId, Supplier<T> call) {
    String previous = MDC.get(MDC_REQUEST_ID);
    MDC.put(MDC_REQUEST_ID, requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId);
    try {
      return call.get();
    } finally {
      if (previous == null) {
        MDC.remove(MDC_REQUEST_ID);
      } else {
        MDC.put(MDC_REQUEST_ID, previous);
      }
    }
  }
}
