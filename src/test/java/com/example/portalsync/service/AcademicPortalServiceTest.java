package com.example.portalsync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

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
import com.example.portalsync.domain.model.ReasonCode;
import com.example.portalsync.domain.model.ResourceKind;
import com.example.portalsync.domain.model.SnapshotView;
import com.example.portalsync.domain.model.SyncResult;
import com.example.portalsync.exception.SessionStoreUnavailableException;
import com.example.portalsync.exception.UpstreamUnreachableException;
import com.example.portalsync.repository.SnapshotRepository;
import com.example.portalsync.service.resource.GradeResource;
import com.example.portalsync.service.resource.ProfileResource;
import com.example.portalsync.service.resource.ScheduleResource;
import com.example.portalsync.service.resource.SemesterResource;
import com.example.portalsync.service.session.PortalSessionStore;
import com.example.portalsync.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@ExtendWith(MockitoExtension.class)
class AcademicPortalServiceTest {

  private static final Instant NOW = Instant.parse("2025-03-01T08:00:00Z");

  @Mock
  private PortalTransport transport;
  @Mock
  private LoginFlow loginFlow;
  @Mock
  private PortalSessionStore sessionStore;
  @Mock
  private SyncService syncService;
  @Mock
  private SnapshotRepository snapshotRepository;
  @Mock
  private ProfileResource profileResource;
  @Mock
  private SemesterResource semesterResource;
  @Mock
  private GradeResource gradeResource;
  @Mock
  private ScheduleResource scheduleResource;

  private AcademicPortalService service;

  private final PortalSession session = new PortalSession("sid", "20210001", Map.of("JSESSIONID", "abc"),
      NOW, NOW.plus(Duration.ofHours(8)), NOW.plus(Duration.ofMinutes(30)));

  @BeforeEach
  void setUp() {
    service = new AcademicPortalService(transport, loginFlow, sessionStore, syncService, snapshotRepository,
        profileResource, semesterResource, gradeResource, scheduleResource, TestProperties.defaults());
  }

  @Test
  void healthTreatsRedirectAsReachable() {
    when(transport.execute(any(PortalRequest.class), any(SessionCookieJar.class))).thenReturn(
        new PortalResponse(302, "https://portal.example.edu/jsxsd/xk/LoginToXk", "/jsxsd/", "", "text/html", 0));

    HealthReport report = service.health("req");

    assertThat(report.reachable()).isTrue();
    assertThat(report.statusCode()).isEqualTo(302);
    assertThat(report.redirectLocation()).isEqualTo("/jsxsd/");
  }

  @Test
  void healthTreatsServerErrorAsUnreachable() {
    when(transport.execute(any(PortalRequest.class), any(SessionCookieJar.class))).thenReturn(
        new PortalResponse(502, "https://portal.example.edu/jsxsd/xk/LoginToXk", null, "bad gateway", "text/html", 11));

    HealthReport report = service.health("req");

    assertThat(report.reachable()).isFalse();
    assertThat(report.contentSample()).isEqualTo("bad gateway");
  }

  @Test
  void healthReportsNetworkFailure() {
    when(transport.execute(any(PortalRequest.class), any(SessionCookieJar.class)))
        .thenThrow(new UpstreamUnreachableException("connect timed out"));

    HealthReport report = service.health("req");

    assertThat(report.reachable()).isFalse();
    assertThat(report.message()).isEqualTo("connect timed out");
  }

  @Test
  void blankCredentialsAreInvalidRequest() {
    LoginResult result = service.login("  ", "pa55", "req");

    assertThat(result.success()).isFalse();
    assertThat(result.reason()).isEqualTo(ReasonCode.INVALID_REQUEST);
    verifyNoInteractions(loginFlow, sessionStore);
  }

  @Test
  void successfulLoginCreatesSessionAndIdentity() {
    Map<String, String> cookies = Map.of("JSESSIONID", "abc");
    when(loginFlow.login("20210001", "pa55", "req"))
        .thenReturn(new LoginOutcome(true, cookies, Diagnostic.of(302, "/jsxsd/framework/xsMain.jsp", "")));
    when(sessionStore.create("20210001", cookies)).thenReturn(session);

    LoginResult result = service.login(" 20210001 ", "pa55", "req");

    assertThat(result.success()).isTrue();
    assertThat(result.sessionId()).isEqualTo("sid");
    assertThat(result.expiresAt()).isEqualTo(session.expiresAt());
    verify(snapshotRepository).ensureIdentity("20210001");
  }

  @Test
  void identityFailureDoesNotFailLogin() {
    when(loginFlow.login("20210001", "pa55", "req"))
        .thenReturn(new LoginOutcome(true, Map.of(), Diagnostic.of(302, "/jsxsd/framework/xsMain.jsp", "")));
    when(sessionStore.create(eq("20210001"), any())).thenReturn(session);
    when(snapshotRepository.ensureIdentity("20210001")).thenThrow(new DataIntegrityViolationException("dup"));

    assertThat(service.login("20210001", "pa55", "req").success()).isTrue();
  }

  @Test
  void rejectedCredentialsCreateNoSession() {
    Diagnostic diagnostic = Diagnostic.of(200, null, "<html>请先登录</html>");
    when(loginFlow.login("20210001", "wrong", "req")).thenReturn(new LoginOutcome(false, Map.of(), diagnostic));

    LoginResult result = service.login("20210001", "wrong", "req");

    assertThat(result.success()).isFalse();
    assertThat(result.reason()).isEqualTo(ReasonCode.CREDENTIALS_REJECTED);
    assertThat(result.diagnostic()).isEqualTo(diagnostic);
    verify(sessionStore, never()).create(anyString(), any());
  }

  @Test
  void unreachablePortalDuringLoginIsReported() {
    when(loginFlow.login("20210001", "pa55", "req")).thenThrow(new UpstreamUnreachableException("timeout"));

    LoginResult result = service.login("20210001", "pa55", "req");

    assertThat(result.reason()).isEqualTo(ReasonCode.UPSTREAM_UNREACHABLE);
    assertThat(result.message()).isEqualTo("timeout");
  }

  @Test
  void sessionStoreOutageAfterUpstreamLoginIsAStructuredFailure() {
    when(loginFlow.login("20210001", "pa55", "req"))
        .thenReturn(new LoginOutcome(true, Map.of(), Diagnostic.of(302, "/jsxsd/framework/xsMain.jsp", "")));
    when(sessionStore.create(eq("20210001"), any()))
        .thenThrow(new SessionStoreUnavailableException("Failed to create session", new IllegalStateException("down")));

    LoginResult result = service.login("20210001", "pa55", "req");

    assertThat(result.success()).isFalse();
    assertThat(result.reason()).isEqualTo(ReasonCode.SESSION_STORE_UNAVAILABLE);
    assertThat(result.sessionId()).isNull();
    verify(snapshotRepository, never()).ensureIdentity(anyString());
  }

  @Test
  void logoutIsIdempotent() {
    assertThat(service.logout("sid")).isTrue();
    assertThat(service.logout(null)).isTrue();
    verify(sessionStore).delete("sid");
  }

  @Test
  void logoutDuringStoreOutageReportsFailureInsteadOfThrowing() {
    doThrow(new SessionStoreUnavailableException("Failed to delete session", new IllegalStateException("down")))
        .when(sessionStore).delete("sid");

    assertThat(service.logout("sid")).isFalse();
  }

  @Test
  void gradesDelegateWithSemesterScope() {
    SyncResult<GradeSheet> expected = SyncResult.cached(GradeSheet.empty());
    when(syncService.fetch("sid", gradeResource, "2024-2025-1", false, "req")).thenReturn(expected);

    assertThat(service.grades("sid", "2024-2025-1", "req", false)).isSameAs(expected);
  }

  @Test
  void requestIdIsScopedToTheCall() {
    MDC.put(AcademicPortalService.MDC_REQUEST_ID, "outer");
    try {
      when(syncService.fetch("sid", profileResource, "", false, "inner")).thenAnswer(invocation -> {
        assertThat(MDC.get(AcademicPortalService.MDC_REQUEST_ID)).isEqualTo("inner");
        return SyncResult.failure(ReasonCode.SESSION_INVALID, "gone", null);
      });

      service.me("sid", "inner", false);

      assertThat(MDC.get(AcademicPortalService.MDC_REQUEST_ID)).isEqualTo("outer");
    } finally {
      MDC.remove(AcademicPortalService.MDC_REQUEST_ID);
    }
  }

  @Test
  void snapshotsNeedASession() {
    when(sessionStore.get("gone")).thenReturn(Optional.empty());

    assertThat(service.snapshots("gone", null, null, null, "req").reason()).isEqualTo(ReasonCode.SESSION_INVALID);
  }

  @Test
  void snapshotsRejectUnknownKindAndBadLimit() {
    when(sessionStore.get("sid")).thenReturn(Optional.of(session));

    assertThat(service.snapshots("sid", "timetable", null, null, "req").reason())
        .isEqualTo(ReasonCode.INVALID_REQUEST);
    assertThat(service.snapshots("sid", "grades", null, 0, "req").reason()).isEqualTo(ReasonCode.INVALID_REQUEST);
    assertThat(service.snapshots("sid", "grades", null, 101, "req").reason()).isEqualTo(ReasonCode.INVALID_REQUEST);
    verifyNoInteractions(snapshotRepository);
  }

  @Test
  void snapshotsDefaultToTenNewest() {
    when(sessionStore.get("sid")).thenReturn(Optional.of(session));
    List<SnapshotView> views = List.of();
    when(snapshotRepository.recent("20210001", ResourceKind.GRADES, "2024-2025-1", 10)).thenReturn(views);

    SyncResult<List<SnapshotView>> result = service.snapshots("sid", "grades", "2024-2025-1", null, "req");

    assertThat(result.success()).isTrue();
    assertThat(result.data()).isSameAs(views);
  }
}
