package com.example.portalsync.web.rest.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.matchesPattern;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.portalsync.domain.model.GradeSheet;
import com.example.portalsync.domain.model.HealthReport;
import com.example.portalsync.domain.model.LoginResult;
import com.example.portalsync.domain.model.ProfileView;
import com.example.portalsync.domain.model.ReasonCode;
import com.example.portalsync.domain.model.ScheduleView;
import com.example.portalsync.domain.model.SyncResult;
import com.example.portalsync.service.AcademicPortalService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@WebMvcTest(AcademicController.class)
class AcademicControllerTest {

  private static final String BASE = "/api/academic";
  private static final String SESSION = "s".repeat(43);

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private AcademicPortalService academicPortalService;

  @Test
  void loginSuccessReturnsSessionId() throws Exception {
    when(academicPortalService.login(eq("20210001"), eq("pa55"), anyString()))
        .thenReturn(LoginResult.success(SESSION, Instant.parse("2024-09-02T16:00:00Z")));

    mockMvc.perform(post(BASE + "/login")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"username\":\"20210001\",\"password\":\"pa55\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.sessionId").value(SESSION))
        .andExpect(jsonPath("$.reason").doesNotExist());
  }

  @Test
  void rejectedCredentialsMapTo401() throws Exception {
    when(academicPortalService.login(anyString(), anyString(), anyString()))
        .thenReturn(LoginResult.failure(ReasonCode.CREDENTIALS_REJECTED, "rejected", null));

    mockMvc.perform(post(BASE + "/login")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"username\":\"20210001\",\"password\":\"wrong\"}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.reason").value("CREDENTIALS_REJECTED"));
  }

  @Test
  void blankPasswordIsRejectedBeforeTheService() throws Exception {
    mockMvc.perform(post(BASE + "/login")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"username\":\"20210001\",\"password\":\"\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.reason").value("INVALID_REQUEST"))
        .andExpect(jsonPath("$.message").value("password is required"))
        .andExpect(jsonPath("$.requestId").exists());

    verifyNoInteractions(academicPortalService);
  }

  @Test
  void malformedBodyIs400() throws Exception {
    mockMvc.perform(post(BASE + "/login")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"username\":"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("INVALID_REQUEST"));
  }

  @Test
  void wrongMethodIs405() throws Exception {
    mockMvc.perform(get(BASE + "/login"))
        .andExpect(status().isMethodNotAllowed())
        .andExpect(jsonPath("$.reason").value("METHOD_NOT_ALLOWED"));
  }

  @Test
  void sessionHeaderAndQueryAreForwarded() throws Exception {
    when(academicPortalService.grades(eq(SESSION), eq("2024-2025-1"), anyString(), eq(true)))
        .thenReturn(SyncResult.live(new GradeSheet(List.of("成绩"), List.of(Map.of("成绩", "92"))), List.of()));

    mockMvc.perform(get(BASE + "/grades")
            .header("X-Session-Id", SESSION)
            .param("semester", "2024-2025-1")
            .param("refresh", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.cached").value(false))
        .andExpect(jsonPath("$.data.rows[0]['成绩']").value("92"));
  }

  @Test
  void missingSessionMapsTo401() throws Exception {
    when(academicPortalService.me(isNull(), anyString(), anyBoolean()))
        .thenReturn(SyncResult.failure(ReasonCode.SESSION_INVALID, "Session is missing or expired", null));

    mockMvc.perform(get(BASE + "/me"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.reason").value("SESSION_INVALID"));
  }

  @Test
  void fallbackResultIsStill200() throws Exception {
    when(academicPortalService.schedule(eq(SESSION), isNull(), anyString(), eq(false)))
        .thenReturn(SyncResult.fallback(new ScheduleView("2024-2025-1", 5, List.of()),
            ReasonCode.UPSTREAM_UNREACHABLE, "timeout", Instant.parse("2024-09-01T08:00:00Z")));

    mockMvc.perform(get(BASE + "/schedule").header("X-Session-Id", SESSION))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.fallback").value(true))
        .andExpect(jsonPath("$.reason").value("UPSTREAM_UNREACHABLE"))
        .andExpect(jsonPath("$.data.currentWeek").value(5));
  }

  @Test
  void unreachableWithoutSnapshotIs502() throws Exception {
    when(academicPortalService.me(eq(SESSION), anyString(), anyBoolean()))
        .thenReturn(SyncResult.<ProfileView>failure(ReasonCode.UPSTREAM_UNREACHABLE, "timeout", null));

    mockMvc.perform(get(BASE + "/me").header("X-Session-Id", SESSION))
        .andExpect(status().isBadGateway());
  }

  @Test
  void nonNumericLimitIs400() throws Exception {
    mockMvc.perform(get(BASE + "/snapshots").header("X-Session-Id", SESSION).param("limit", "ten"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Invalid value for parameter: limit"));
  }

  @Test
  void snapshotsForwardFilters() throws Exception {
    when(academicPortalService.snapshots(eq(SESSION), eq("grades"), eq("2024-2025-1"), eq(5), anyString()))
        .thenReturn(SyncResult.live(List.of(), List.of()));

    mockMvc.perform(get(BASE + "/snapshots")
            .header("X-Session-Id", SESSION)
            .param("kind", "grades")
            .param("scope", "2024-2025-1")
            .param("limit", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data").isArray());
  }

  @Test
  void logoutReportsSuccess() throws Exception {
    when(academicPortalService.logout(SESSION)).thenReturn(true);

    mockMvc.perform(post(BASE + "/logout").header("X-Session-Id", SESSION))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true));

    verify(academicPortalService).logout(SESSION);
  }

  @Test
  void callerRequestIdIsPassedThroughAndEchoed() throws Exception {
    when(academicPortalService.health("trace-123"))
        .thenReturn(new HealthReport(true, 302, "https://portal.example.edu/jsxsd/xk/LoginToXk",
            "/jsxsd/", null, 0L, null, null));

    mockMvc.perform(get(BASE + "/health").header("X-Request-Id", "trace-123"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Request-Id", "trace-123"))
        .andExpect(jsonPath("$.reachable").value(true))
        .andExpect(jsonPath("$.statusCode").value(302));
  }

  @Test
  void unsafeRequestIdIsReplaced() throws Exception {
    when(academicPortalService.health(anyString())).thenReturn(HealthReport.unreachable("down"));

    mockMvc.perform(get(BASE + "/health").header("X-Request-Id", "bad id; drop"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Request-Id", matchesPattern("[0-9a-f\\-]{36}")))
        .andExpect(jsonPath("$.reachable").value(false));
  }

  @Test
  void unexpectedErrorIs500WithoutDetails() throws Exception {
    when(academicPortalService.semesters(any(), anyString(), anyBoolean()))
        .thenThrow(new IllegalStateException("secret detail"));

    mockMvc.perform(get(BASE + "/semesters").header("X-Session-Id", SESSION))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.reason").value("INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("An error occurred processing your request"));
  }

  @Test
  void statusFollowsReasonOnlyOnFailure() {
    assertThat(AcademicController.statusOf(true, ReasonCode.EXTRACTION_DEGRADED)).isEqualTo(HttpStatus.OK);
    assertThat(AcademicController.statusOf(false, null)).isEqualTo(HttpStatus.OK);
    assertThat(AcademicController.statusOf(false, ReasonCode.INVALID_REQUEST)).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(AcademicController.statusOf(false, ReasonCode.SESSION_STORE_UNAVAILABLE))
        .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
  }
}
