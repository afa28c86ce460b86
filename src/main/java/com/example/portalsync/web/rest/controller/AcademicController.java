package com.example.portalsync.web.rest.controller;

import com.example.portalsync.domain.model.GradeSheet;
import com.example.portalsync.domain.model.HealthReport;
import com.example.portalsync.domain.model.LoginResult;
import com.example.portalsync.domain.model.ProfileView;
import com.example.portalsync.domain.model.ReasonCode;
import com.example.portalsync.domain.model.ScheduleView;
import com.example.portalsync.domain.model.SemesterList;
import com.example.portalsync.domain.model.SnapshotView;
import com.example.portalsync.domain.model.SyncResult;
import com.example.portalsync.service.AcademicPortalService;
import com.example.portalsync.web.filter.RequestIdFilter;
import com.example.portalsync.web.rest.ApiConstants;
import com.example.portalsync.web.rest.dto.LoginRequest;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Thin HTTP mapping over {@link AcademicPortalService}. Failed results keep their body and get
 * the status their reason code names.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AcademicController implements AcademicAPI {

  private final AcademicPortalService academicPortalService;
  private final HttpServletRequest request;

  @Override
  public ResponseEntity<HealthReport> health() {
    return ResponseEntity.ok(academicPortalService.health(requestId()));
  }

  @Override
  public ResponseEntity<LoginResult> login(LoginRequest loginRequest) {
    LoginResult result = academicPortalService.login(
        loginRequest.username(), loginRequest.password(), requestId());
    return ResponseEntity.status(statusOf(result.success(), result.reason())).body(result);
  }

  @Override
  public ResponseEntity<Map<String, Object>> logout(String sessionId) {
    return ResponseEntity.ok(Map.of("success", academicPortalService.logout(sessionId)));
  }

  @Override
  public ResponseEntity<SyncResult<ProfileView>> me(String sessionId, boolean refresh) {
    return respond(academicPortalService.me(sessionId, requestId(), refresh));
  }

  @Override
  public ResponseEntity<SyncResult<SemesterList>> semesters(String sessionId, boolean refresh) {
    return respond(academicPortalService.semesters(sessionId, requestId(), refresh));
  }

  @Override
  public ResponseEntity<SyncResult<GradeSheet>> grades(String sessionId, String semester, boolean refresh) {
    return respond(academicPortalService.grades(sessionId, semester, requestId(), refresh));
  }

  @Override
  public ResponseEntity<SyncResult<ScheduleView>> schedule(String sessionId, String xnxq, boolean refresh) {
    return respond(academicPortalService.schedule(sessionId, xnxq, requestId(), refresh));
  }

  @Override
  public ResponseEntity<SyncResult<List<SnapshotView>>> snapshots(String sessionId, String kind, String scope,
                                                                   Integer limit) {
    return respond(academicPortalService.snapshots(sessionId, kind, scope, limit, requestId()));
  }

  private static <T> ResponseEntity<SyncResult<T>> respond(SyncResult<T> result) {
    return ResponseEntity.status(statusOf(result.success(), result.reason())).body(result);
  }

  static HttpStatus statusOf(boolean success, ReasonCode reason) {
    if (success || reason == null) {
      return HttpStatus.OK;
    }
    return reason.httpStatus();
  }

  private String requestId() {
    Object attribute = request.getAttribute(RequestIdFilter.REQUEST_ID_ATTRIBUTE);
    if (attribute instanceof String requestId) {
      return requestId;
    }
    return RequestIdFilter.resolve(request.getHeader(ApiConstants.ApiHeader.REQUEST_ID));
  }
}
