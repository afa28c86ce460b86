package com.example.portalsync.web.rest.controller;

import static com.example.portalsync.web.rest.ApiConstants.ApiHeader.SESSION_ID;
import static com.example.portalsync.web.rest.ApiConstants.ApiPath.*;

import com.example.portalsync.domain.model.GradeSheet;
import com.example.portalsync.domain.model.HealthReport;
import com.example.portalsync.domain.model.LoginResult;
import com.example.portalsync.domain.model.ProfileView;
import com.example.portalsync.domain.model.ScheduleView;
import com.example.portalsync.domain.model.SemesterList;
import com.example.portalsync.domain.model.SnapshotView;
import com.example.portalsync.domain.model.SyncResult;
import com.example.portalsync.web.rest.dto.LoginRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Academic portal API.
 * Results carry {@code success}, {@code cached} and {@code fallback} flags; failures carry a reason code.
 */
@Tag(
    name = "Academic Portal",
    description = "Login against the academic portal and read profile, semesters, grades and timetable"
)
@RequestMapping(
    value = API_BASE + ACADEMIC_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AcademicAPI {

  @Operation(
      summary = "Upstream reachability",
      description = "Probes the academic portal login page without following redirects"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Probe result returned")
  })
  @GetMapping(value = HEALTH)
  ResponseEntity<HealthReport> health();

  @Operation(
      summary = "Log in",
      description = "Performs the portal form login and returns a session id for the X-Session-Id header"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Logged in"),
      @ApiResponse(responseCode = "400", description = "Username or password missing"),
      @ApiResponse(responseCode = "401", description = "Credentials rejected by the portal"),
      @ApiResponse(responseCode = "502", description = "Portal unreachable"),
      @ApiResponse(responseCode = "503", description = "Session storage unavailable")
  })
  @PostMapping(value = LOGIN, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<LoginResult> login(@Valid @RequestBody LoginRequest loginRequest);

  @Operation(summary = "Log out", description = "Drops the local session")
  @PostMapping(value = LOGOUT)
  ResponseEntity<Map<String, Object>> logout(
      @RequestHeader(value = SESSION_ID, required = false) String sessionId);

  @Operation(summary = "Student profile")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Profile returned, possibly from cache or snapshot"),
      @ApiResponse(responseCode = "401", description = "Session missing or expired"),
      @ApiResponse(responseCode = "502", description = "Portal unreachable and no snapshot available")
  })
  @GetMapping(value = ME)
  ResponseEntity<SyncResult<ProfileView>> me(
      @RequestHeader(value = SESSION_ID, required = false) String sessionId,
      @Parameter(description = "Bypass the hot cache") @RequestParam(defaultValue = "false") boolean refresh);

  @Operation(summary = "Semester options")
  @GetMapping(value = SEMESTERS)
  ResponseEntity<SyncResult<SemesterList>> semesters(
      @RequestHeader(value = SESSION_ID, required = false) String sessionId,
      @RequestParam(defaultValue = "false") boolean refresh);

  @Operation(summary = "Grades", description = "Grades of one semester, or all semesters when omitted")
  @GetMapping(value = GRADES)
  ResponseEntity<SyncResult<GradeSheet>> grades(
      @RequestHeader(value = SESSION_ID, required = false) String sessionId,
      @Parameter(description = "Semester code, e.g. 2024-2025-1") @RequestParam(required = false) String semester,
      @RequestParam(defaultValue = "false") boolean refresh);

  @Operation(summary = "Weekly timetable", description = "Timetable of one term, or the current term when omitted")
  @GetMapping(value = SCHEDULE)
  ResponseEntity<SyncResult<ScheduleView>> schedule(
      @RequestHeader(value = SESSION_ID, required = false) String sessionId,
      @Parameter(description = "Term code, e.g. 2024-2025-1") @RequestParam(required = false) String xnxq,
      @RequestParam(defaultValue = "false") boolean refresh);

  @Operation(summary = "Snapshot history", description = "Most recent stored extractions, newest first")
  @GetMapping(value = SNAPSHOTS)
  ResponseEntity<SyncResult<List<SnapshotView>>> snapshots(
      @RequestHeader(value = SESSION_ID, required = false) String sessionId,
      @Parameter(description = "me, semesters, grades or schedule") @RequestParam(required = false) String kind,
      @RequestParam(required = false) String scope,
      @RequestParam(required = false) Integer limit);
}
