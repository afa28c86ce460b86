package com.example.portalsync.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String API_BASE = "/api";
    public static final String ACADEMIC_BASE = "/academic";

    // Academic paths
    public static final String HEALTH = "/health";
    public static final String LOGIN = "/login";
    public static final String LOGOUT = "/logout";
    public static final String ME = "/me";
    public static final String SEMESTERS = "/semesters";
    public static final String GRADES = "/grades";
    public static final String SCHEDULE = "/schedule";
    public static final String SNAPSHOTS = "/snapshots";

    private ApiPath() {}
  }

  public static final class ApiHeader {
    public static final String SESSION_ID = "X-Session-Id";
    public static final String REQUEST_ID = "X-Request-Id";

    private ApiHeader() {}
  }

  private ApiConstants() {}
}
