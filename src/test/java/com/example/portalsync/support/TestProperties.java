package com.example.portalsync.support;

import com.example.portalsync.properties.ApplicationProperties;
import com.example.portalsync.properties.ApplicationProperties.*;

import java.time.Duration;
import java.util.List;

/**
 * Property trees for tests that construct beans by hand.
 */
public final class TestProperties {

  public static final List<String> LOGIN_LOCATION_MARKERS = List.of("LoginToXk", "login", "Logon.do");
  public static final List<String> LOGIN_PAGE_MARKERS =
      List.of("name=\"userAccount\"", "id=\"userAccount\"", "name=\"userPassword\"", "name=\"encoded\"", "请先登录");
  public static final List<String> HOME_MARKERS =
      List.of("xsMain.jsp", "framework/xsMain", "framework/main", "mainFrame", "main_frame");

  private TestProperties() {
  }

  public static ApplicationProperties defaults() {
    return withPortal("https://portal.example.edu");
  }

  public static ApplicationProperties withPortal(String baseUrl) {
    return new ApplicationProperties(
        portal(baseUrl),
        new SessionProperties(Duration.ofHours(8), Duration.ofMinutes(30)),
        new StoreProperties("memory"),
        redis(),
        cache(),
        new SyncProperties(true, Duration.ofSeconds(30), Duration.ofMillis(300)),
        new ExtractorProperties("auto"));
  }

  public static ApplicationProperties with(PortalProperties portal, SessionProperties session,
                                           CacheProperties cache, SyncProperties sync) {
    return new ApplicationProperties(
        portal, session, new StoreProperties("memory"), redis(), cache, sync, new ExtractorProperties("auto"));
  }

  public static PortalProperties portal(String baseUrl) {
    return new PortalProperties(
        baseUrl,
        "/jsxsd/xk/LoginToXk",
        "/jsxsd/xk/LoginToXk",
        "/jsxsd/grxx/xsxx",
        "/jsxsd/kscj/cjcx_query",
        "/jsxsd/kscj/cjcx_list",
        "/jsxsd/xskb/xskb_list.do",
        "portal-sync-test",
        Duration.ofSeconds(2),
        Duration.ofSeconds(2),
        false,
        markers());
  }

  public static PortalProperties.MarkerProperties markers() {
    return new PortalProperties.MarkerProperties(LOGIN_LOCATION_MARKERS, LOGIN_PAGE_MARKERS, HOME_MARKERS);
  }

  public static CacheProperties cache() {
    return new CacheProperties(
        Duration.ofHours(24), Duration.ofHours(12), Duration.ofHours(6), Duration.ofHours(6), 1000);
  }

  public static RedisProperties redis() {
    return new RedisProperties("localhost", 6379, null, 0, false, Duration.ofSeconds(2),
        new RedisProperties.PoolProperties(16, 8, 2, Duration.ofSeconds(2)));
  }
}
