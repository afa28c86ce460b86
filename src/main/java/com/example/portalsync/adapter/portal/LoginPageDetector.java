package com.example.portalsync.adapter.portal;

import com.example.portalsync.properties.ApplicationProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * The single definition of "the upstream sent us back to its login page".
 * Shared by the login flow and every page extractor.
 */
@Component
public class LoginPageDetector {

  private final List<String> locationMarkers;
  private final List<String> pageMarkers;
  private final List<String> homeMarkers;

  public LoginPageDetector(ApplicationProperties properties) {
    this(properties.portal().markers());
  }

  public LoginPageDetector(ApplicationProperties.PortalProperties.MarkerProperties markers) {
    this.locationMarkers = lower(markers.loginLocation());
    this.pageMarkers = lower(markers.loginPage());
    this.homeMarkers = lower(markers.home());
  }

  /**
   * True when a redirect target points back at the login endpoint.
   */
  public boolean isLoginLocation(String location) {
    return location != null && containsAny(location, locationMarkers);
  }

  /**
   * True when a response body is the login form rather than content.
   */
  public boolean looksLikeLoginPage(String html) {
    return html != null && containsAny(html, pageMarkers);
  }

  /**
   * True when a response body is the authenticated home frame.
   */
  public boolean looksLikeHomePage(String html) {
    return html != null && containsAny(html, homeMarkers);
  }

  /**
   * True when a data page response means the upstream session is gone.
   */
  public boolean isLoginResponse(PortalResponse response) {
    if (response.isRedirect()) {
      return isLoginLocation(response.location());
    }
    return looksLikeLoginPage(response.body());
  }

  private static boolean containsAny(String text, List<String> markers) {
    String haystack = text.toLowerCase(Locale.ROOT);
    for (String marker : markers) {
      if (haystack.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  private static List<String> lower(List<String> markers) {
    return markers.stream()
        .filter(m -> m != null && !m.isBlank())
        .map(m -> m.toLowerCase(Locale.ROOT))
        .toList();
  }
}
