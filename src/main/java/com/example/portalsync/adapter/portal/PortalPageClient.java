package com.example.portalsync.adapter.portal;

import com.example.portalsync.domain.model.Diagnostic;
import com.example.portalsync.domain.model.PortalSession;
import com.example.portalsync.exception.SessionInvalidException;
import com.example.portalsync.exception.UpstreamUnreachableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fetches data pages with the cookies held by an authenticated session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PortalPageClient {

  private final PortalTransport transport;
  private final LoginPageDetector loginPageDetector;

  /**
   * Fetch a page and reject anything that is not a 2xx content response.
   * A redirect to the login endpoint is a dead upstream session, any other
   * redirect or status is treated as the upstream being unavailable.
   */
  public PortalResponse fetch(PortalSession session, PortalRequest request) {
    PortalResponse response = transport.execute(request, new SessionCookieJar(session.cookies()));

    if (response.isRedirect()) {
      if (loginPageDetector.isLoginLocation(response.location())) {
        throw new SessionInvalidException("Upstream session expired: redirected to login");
      }
      throw new UpstreamUnreachableException(
          "Unexpected upstream redirect for " + request.path(),
          Diagnostic.of(response.statusCode(), response.location(), response.body()),
          null);
    }
    if (!response.isOk()) {
      throw new UpstreamUnreachableException(
          "Upstream responded with HTTP " + response.statusCode() + " for " + request.path(),
          Diagnostic.of(response.statusCode(), response.location(), response.body()),
          null);
    }
    return response;
  }
}
