package com.example.portalsync.adapter.portal;

import com.example.portalsync.domain.model.Diagnostic;
import com.example.portalsync.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drives the upstream form login: a warm-up GET of the login page, then the
 * credential POST, both sharing one cookie jar.
 */
@Slf4j
@Component
public class LoginFlow {

  static final String FIELD_ACCOUNT = "userAccount";
  static final String FIELD_PASSWORD = "userPassword";
  static final String FIELD_ENCODED = "encoded";

  private final PortalTransport transport;
  private final CredentialEncoder credentialEncoder;
  private final LoginPageDetector loginPageDetector;
  private final ApplicationProperties.PortalProperties portal;

  public LoginFlow(PortalTransport transport,
                   CredentialEncoder credentialEncoder,
                   LoginPageDetector loginPageDetector,
                   ApplicationProperties properties) {
    this.transport = transport;
    this.credentialEncoder = credentialEncoder;
    this.loginPageDetector = loginPageDetector;
    this.portal = properties.portal();
  }

  /**
   * Perform the handshake and interpret the response.
   *
   * @throws com.example.portalsync.exception.UpstreamUnreachableException on network errors or timeouts
   */
  public LoginOutcome login(String username, String password, String requestId) {
    if (username == null || username.isBlank() || password == null || password.isEmpty()) {
      throw new IllegalArgumentException("Username and password must not be empty");
    }

    SessionCookieJar cookieJar = new SessionCookieJar();
    transport.execute(PortalRequest.get(portal.healthPath(), requestId), cookieJar);

    Map<String, String> form = new LinkedHashMap<>();
    form.put(FIELD_ACCOUNT, username);
    form.put(FIELD_PASSWORD, "");
    form.put(FIELD_ENCODED, credentialEncoder.encode(username, password));

    PortalResponse response = transport.execute(PortalRequest.post(portal.loginPath(), form, requestId), cookieJar);
    boolean success = isAuthenticated(response);

    Diagnostic diagnostic = Diagnostic.of(response.statusCode(), response.location(), response.body());
    if (!success) {
      log.info("Upstream login rejected: status={}, location={}", response.statusCode(), response.location());
    }
    return new LoginOutcome(success, success ? cookieJar.snapshot() : Map.of(), diagnostic);
  }

  boolean isAuthenticated(PortalResponse response) {
    if (response.isRedirect()) {
      return !loginPageDetector.isLoginLocation(response.location());
    }
    if (response.statusCode() == 200) {
      return loginPageDetector.looksLikeHomePage(response.body());
    }
    return false;
  }
}
