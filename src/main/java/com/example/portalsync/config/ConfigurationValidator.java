package com.example.portalsync.config;

import com.example.portalsync.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configuration validator that enforces cross-field rules beyond JSR-303 validation.
 * Fails startup with every violation listed at once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_PATH_PREFIX = "%s must start with '/': %s";
  private static final String ERROR_MUST_BE_POSITIVE = "%s must be positive.";
  private static final String ERROR_MIN_DURATION = "%s must be at least %s.";
  private static final String PATH_PREFIX_SLASH = "/";
  private static final Duration MIN_LOCK_TTL = Duration.ofSeconds(1);

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = new ArrayList<>();

    validatePortalConfig(errors);
    validateSessionConfig(errors);
    validateCacheConfig(errors);
    validateSyncConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validatePortalConfig(List<String> errors) {
    ApplicationProperties.PortalProperties portal = properties.portal();
    if (!isValidHttpUrl(portal.baseUrl())) {
      errors.add(ERROR_INVALID_URL.formatted("Academic portal base URL", portal.baseUrl()));
    }
    Map<String, String> paths = Map.of(
        "Health path", portal.healthPath(),
        "Login path", portal.loginPath(),
        "Profile path", portal.profilePath(),
        "Semesters path", portal.semestersPath(),
        "Grades path", portal.gradesPath(),
        "Schedule path", portal.schedulePath());
    paths.forEach((name, path) -> {
      if (path == null || !path.startsWith(PATH_PREFIX_SLASH)) {
        errors.add(ERROR_PATH_PREFIX.formatted(name, path));
      }
    });
    if (isNotPositive(portal.connectTimeout())) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Portal connect timeout"));
    }
    if (isNotPositive(portal.readTimeout())) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Portal read timeout"));
    }
    if (portal.insecureSkipVerify()) {
      log.warn("app.portal.insecure-skip-verify is enabled; only use this against test portals");
    }
  }

  private void validateSessionConfig(List<String> errors) {
    ApplicationProperties.SessionProperties session = properties.session();
    if (isNotPositive(session.absoluteTtl()) || isNotPositive(session.idleTtl())) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Session absolute and idle TTL"));
    } else if (session.idleTtl().compareTo(session.absoluteTtl()) > 0) {
      errors.add("Session idle TTL (%s) must not exceed absolute TTL (%s)"
          .formatted(session.idleTtl(), session.absoluteTtl()));
    }
  }

  private void validateCacheConfig(List<String> errors) {
    ApplicationProperties.CacheProperties cache = properties.cache();
    if (isNotPositive(cache.profileTtl()) || isNotPositive(cache.semestersTtl())
        || isNotPositive(cache.gradesTtl()) || isNotPositive(cache.scheduleTtl())) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Every hot cache TTL"));
    }
  }

  private void validateSyncConfig(List<String> errors) {
    ApplicationProperties.SyncProperties sync = properties.sync();
    if (sync.lockTtl().compareTo(MIN_LOCK_TTL) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Sync lock TTL", "1 second"));
    }
    if (sync.lockWait().isNegative()) {
      errors.add("Sync lock wait cannot be negative.");
    }
    if (sync.lockWait().compareTo(sync.lockTtl()) > 0) {
      errors.add("Sync lock wait (%s) must not exceed lock TTL (%s)".formatted(sync.lockWait(), sync.lockTtl()));
    }
  }

  private static boolean isNotPositive(Duration duration) {
    return duration == null || duration.isZero() || duration.isNegative();
  }

  private static boolean isValidHttpUrl(String url) {
    if (url == null) {
      return false;
    }
    try {
      URI uri = new URI(url);
      return uri.getHost() != null
          && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()));
    } catch (URISyntaxException e) {
      return false;
    }
  }
}
