package com.example.portalsync.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of upstream resources that are fetched, cached and snapshotted.
 * The code is the stored snapshot kind and the hot cache key segment.
 */
public enum ResourceKind {
  PROFILE("me", ""),
  SEMESTERS("semesters", ""),
  GRADES("grades", "all"),
  SCHEDULE("schedule", "current");

  private final String code;
  private final String defaultScopeLabel;

  ResourceKind(String code, String defaultScopeLabel) {
    this.code = code;
    this.defaultScopeLabel = defaultScopeLabel;
  }

  public String code() {
    return code;
  }

  public boolean isScoped() {
    return !defaultScopeLabel.isEmpty();
  }

  public String cacheKey(String owner, String scope) {
    String key = "academic:" + code + ":" + owner;
    if (!isScoped()) {
      return key;
    }
    return key + ":" + (scope == null || scope.isBlank() ? defaultScopeLabel : scope);
  }

  public static Optional<ResourceKind> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    return Arrays.stream(values())
        .filter(k -> k.code.equalsIgnoreCase(code) || k.name().equalsIgnoreCase(code))
        .findFirst();
  }
}
