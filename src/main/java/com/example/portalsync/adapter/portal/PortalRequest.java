package com.example.portalsync.adapter.portal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One request against the upstream portal. A non-null form makes it a form POST.
 */
public record PortalRequest(
    String path,
    Map<String, String> query,
    Map<String, String> form,
    String requestId
) {

  public PortalRequest {
    query = query == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(query));
    form = form == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(form));
  }

  public static PortalRequest get(String path, String requestId) {
    return new PortalRequest(path, null, null, requestId);
  }

  public static PortalRequest get(String path, Map<String, String> query, String requestId) {
    return new PortalRequest(path, query, null, requestId);
  }

  public static PortalRequest post(String path, Map<String, String> form, String requestId) {
    return new PortalRequest(path, null, form, requestId);
  }

  public boolean isPost() {
    return form != null;
  }
}
