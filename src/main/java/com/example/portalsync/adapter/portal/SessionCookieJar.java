package com.example.portalsync.adapter.portal;

import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cookie jar for one logical upstream session. Cookies are keyed by name only,
 * since every call targets the same upstream host.
 */
public class SessionCookieJar implements CookieJar {

  private final Map<String, String> cookies = new LinkedHashMap<>();

  public SessionCookieJar() {
  }

  public SessionCookieJar(Map<String, String> initial) {
    if (initial != null) {
      cookies.putAll(initial);
    }
  }

  @Override
  public synchronized void saveFromResponse(HttpUrl url, List<Cookie> received) {
    long now = System.currentTimeMillis();
    for (Cookie cookie : received) {
      if (cookie.persistent() && cookie.expiresAt() <= now) {
        cookies.remove(cookie.name());
      } else {
        cookies.put(cookie.name(), cookie.value());
      }
    }
  }

  @Override
  public synchronized List<Cookie> loadForRequest(HttpUrl url) {
    List<Cookie> result = new ArrayList<>(cookies.size());
    cookies.forEach((name, value) -> result.add(new Cookie.Builder()
        .name(name)
        .value(value)
        .domain(url.host())
        .path("/")
        .build()));
    return result;
  }

  public synchronized Map<String, String> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(cookies));
  }
}
