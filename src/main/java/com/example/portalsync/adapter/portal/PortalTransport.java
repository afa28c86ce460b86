package com.example.portalsync.adapter.portal;

import com.example.portalsync.exception.UpstreamUnreachableException;
import com.example.portalsync.properties.ApplicationProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Low-level request executor against the upstream portal.
 * Fixed timeouts, no redirect following and the same headers on every call.
 */
@Slf4j
@Component
public class PortalTransport {

  private static final String ACCEPT =
      "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
  private static final String ACCEPT_LANGUAGE = "zh-CN,zh;q=0.9,en;q=0.8";
  private static final String REQUEST_ID_HEADER = "X-Request-ID";

  private final OkHttpClient portalOkHttpClient;
  private final ApplicationProperties.PortalProperties portal;
  private final HttpUrl baseUrl;

  public PortalTransport(OkHttpClient portalOkHttpClient, ApplicationProperties properties) {
    this.portalOkHttpClient = portalOkHttpClient;
    this.portal = properties.portal();
    this.baseUrl = HttpUrl.get(portal.baseUrl());
  }

  /**
   * Execute one request sharing the given cookie jar. Network errors and timeouts
   * surface as {@link UpstreamUnreachableException}.
   */
  @CircuitBreaker(name = "academicPortal", fallbackMethod = "executeFallback")
  public PortalResponse execute(PortalRequest portalRequest, SessionCookieJar cookieJar) {
    Request request = buildRequest(portalRequest);
    OkHttpClient client = portalOkHttpClient.newBuilder()
        .cookieJar(cookieJar)
        .build();

    try (Response response = client.newCall(request).execute()) {
      ResponseBody body = response.body();
      byte[] bytes = body == null ? new byte[0] : body.bytes();
      MediaType mediaType = body == null ? null : body.contentType();
      Charset charset = mediaType == null ? StandardCharsets.UTF_8 : mediaType.charset(StandardCharsets.UTF_8);

      log.debug("{} {} -> {}", request.method(), request.url().encodedPath(), response.code());
      return new PortalResponse(
          response.code(),
          request.url().toString(),
          response.header("Location"),
          new String(bytes, charset),
          response.header("Content-Type"),
          bytes.length
      );
    } catch (IOException e) {
      throw new UpstreamUnreachableException(
          "Upstream request failed: " + request.method() + " " + request.url().encodedPath(), e);
    }
  }

  public PortalResponse executeFallback(PortalRequest portalRequest, SessionCookieJar cookieJar, Throwable ex) {
    if (ex instanceof UpstreamUnreachableException unreachable) {
      throw unreachable;
    }
    log.warn("Academic portal circuit breaker rejected {}: {}", portalRequest.path(), ex.getMessage());
    throw new UpstreamUnreachableException("Academic portal is temporarily unavailable", ex);
  }

  public HttpUrl resolve(String path) {
    HttpUrl resolved = baseUrl.resolve(path);
    if (resolved == null) {
      throw new IllegalArgumentException("Cannot resolve portal path: " + path);
    }
    return resolved;
  }

  private Request buildRequest(PortalRequest portalRequest) {
    HttpUrl.Builder url = resolve(portalRequest.path()).newBuilder();
    portalRequest.query().forEach(url::addQueryParameter);

    Request.Builder builder = new Request.Builder()
        .url(url.build())
        .header("User-Agent", portal.userAgent())
        .header("Accept", ACCEPT)
        .header("Accept-Language", ACCEPT_LANGUAGE);

    if (portalRequest.requestId() != null && !portalRequest.requestId().isBlank()) {
      builder.header(REQUEST_ID_HEADER, portalRequest.requestId());
    }

    if (portalRequest.isPost()) {
      FormBody.Builder form = new FormBody.Builder(StandardCharsets.UTF_8);
      portalRequest.form().forEach(form::add);
      builder.post(form.build());
    } else {
      builder.get();
    }
    return builder.build();
  }
}
