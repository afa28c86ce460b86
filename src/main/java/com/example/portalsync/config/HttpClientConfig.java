package com.example.portalsync.config;

import com.example.portalsync.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp client configuration for the upstream academic portal.
 *
 * Redirects are never followed: the login heuristic needs the raw 3xx status and Location header.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

  private static final int MAX_IDLE_CONNECTIONS = 20;
  private static final long KEEP_ALIVE_MINUTES = 5;
  private static final int MAX_REQUESTS = 64;
  private static final int MAX_REQUESTS_PER_HOST = 16;

  private final ApplicationProperties properties;

  /**
   * Shared connection pool to reduce connection establishment overhead
   */
  @Bean
  public ConnectionPool portalConnectionPool() {
    return new ConnectionPool(MAX_IDLE_CONNECTIONS, KEEP_ALIVE_MINUTES, TimeUnit.MINUTES);
  }

  @Bean
  public Dispatcher portalDispatcher() {
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(MAX_REQUESTS);
    dispatcher.setMaxRequestsPerHost(MAX_REQUESTS_PER_HOST);
    return dispatcher;
  }

  @Bean
  public OkHttpClient portalOkHttpClient(ConnectionPool portalConnectionPool, Dispatcher portalDispatcher) {
    return buildClient(properties.portal(), portalConnectionPool, portalDispatcher);
  }

  static OkHttpClient buildClient(ApplicationProperties.PortalProperties portal,
                                  ConnectionPool connectionPool,
                                  Dispatcher dispatcher) {
    OkHttpClient.Builder builder = new OkHttpClient.Builder()
        .connectionPool(connectionPool)
        .dispatcher(dispatcher)
        .connectTimeout(portal.connectTimeout())
        .readTimeout(portal.readTimeout())
        .writeTimeout(portal.readTimeout())
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .followSslRedirects(false);

    if (portal.insecureSkipVerify()) {
      log.warn("TLS certificate verification is DISABLED for {}", portal.baseUrl());
      trustEverything(builder);
    }
    return builder.build();
  }

  private static void trustEverything(OkHttpClient.Builder builder) {
    X509TrustManager trustAll = new X509TrustManager() {
      @Override
      public void checkClientTrusted(X509Certificate[] chain, String authType) {
      }

      @Override
      public void checkServerTrusted(X509Certificate[] chain, String authType) {
      }

      @Override
      public X509Certificate[] getAcceptedIssuers() {
        return new X509Certificate[0];
      }
    };
    try {
      SSLContext sslContext = SSLContext.getInstance("TLS");
      sslContext.init(null, new TrustManager[] {trustAll}, new SecureRandom());
      builder.sslSocketFactory(sslContext.getSocketFactory(), trustAll);
      builder.hostnameVerifier((hostname, session) -> true);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Cannot initialise permissive TLS context", e);
    }
  }
}
