package com.example.portalsync.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Centralized configuration properties for the portal sync service.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid PortalProperties portal,
    @NotNull @Valid SessionProperties session,
    @NotNull @Valid StoreProperties store,
    @NotNull @Valid RedisProperties redis,
    @NotNull @Valid CacheProperties cache,
    @NotNull @Valid SyncProperties sync,
    @NotNull @Valid ExtractorProperties extractor
) {

  /**
   * Upstream academic portal configuration
   */
  public record PortalProperties(
      @NotBlank String baseUrl,
      @DefaultValue("/jsxsd/xk/LoginToXk") @NotBlank String healthPath,
      @DefaultValue("/jsxsd/xk/LoginToXk") @NotBlank String loginPath,
      @DefaultValue("/jsxsd/grxx/xsxx") @NotBlank String profilePath,
      @DefaultValue("/jsxsd/kscj/cjcx_query") @NotBlank String semestersPath,
      @DefaultValue("/jsxsd/kscj/cjcx_list") @NotBlank String gradesPath,
      @DefaultValue("/jsxsd/xskb/xskb_list.do") @NotBlank String schedulePath,
      @NotBlank String userAgent,
      @DefaultValue("10s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
      @DefaultValue("20s") @DurationUnit(ChronoUnit.SECONDS) Duration readTimeout,
      @DefaultValue("false") boolean insecureSkipVerify,
      @NotNull @Valid MarkerProperties markers
  ) {
    /**
     * Substrings used to recognise the login page and the authenticated home frame.
     */
    public record MarkerProperties(
        @NotEmpty List<String> loginLocation,
        @NotEmpty List<String> loginPage,
        @NotEmpty List<String> home
    ) {}
  }

  /**
   * Local session lifetime. Absolute TTL is fixed at creation, idle TTL slides on each access.
   */
  public record SessionProperties(
      @DefaultValue("8h") Duration absoluteTtl,
      @DefaultValue("30m") Duration idleTtl
  ) {}

  /**
   * Backing store selection for sessions, hot cache and fetch locks
   */
  public record StoreProperties(
      @DefaultValue("redis") @Pattern(regexp = "redis|memory") String backend
  ) {
    public boolean isMemory() {
      return "memory".equalsIgnoreCase(backend);
    }
  }

  /**
   * Redis configuration
   */
  public record RedisProperties(
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @DefaultValue("0") @Min(0) int database,
      @DefaultValue("false") boolean ssl,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @NotNull @Valid PoolProperties pool
  ) {
    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("2") @PositiveOrZero int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait
    ) {}
  }

  /**
   * Hot cache TTLs per resource kind
   */
  public record CacheProperties(
      @DefaultValue("24h") Duration profileTtl,
      @DefaultValue("12h") Duration semestersTtl,
      @DefaultValue("6h") Duration gradesTtl,
      @DefaultValue("6h") Duration scheduleTtl,
      @DefaultValue("10000") @Positive int localMaxSize
  ) {}

  /**
   * Fetch orchestration tuning
   */
  public record SyncProperties(
      @DefaultValue("true") boolean singleFlight,
      @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration lockTtl,
      @DefaultValue("3s") @DurationUnit(ChronoUnit.SECONDS) Duration lockWait
  ) {}

  /**
   * HTML extraction engine selection
   */
  public record ExtractorProperties(
      @DefaultValue("auto") @Pattern(regexp = "auto|markup|regex") String scheduleEngine
  ) {}
}
