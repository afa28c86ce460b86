package com.example.portalsync;

import com.example.portalsync.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Portal Sync Application
 *
 * Academic portal synchronization service with:
 * - Form login against the upstream academic system
 * - Redis-backed sessions bound to upstream cookies
 * - Hot cache, durable snapshots and live re-fetch with fallback
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class PortalSyncApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(PortalSyncApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
