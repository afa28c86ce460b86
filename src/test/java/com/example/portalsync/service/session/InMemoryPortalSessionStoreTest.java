package com.example.portalsync.service.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.portalsync.domain.model.PortalSession;
import com.example.portalsync.support.MutableClock;
import com.example.portalsync.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

class InMemoryPortalSessionStoreTest {

  private MutableClock clock;
  private InMemoryPortalSessionStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2025-03-01T08:00:00Z"));
    store = new InMemoryPortalSessionStore(clock, TestProperties.defaults());
  }

  @Test
  void createdSessionIsReadableWithItsCookies() {
    PortalSession created = store.create("20210001", Map.of("JSESSIONID", "abc"));

    assertThat(SessionIds.isWellFormed(created.sessionId())).isTrue();
    assertThat(created.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(30)));
    assertThat(store.get(created.sessionId()))
        .hasValueSatisfying(s -> {
          assertThat(s.account()).isEqualTo("20210001");
          assertThat(s.cookies()).containsEntry("JSESSIONID", "abc");
        });
  }

  @Test
  void idleSessionExpires() {
    PortalSession created = store.create("20210001", Map.of());

    clock.advance(Duration.ofMinutes(31));

    assertThat(store.get(created.sessionId())).isEmpty();
  }

  @Test
  void readsSlideTheIdleWindow() {
    PortalSession created = store.create("20210001", Map.of());

    clock.advance(Duration.ofMinutes(20));
    assertThat(store.get(created.sessionId())).isPresent();
    clock.advance(Duration.ofMinutes(20));

    assertThat(store.get(created.sessionId()))
        .hasValueSatisfying(s -> assertThat(s.idleExpiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(30))));
  }

  @Test
  void absoluteLifetimeWinsOverActivity() {
    PortalSession created = store.create("20210001", Map.of());

    for (int i = 0; i < 16; i++) {
      clock.advance(Duration.ofMinutes(29));
      store.get(created.sessionId());
    }
    clock.advance(Duration.ofMinutes(29));

    assertThat(store.get(created.sessionId())).isEmpty();
  }

  @Test
  void abandonedSessionsAreEvictedWithoutBeingRead() {
    for (int i = 0; i < 1000; i++) {
      store.create("2021" + i, Map.of());
    }
    assertThat(store.size()).isEqualTo(1000);

    clock.advance(Duration.ofDays(30));
    PortalSession fresh = store.create("20210001", Map.of());

    assertThat(store.size()).isEqualTo(1);
    assertThat(store.get(fresh.sessionId())).isPresent();
  }

  @Test
  void deletedSessionIsGone() {
    PortalSession created = store.create("20210001", Map.of());

    store.delete(created.sessionId());

    assertThat(store.get(created.sessionId())).isEmpty();
  }

  @Test
  void unknownOrMissingIdsResolveToNothing() {
    assertThat(store.get(null)).isEmpty();
    assertThat(store.get("nope")).isEmpty();
    store.delete(null);
  }
}
