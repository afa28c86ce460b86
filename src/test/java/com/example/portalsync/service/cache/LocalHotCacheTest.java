package com.example.portalsync.service.cache;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

class LocalHotCacheTest {

  private final AtomicLong nanos = new AtomicLong();
  private final LocalHotCache cache = new LocalHotCache(100, nanos::get);

  @Test
  void entryLivesForItsOwnTtl() {
    cache.put("academic:me:20210001", "{}", Duration.ofMinutes(5));
    cache.put("academic:grades:20210001:all", "{}", Duration.ofMinutes(1));

    advance(Duration.ofMinutes(2));

    assertThat(cache.get("academic:me:20210001")).contains("{}");
    assertThat(cache.get("academic:grades:20210001:all")).isEmpty();
  }

  @Test
  void readsDoNotExtendLifetime() {
    cache.put("k", "v", Duration.ofMinutes(2));

    advance(Duration.ofMinutes(1));
    assertThat(cache.get("k")).contains("v");
    advance(Duration.ofSeconds(61));

    assertThat(cache.get("k")).isEmpty();
  }

  @Test
  void overwriteResetsTtl() {
    cache.put("k", "v1", Duration.ofMinutes(1));
    advance(Duration.ofSeconds(50));
    cache.put("k", "v2", Duration.ofMinutes(1));
    advance(Duration.ofSeconds(50));

    assertThat(cache.get("k")).contains("v2");
  }

  @Test
  void evictRemovesEntry() {
    cache.put("k", "v", Duration.ofMinutes(1));

    cache.evict("k");

    assertThat(cache.get("k")).isEmpty();
  }

  private void advance(Duration duration) {
    nanos.addAndGet(duration.toNanos());
  }
}
