package com.example.portalsync.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ResourceKindTest {

  @Test
  void cacheKeysUseDefaultScopeLabels() {
    assertThat(ResourceKind.PROFILE.cacheKey("20210001", "")).isEqualTo("academic:me:20210001");
    assertThat(ResourceKind.GRADES.cacheKey("20210001", "")).isEqualTo("academic:grades:20210001:all");
    assertThat(ResourceKind.SCHEDULE.cacheKey("20210001", null)).isEqualTo("academic:schedule:20210001:current");
    assertThat(ResourceKind.GRADES.cacheKey("20210001", "2024-2025-1"))
        .isEqualTo("academic:grades:20210001:2024-2025-1");
    assertThat(ResourceKind.fromCode("ME")).contains(ResourceKind.PROFILE);
    assertThat(ResourceKind.fromCode("timetable")).isEmpty();
  }
}
