package com.example.portalsync.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

class ContentHasherTest {

  @Test
  void keyOrderDoesNotChangeHash() {
    Map<String, String> first = new LinkedHashMap<>();
    first.put("课程名称", "高等数学");
    first.put("成绩", "92");
    Map<String, String> second = new LinkedHashMap<>();
    second.put("成绩", "92");
    second.put("课程名称", "高等数学");

    assertThat(ContentHasher.hash(first)).isEqualTo(ContentHasher.hash(second));
    assertThat(ContentHasher.canonicalJson(second)).isEqualTo("{\"成绩\":\"92\",\"课程名称\":\"高等数学\"}");
  }

  @Test
  void valueChangeChangesHash() {
    assertThat(ContentHasher.hash(Map.of("成绩", "92"))).isNotEqualTo(ContentHasher.hash(Map.of("成绩", "93")));
  }

  @Test
  void hashIsHexSha1() {
    assertThat(ContentHasher.hash(Map.of())).hasSize(40).matches("[0-9a-f]+");
  }
}
