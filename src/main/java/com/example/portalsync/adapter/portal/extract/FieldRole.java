package com.example.portalsync.adapter.portal.extract;

import java.util.Locale;
import java.util.Optional;

/**
 * Meaning of a titled span inside a course fragment, keyed off its title attribute.
 */
enum FieldRole {
  TEACHER,
  WEEKS,
  ROOM;

  static Optional<FieldRole> fromTitle(String title) {
    if (title == null || title.isBlank()) {
      return Optional.empty();
    }
    String t = title.toLowerCase(Locale.ROOT);
    if (t.contains("老师") || t.contains("教师") || t.contains("teacher") || t.contains("instructor")) {
      return Optional.of(TEACHER);
    }
    if (t.contains("周次") || t.contains("week")) {
      return Optional.of(WEEKS);
    }
    if (t.contains("教室") || t.contains("地点") || t.contains("room")) {
      return Optional.of(ROOM);
    }
    return Optional.empty();
  }
}
