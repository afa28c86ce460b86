package com.example.portalsync.domain.model;

import java.util.List;

/**
 * Semester options offered by the upstream term selector, with the option it marks as selected.
 */
public record SemesterList(
    List<SemesterOption> semesters,
    String current
) {

  public static SemesterList empty() {
    return new SemesterList(List.of(), null);
  }
}
