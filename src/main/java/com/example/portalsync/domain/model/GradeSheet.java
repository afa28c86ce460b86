package com.example.portalsync.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Grade table as published upstream: ordered headers and one header-keyed map per row.
 */
public record GradeSheet(
    List<String> headers,
    List<Map<String, String>> rows
) {

  public static GradeSheet empty() {
    return new GradeSheet(List.of(), List.of());
  }
}
