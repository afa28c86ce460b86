package com.example.portalsync.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;

/**
 * Personal information scraped from the student record page. Every field is optional.
 */
public record ProfileView(
    String studentId,
    String name,
    String college,
    String major,
    String className,
    String enrollmentYear,
    String studyLevel,
    Map<String, String> fields
) {

  @JsonIgnore
  public boolean isEmpty() {
    return fields == null || fields.isEmpty();
  }
}
