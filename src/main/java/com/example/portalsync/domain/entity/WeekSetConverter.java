package com.example.portalsync.domain.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.List;

/**
 * Stores a week set as a sorted comma-separated list, e.g. {@code 1,3,5}.
 */
@Converter
public class WeekSetConverter implements AttributeConverter<List<Integer>, String> {

  @Override
  public String convertToDatabaseColumn(List<Integer> weeks) {
    if (weeks == null || weeks.isEmpty()) {
      return "";
    }
    return String.join(",", weeks.stream().sorted().distinct().map(String::valueOf).toList());
  }

  @Override
  public List<Integer> convertToEntityAttribute(String column) {
    if (column == null || column.isBlank()) {
      return List.of();
    }
    return Arrays.stream(column.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .map(Integer::valueOf)
        .toList();
  }
}
