package com.example.portalsync.adapter.portal.extract;

import com.example.portalsync.domain.model.CourseView;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collapses fragments that share name, weekday, slots, teacher and location into one
 * course whose weeks are the union of the fragments' weeks.
 */
public final class CourseMerger {

  private CourseMerger() {
  }

  static List<CourseView> merge(List<CourseFragment> fragments) {
    Map<MergeKey, Accumulator> groups = new LinkedHashMap<>();
    for (CourseFragment fragment : fragments) {
      MergeKey key = new MergeKey(
          fragment.name(),
          fragment.weekday(),
          fragment.startSection(),
          fragment.endSection(),
          fragment.teacher(),
          fragment.location());
      groups.computeIfAbsent(key, k -> new Accumulator()).add(fragment);
    }

    List<CourseView> courses = new ArrayList<>(groups.size());
    groups.forEach((key, acc) -> courses.add(new CourseView(
        key.name(),
        key.teacher(),
        key.location(),
        key.weekday(),
        key.startSection(),
        key.endSection(),
        acc.label(),
        new ArrayList<>(acc.weeks))));
    return courses;
  }

  private record MergeKey(String name, int weekday, int startSection, int endSection,
                          String teacher, String location) {}

  private static final class Accumulator {
    private final Set<String> labels = new LinkedHashSet<>();
    private final TreeSet<Integer> weeks = new TreeSet<>();

    void add(CourseFragment fragment) {
      if (fragment.weekRange() != null && !fragment.weekRange().isBlank()) {
        labels.add(fragment.weekRange());
      }
      weeks.addAll(WeekRangeParser.parse(fragment.weekRange()));
    }

    String label() {
      return labels.isEmpty() ? null : String.join(",", labels.stream().filter(Objects::nonNull).toList());
    }
  }
}
