package com.example.portalsync.domain.model;

import java.util.List;

/**
 * One logical course occurrence in the weekly grid.
 */
public record CourseView(
    String name,
    String teacher,
    String location,
    int weekday,
    int startSection,
    int endSection,
    String weekRange,
    List<Integer> weeks
) {}
