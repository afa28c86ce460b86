package com.example.portalsync.domain.model;

import java.util.List;

public record ScheduleView(
    String semester,
    Integer currentWeek,
    List<CourseView> courses
) {}
