package com.example.portalsync.adapter.portal.extract;

/**
 * A single course as read from one grid cell, before the merge pass.
 */
record CourseFragment(
    String name,
    String teacher,
    String location,
    int weekday,
    int startSection,
    int endSection,
    String weekRange
) {}
