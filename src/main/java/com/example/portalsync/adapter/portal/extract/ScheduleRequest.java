package com.example.portalsync.adapter.portal.extract;

/**
 * Input to a schedule extractor.
 *
 * @param html             raw timetable page
 * @param explicitSemester semester supplied by the caller, may be null
 * @param requestUrl       URL the page was fetched from, used as a last resort for the semester
 */
public record ScheduleRequest(String html, String explicitSemester, String requestUrl) {}
