package com.example.portalsync.adapter.portal.extract;

import com.example.portalsync.domain.model.Extraction;
import com.example.portalsync.domain.model.ScheduleView;

/**
 * Turns a weekly timetable page into a {@link ScheduleView}.
 *
 * Implementations differ only in how they read markup. Row and column mapping, fragment
 * splitting, week decoding, merging and defaults are identical across engines.
 */
public interface ScheduleExtractor {

  Extraction<ScheduleView> extract(ScheduleRequest request);

  /**
   * Short engine name, for logs.
   */
  String engine();
}
