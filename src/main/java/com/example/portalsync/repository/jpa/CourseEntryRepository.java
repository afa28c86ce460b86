package com.example.portalsync.repository.jpa;

import com.example.portalsync.domain.entity.CourseEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface CourseEntryRepository extends JpaRepository<CourseEntry, UUID> {

  List<CourseEntry> findByScheduleIdOrderByWeekdayAscStartSlotAsc(UUID scheduleId);

  long countByScheduleId(UUID scheduleId);

  /**
   * Runs as an immediate statement so the replacement inserts cannot be reordered ahead of it.
   */
  @Modifying(flushAutomatically = true)
  @Query("delete from CourseEntry c where c.schedule.id = :scheduleId")
  int deleteByScheduleId(@Param("scheduleId") UUID scheduleId);
}
