package com.example.portalsync.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UuidGenerator;

import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "course_entry", uniqueConstraints = {
    @UniqueConstraint(name = "uk_course_schedule_hash", columnNames = {"schedule_id", "content_hash"})
})
@Getter
@Setter
@NoArgsConstructor
public class CourseEntry {

  @Id
  @UuidGenerator
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "schedule_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private ScheduleRecord schedule;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "teacher", length = 255)
  private String teacher;

  @Column(name = "location", length = 255)
  private String location;

  @Column(name = "weekday", nullable = false)
  private int weekday;

  @Column(name = "start_slot", nullable = false)
  private int startSlot;

  @Column(name = "end_slot", nullable = false)
  private int endSlot;

  @Column(name = "week_range_label", length = 255)
  private String weekRangeLabel;

  @Convert(converter = WeekSetConverter.class)
  @Column(name = "weeks", length = 255)
  private List<Integer> weeks;

  @Column(name = "content_hash", nullable = false, length = 40)
  private String contentHash;
}
