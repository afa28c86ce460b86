package com.example.portalsync.domain.entity;

import jakarta.persistence.Column;
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
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Current timetable of one identity for one semester. Its course entries are replaced on every fetch.
 */
@Entity
@Table(name = "schedule_record", uniqueConstraints = {
    @UniqueConstraint(name = "uk_schedule_owner_scope", columnNames = {"external_id", "semester_scope"})
})
@Getter
@Setter
@NoArgsConstructor
public class ScheduleRecord {

  @Id
  @UuidGenerator
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "external_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private AcademicIdentity identity;

  @Column(name = "semester_scope", nullable = false, length = 64)
  private String semesterScope;

  @Column(name = "current_week")
  private Integer currentWeek;

  @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
  @Column(name = "raw_payload", nullable = false)
  private String rawPayload;

  @Column(name = "fetched_at", nullable = false)
  private Instant fetchedAt;
}
