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
 * One grade row. A corrected upstream row hashes differently and becomes a new record.
 */
@Entity
@Table(name = "grade_record", uniqueConstraints = {
    @UniqueConstraint(name = "uk_grade_owner_scope_hash", columnNames = {"external_id", "semester_scope", "content_hash"})
})
@Getter
@Setter
@NoArgsConstructor
public class GradeRecord {

  @Id
  @UuidGenerator
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "external_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private AcademicIdentity identity;

  @Column(name = "semester_scope", nullable = false, length = 64)
  private String semesterScope;

  @Column(name = "course_code", length = 64)
  private String courseCode;

  @Column(name = "course_name", length = 255)
  private String courseName;

  @Column(name = "credit", length = 32)
  private String credit;

  @Column(name = "score", length = 32)
  private String score;

  @Column(name = "grade_point", length = 32)
  private String gradePoint;

  @Column(name = "content_hash", nullable = false, length = 40)
  private String contentHash;

  @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
  @Column(name = "raw_payload", nullable = false)
  private String rawPayload;

  @Column(name = "fetched_at", nullable = false)
  private Instant fetchedAt;
}
