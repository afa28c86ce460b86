package com.example.portalsync.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * The upstream account a session belongs to. Owns snapshots, grades and schedules.
 */
@Entity
@Table(name = "academic_identity")
@Getter
@Setter
@NoArgsConstructor
public class AcademicIdentity {

  @Id
  @Column(name = "external_id", length = 64)
  private String externalId;

  @Column(name = "student_id", length = 64)
  private String studentId;

  @Column(name = "name", length = 128)
  private String name;

  @Column(name = "college", length = 255)
  private String college;

  @Column(name = "major", length = 255)
  private String major;

  @Column(name = "class_name", length = 255)
  private String className;

  @Column(name = "enrollment_year", length = 32)
  private String enrollmentYear;

  @Column(name = "study_level", length = 64)
  private String studyLevel;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  public AcademicIdentity(String externalId, Instant now) {
    this.externalId = externalId;
    this.createdAt = now;
    this.updatedAt = now;
  }
}
