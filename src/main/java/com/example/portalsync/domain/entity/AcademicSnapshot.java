package com.example.portalsync.domain.entity;

import com.example.portalsync.domain.model.ResourceKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
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
 * Append-only copy of one successful extraction.
 */
@Entity
@Table(name = "academic_snapshot", indexes = {
    @Index(name = "idx_snapshot_owner_kind_scope_time", columnList = "external_id, kind, scope, fetched_at")
})
@Getter
@Setter
@NoArgsConstructor
public class AcademicSnapshot {

  @Id
  @UuidGenerator
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "external_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private AcademicIdentity identity;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, length = 32)
  private ResourceKind kind;

  @Column(name = "scope", nullable = false, length = 64)
  private String scope;

  @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
  @Column(name = "payload", nullable = false)
  private String payload;

  @Column(name = "fetched_at", nullable = false)
  private Instant fetchedAt;
}
